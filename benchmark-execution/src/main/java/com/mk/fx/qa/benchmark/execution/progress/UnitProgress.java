package com.mk.fx.qa.benchmark.execution.progress;

import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import java.time.Clock;
import java.time.Instant;

/**
 * Emits the events of a single unit. RUNNING updates that do not raise the percentage are dropped
 * and nothing is emitted after the terminal event.
 */
public class UnitProgress {

  private final String unitId;
  private final String displayName;
  private final ProgressReporter reporter;
  private final Clock clock;

  private Instant startedAt;
  private int lastPercent = -1;
  private boolean finished;

  public UnitProgress(String unitId, String displayName, ProgressReporter reporter, Clock clock) {
    this.unitId = unitId;
    this.displayName = displayName;
    this.reporter = reporter;
    this.clock = clock;
  }

  public String unitId() {
    return unitId;
  }

  public String displayName() {
    return displayName;
  }

  public void queued() {
    reporter.onUnitStatus(
        new UnitStatusEvent(unitId, displayName, UnitStatus.QUEUED, 0, null, null, null, null));
  }

  public void running(int percent) {
    if (finished) {
      return;
    }
    if (startedAt == null) {
      startedAt = clock.instant();
    }
    var bounded = Math.max(0, Math.min(100, percent));
    if (bounded <= lastPercent) {
      return;
    }
    lastPercent = bounded;
    reporter.onUnitStatus(
        new UnitStatusEvent(
            unitId, displayName, UnitStatus.RUNNING, bounded, startedAt, null, null, null));
  }

  public void completed(UnitResult result) {
    finish(UnitStatus.COMPLETED, 100, null, result);
  }

  public void failed(String error) {
    finish(UnitStatus.FAILED, Math.max(lastPercent, 0), error, null);
  }

  private void finish(UnitStatus status, int percent, String error, UnitResult result) {
    if (finished) {
      return;
    }
    finished = true;
    var now = clock.instant();
    reporter.onUnitStatus(
        new UnitStatusEvent(
            unitId,
            displayName,
            status,
            percent,
            startedAt == null ? now : startedAt,
            now,
            error,
            result));
  }
}
