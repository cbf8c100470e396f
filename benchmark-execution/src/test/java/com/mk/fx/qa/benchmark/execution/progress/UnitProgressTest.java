package com.mk.fx.qa.benchmark.execution.progress;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.benchmark.execution.compare.ComparisonReport;
import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import com.mk.fx.qa.benchmark.execution.support.RecordingProgressReporter;
import com.mk.fx.qa.benchmark.execution.trial.TrialMeasurement;
import com.mk.fx.qa.benchmark.execution.verdict.Winner;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class UnitProgressTest {

  private static final Instant NOW = Instant.parse("2026-01-05T10:15:30Z");

  private final RecordingProgressReporter reporter = new RecordingProgressReporter();
  private final UnitProgress progress =
      new UnitProgress(
          "perf-v1-100", "Perf - v1 (100 records)", reporter, Clock.fixed(NOW, ZoneOffset.UTC));

  private static UnitResult result() {
    var m = new TrialMeasurement(10, true, null, 0, List.of(10L), 1, null);
    return new UnitResult(
        "perf-v1-100", "Perf - v1 (100 records)", m, m, Winner.TIE, ComparisonReport.empty("x"),
        NOW);
  }

  @Test
  void running_dropsUpdatesThatDoNotIncrease() {
    progress.queued();
    progress.running(0);
    progress.running(16);
    progress.running(16);
    progress.running(10);
    progress.running(33);
    progress.running(150);

    assertThat(reporter.runningPercentsFor("perf-v1-100")).containsExactly(0, 16, 33, 100);
    assertThat(reporter.unitEvents().get(0).status()).isEqualTo(UnitStatus.QUEUED);
    assertThat(reporter.unitEvents().get(1).startedAt()).isEqualTo(NOW);
  }

  @Test
  void completed_isTerminalAndCarriesResult() {
    progress.running(50);
    progress.completed(result());
    progress.running(75);
    progress.failed("late");

    var events = reporter.unitEvents();
    assertThat(events).extracting(UnitStatusEvent::status)
        .containsExactly(UnitStatus.RUNNING, UnitStatus.COMPLETED);
    var last = events.get(1);
    assertThat(last.percent()).isEqualTo(100);
    assertThat(last.result()).isNotNull();
    assertThat(last.endedAt()).isEqualTo(NOW);
    assertThat(last.error()).isNull();
  }

  @Test
  void failed_keepsLastPercentAndMessage() {
    progress.running(25);
    progress.failed("HTTP 500");

    var last = reporter.unitEvents().get(1);
    assertThat(last.status()).isEqualTo(UnitStatus.FAILED);
    assertThat(last.percent()).isEqualTo(25);
    assertThat(last.error()).isEqualTo("HTTP 500");
    assertThat(last.result()).isNull();
    assertThat(last.status().isTerminal()).isTrue();
  }

  @Test
  void failed_beforeRunningStillHasTimestamps() {
    progress.failed("boom");

    var only = reporter.unitEvents().get(0);
    assertThat(only.percent()).isZero();
    assertThat(only.startedAt()).isEqualTo(NOW);
    assertThat(only.endedAt()).isEqualTo(NOW);
  }
}
