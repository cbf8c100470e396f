package com.mk.fx.qa.benchmark.execution.progress;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingProgressReporter implements ProgressReporter {

  @Override
  public void onUnitStatus(UnitStatusEvent event) {
    switch (event.status()) {
      case QUEUED -> log.debug("Unit {} queued", event.unitId());
      case RUNNING -> log.debug("Unit {} running {}%", event.unitId(), event.percent());
      case COMPLETED -> {
        var result = event.result();
        log.info(
            "Unit {} completed: winner={} A={}ms B={}ms",
            event.unitId(),
            result == null ? null : result.winner(),
            result == null ? null : result.styleA().durationMs(),
            result == null ? null : result.styleB().durationMs());
      }
      case FAILED -> log.warn("Unit {} failed: {}", event.unitId(), event.error());
    }
  }

  @Override
  public void onRunCompleted(AggregateEvent event) {
    log.info(
        "Run {}: units={} winsA={} winsB={} avgA={}ms avgB={}ms successRate={}%",
        event.cancelled() ? "cancelled" : "completed",
        event.unitsCompleted(),
        event.winsA(),
        event.winsB(),
        String.format("%.1f", event.averageDurationA()),
        String.format("%.1f", event.averageDurationB()),
        String.format("%.1f", event.successRate()));
  }
}
