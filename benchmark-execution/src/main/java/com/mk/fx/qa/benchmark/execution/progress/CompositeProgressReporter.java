package com.mk.fx.qa.benchmark.execution.progress;

import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Forwards every event to each delegate; a failing delegate does not stop the others. */
@Slf4j
public class CompositeProgressReporter implements ProgressReporter {

  private final List<ProgressReporter> delegates;

  public CompositeProgressReporter(List<ProgressReporter> delegates) {
    this.delegates = List.copyOf(delegates);
  }

  @Override
  public void onUnitStatus(UnitStatusEvent event) {
    for (ProgressReporter delegate : delegates) {
      try {
        delegate.onUnitStatus(event);
      } catch (RuntimeException e) {
        log.warn("Progress reporter {} failed on unit event: {}", name(delegate), e.getMessage());
      }
    }
  }

  @Override
  public void onRunCompleted(AggregateEvent event) {
    for (ProgressReporter delegate : delegates) {
      try {
        delegate.onRunCompleted(event);
      } catch (RuntimeException e) {
        log.warn("Progress reporter {} failed on run event: {}", name(delegate), e.getMessage());
      }
    }
  }

  private static String name(ProgressReporter reporter) {
    return reporter.getClass().getSimpleName();
  }
}
