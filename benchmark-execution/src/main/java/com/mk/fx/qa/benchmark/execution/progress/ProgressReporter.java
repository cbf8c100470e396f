package com.mk.fx.qa.benchmark.execution.progress;

/**
 * One-way sink for run progress. The run never reads anything back from a reporter, and
 * implementations must not throw for ordinary consumer problems.
 */
public interface ProgressReporter {

  void onUnitStatus(UnitStatusEvent event);

  /** Called exactly once per run, after the last unit event. */
  void onRunCompleted(AggregateEvent event);
}
