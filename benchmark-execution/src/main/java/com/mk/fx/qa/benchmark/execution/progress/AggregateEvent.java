package com.mk.fx.qa.benchmark.execution.progress;

import com.mk.fx.qa.benchmark.execution.verdict.RunningTotals;

/** Final totals of a run, emitted once when the run ends. */
public record AggregateEvent(
    int winsA,
    int winsB,
    int unitsCompleted,
    double averageDurationA,
    double averageDurationB,
    long totalPayloadA,
    long totalPayloadB,
    double averagePayloadA,
    double averagePayloadB,
    double successRate,
    boolean cancelled) {

  public static AggregateEvent of(RunningTotals totals, boolean cancelled) {
    return new AggregateEvent(
        totals.winsA(),
        totals.winsB(),
        totals.unitsCompleted(),
        totals.averageDurationA(),
        totals.averageDurationB(),
        totals.sumPayloadA(),
        totals.sumPayloadB(),
        totals.averagePayloadA(),
        totals.averagePayloadB(),
        totals.successRate(),
        cancelled);
  }
}
