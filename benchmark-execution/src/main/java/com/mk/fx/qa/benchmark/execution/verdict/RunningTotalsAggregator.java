package com.mk.fx.qa.benchmark.execution.verdict;

import com.mk.fx.qa.benchmark.execution.executor.UnitResult;

/** Folds unit results into running totals. */
public final class RunningTotalsAggregator {

  private RunningTotalsAggregator() {
    // Utility class, no instantiation
  }

  /**
   * Returns {@code totals} advanced by {@code result}. Not idempotent: folding the same result
   * twice counts it twice.
   */
  public static RunningTotals fold(UnitResult result, RunningTotals totals) {
    var a = result.styleA();
    var b = result.styleB();
    return new RunningTotals(
        totals.unitsCompleted() + 1,
        totals.winsA() + (result.winner() == Winner.A ? 1 : 0),
        totals.winsB() + (result.winner() == Winner.B ? 1 : 0),
        totals.sumDurationA() + a.durationMs(),
        totals.sumDurationB() + b.durationMs(),
        totals.sumPayloadA() + a.payloadSizeBytes(),
        totals.sumPayloadB() + b.payloadSizeBytes());
  }
}
