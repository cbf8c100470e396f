package com.mk.fx.qa.benchmark.execution.run;

import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import com.mk.fx.qa.benchmark.execution.verdict.RunningTotals;
import java.util.List;

/**
 * What a finished run produced.
 *
 * @param unitsPlanned units returned by the expansion
 * @param unitsFailed units that ended without a result
 * @param results result log, in execution order
 */
public record RunSummary(
    int unitsPlanned,
    int unitsFailed,
    RunningTotals totals,
    List<UnitResult> results,
    boolean cancelled) {

  public RunSummary {
    results = List.copyOf(results);
  }
}
