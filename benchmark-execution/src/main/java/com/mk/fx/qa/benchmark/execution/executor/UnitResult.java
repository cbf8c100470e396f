package com.mk.fx.qa.benchmark.execution.executor;

import com.mk.fx.qa.benchmark.execution.compare.ComparisonReport;
import com.mk.fx.qa.benchmark.execution.trial.TrialMeasurement;
import com.mk.fx.qa.benchmark.execution.verdict.Winner;
import java.time.Instant;

/** Outcome of one executed unit. Style A is the direct fetch, style B the structured query. */
public record UnitResult(
    String unitId,
    String displayName,
    TrialMeasurement styleA,
    TrialMeasurement styleB,
    Winner winner,
    ComparisonReport comparisonReport,
    Instant timestamp) {}
