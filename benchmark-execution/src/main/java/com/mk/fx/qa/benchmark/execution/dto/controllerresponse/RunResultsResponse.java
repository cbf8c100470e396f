package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import com.mk.fx.qa.benchmark.execution.progress.AggregateEvent;
import java.util.List;
import java.util.UUID;

/** Completed unit results of a run so far and the totals folded from them. */
public record RunResultsResponse(
    UUID runId, RunStatus status, List<UnitResult> results, AggregateEvent totals) {}
