package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import com.mk.fx.qa.benchmark.execution.progress.AggregateEvent;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Status of a run with the latest state of each of its units. {@code totals} is present once the
 * run has ended.
 */
public record RunStatusResponse(
    UUID runId,
    RunStatus status,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    long processingTimeMillis,
    String errorMessage,
    int unitsPlanned,
    int unitsCompleted,
    int unitsFailed,
    List<UnitStatusView> units,
    AggregateEvent totals) {}
