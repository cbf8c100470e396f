package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

/** One finished run in the recent history. */
public record RunHistoryEntry(
    UUID runId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    long processingTimeMillis,
    int unitsCompleted,
    int winsA,
    int winsB,
    String errorMessage) {}
