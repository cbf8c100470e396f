package com.mk.fx.qa.benchmark.execution.progress;

import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import java.time.Instant;

/**
 * A status transition or percentage update of one unit.
 *
 * @param percent completion of the unit, 0 to 100
 * @param endedAt set on terminal events only
 * @param error human-readable failure message, set on {@link UnitStatus#FAILED} only
 * @param result set on {@link UnitStatus#COMPLETED} only
 */
public record UnitStatusEvent(
    String unitId,
    String displayName,
    UnitStatus status,
    int percent,
    Instant startedAt,
    Instant endedAt,
    String error,
    UnitResult result) {}
