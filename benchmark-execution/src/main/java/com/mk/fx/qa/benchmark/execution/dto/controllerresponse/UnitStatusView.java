package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.progress.UnitStatus;
import java.time.Instant;

/** Latest state of one unit without its measurement payload. */
public record UnitStatusView(
    String unitId,
    String displayName,
    UnitStatus status,
    int percent,
    Instant startedAt,
    Instant endedAt,
    String error) {}
