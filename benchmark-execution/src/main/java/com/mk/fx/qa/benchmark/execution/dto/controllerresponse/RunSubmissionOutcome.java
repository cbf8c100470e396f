package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import java.util.UUID;

/** Outcome of handing a run to the service, as seen at submission time. */
public record RunSubmissionOutcome(UUID runId, RunStatus status, String message) {}
