package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import java.util.UUID;

public record RunSubmissionResponse(UUID runId, RunStatus status, String message) {}
