package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

public record HealthResponse(String status) {}
