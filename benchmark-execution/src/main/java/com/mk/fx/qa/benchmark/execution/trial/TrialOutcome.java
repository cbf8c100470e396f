package com.mk.fx.qa.benchmark.execution.trial;

import com.mk.fx.qa.benchmark.execution.auth.AuthSession;

/** A measurement together with the session that subsequent calls must use. */
public record TrialOutcome(TrialMeasurement measurement, AuthSession session) {}
