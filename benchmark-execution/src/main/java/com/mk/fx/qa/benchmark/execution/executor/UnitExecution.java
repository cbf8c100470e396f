package com.mk.fx.qa.benchmark.execution.executor;

import com.mk.fx.qa.benchmark.execution.auth.AuthSession;

/** A unit result together with the session to use for the next unit. */
public record UnitExecution(UnitResult result, AuthSession session) {}
