package com.mk.fx.qa.benchmark.execution.trial;

import com.mk.fx.qa.benchmark.execution.request.RequestDescriptor;

/** Supplies the descriptor for the next attempt. Called once before every attempt. */
@FunctionalInterface
public interface RequestSource {

  RequestDescriptor next();
}
