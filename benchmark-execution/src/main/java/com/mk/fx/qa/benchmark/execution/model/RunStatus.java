package com.mk.fx.qa.benchmark.execution.model;

/** Lifecycle of a submitted benchmark run. */
public enum RunStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  ERROR,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR || this == CANCELLED;
  }
}
