package com.mk.fx.qa.benchmark.execution.progress;

public enum UnitStatus {
  QUEUED,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
