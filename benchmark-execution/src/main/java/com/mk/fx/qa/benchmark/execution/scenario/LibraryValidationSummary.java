package com.mk.fx.qa.benchmark.execution.scenario;

import java.util.List;

/** Result of checking the composite scenarios of a library. */
public record LibraryValidationSummary(
    Status status,
    int totalComposites,
    int validComposites,
    int failedComposites,
    int highComplexityComposites,
    List<ScenarioLibraryValidator.CompositeCheck> checks) {

  public enum Status {
    READY,
    WARNING,
    FAILED
  }
}
