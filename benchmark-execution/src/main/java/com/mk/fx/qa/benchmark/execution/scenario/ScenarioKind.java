package com.mk.fx.qa.benchmark.execution.scenario;

/** Execution shape of a scenario. */
public enum ScenarioKind {
  /** One table, fetched directly by style A and with a single structured query by style B. */
  SINGLE_RESOURCE,
  /** Several tables, fetched by sequential direct calls versus one batched structured query. */
  COMPOSITE
}
