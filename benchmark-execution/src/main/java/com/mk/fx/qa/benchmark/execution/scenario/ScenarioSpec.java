package com.mk.fx.qa.benchmark.execution.scenario;

import java.util.List;

/** A variant of the scenario library. Implementations are matched on {@link #kind()}. */
public sealed interface ScenarioSpec permits SingleResourceScenario, CompositeScenario {

  ScenarioKind kind();

  String description();

  /** Record limits the scenario was designed for; informational only. */
  List<Integer> recordLimits();
}
