package com.mk.fx.qa.benchmark.execution.scenario;

import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import java.util.List;
import java.util.Objects;

public record SingleResourceScenario(
    String description, ResourceQuery query, List<Integer> recordLimits) implements ScenarioSpec {

  public SingleResourceScenario {
    Objects.requireNonNull(query, "query");
    recordLimits = recordLimits == null ? List.of() : List.copyOf(recordLimits);
  }

  @Override
  public ScenarioKind kind() {
    return ScenarioKind.SINGLE_RESOURCE;
  }
}
