package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.scenario.ScenarioKind;
import java.util.List;

/** A category of the scenario library as offered to clients building a run request. */
public record ScenarioCatalogEntry(
    String key, String title, String description, List<Variant> variants) {

  public record Variant(
      String key,
      ScenarioKind kind,
      String description,
      List<String> tables,
      List<Integer> recordLimits) {}
}
