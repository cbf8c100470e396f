package com.mk.fx.qa.benchmark.execution.scenario;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named group of variants.
 *
 * @param variants variant key to scenario, in library order
 */
public record ScenarioCategory(
    String key, String title, String description, Map<String, ScenarioSpec> variants) {

  public ScenarioCategory {
    variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
  }
}
