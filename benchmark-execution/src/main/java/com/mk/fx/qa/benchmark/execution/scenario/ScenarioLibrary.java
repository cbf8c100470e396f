package com.mk.fx.qa.benchmark.execution.scenario;

import java.util.List;
import java.util.Optional;

/** Ordered, read-only catalogue of scenario categories. */
public class ScenarioLibrary {

  private final List<ScenarioCategory> categories;

  public ScenarioLibrary(List<ScenarioCategory> categories) {
    this.categories = List.copyOf(categories);
  }

  public List<ScenarioCategory> categories() {
    return categories;
  }

  public Optional<ScenarioCategory> category(String key) {
    return categories.stream().filter(c -> c.key().equals(key)).findFirst();
  }

  public Optional<ScenarioSpec> variant(String categoryKey, String variantKey) {
    return category(categoryKey).map(c -> c.variants().get(variantKey));
  }
}
