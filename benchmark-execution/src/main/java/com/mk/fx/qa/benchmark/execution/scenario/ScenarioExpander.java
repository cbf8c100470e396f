package com.mk.fx.qa.benchmark.execution.scenario;

import com.mk.fx.qa.benchmark.execution.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Expands a {@link TestConfiguration} into the ordered list of units to run: category, then
 * variant, then limit, with categories in library order.
 */
@Slf4j
public class ScenarioExpander {

  private final ScenarioLibrary library;

  public ScenarioExpander(ScenarioLibrary library) {
    this.library = Objects.requireNonNull(library, "library");
  }

  /**
   * @throws ConfigurationException if an enabled category has no limit to run or a limit is not
   *     positive
   */
  public List<TestUnit> expand(TestConfiguration configuration) {
    for (String key : configuration.categories().keySet()) {
      if (library.category(key).isEmpty()) {
        log.warn("Skipping unknown category '{}'", key);
      }
    }

    List<TestUnit> units = new ArrayList<>();
    for (ScenarioCategory category : library.categories()) {
      var config = configuration.categories().get(category.key());
      if (config == null || !config.enabled()) {
        continue;
      }
      var limits = resolveLimits(category.key(), config);
      var variants =
          config.selectedVariants() != null
              ? config.selectedVariants()
              : List.copyOf(category.variants().keySet());

      for (String variant : variants) {
        if (!category.variants().containsKey(variant)) {
          log.warn("Skipping unknown variant '{}' in category '{}'", variant, category.key());
          continue;
        }
        for (int limit : limits) {
          units.add(new TestUnit(category.key(), variant, limit));
        }
      }
    }
    log.info("Expanded configuration into {} units", units.size());
    return units;
  }

  private static List<Integer> resolveLimits(String categoryKey, CategoryConfig config) {
    List<Integer> limits;
    if (config.selectedLimits() != null) {
      limits = config.selectedLimits();
    } else {
      var recordLimit = config.parameters() == null ? null : config.parameters().recordLimit();
      if (recordLimit == null) {
        throw new ConfigurationException(
            "Category " + categoryKey + " has no selected limits and no default record limit");
      }
      limits = List.of(recordLimit);
    }
    for (Integer limit : limits) {
      if (limit == null || limit <= 0) {
        throw new ConfigurationException(
            "Category " + categoryKey + " has an invalid record limit: " + limit);
      }
    }
    return limits;
  }
}
