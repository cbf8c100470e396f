package com.mk.fx.qa.benchmark.execution.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Which categories a run covers, keyed by category key. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestConfiguration(Map<String, CategoryConfig> categories) {

  public TestConfiguration {
    categories =
        categories == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
  }
}
