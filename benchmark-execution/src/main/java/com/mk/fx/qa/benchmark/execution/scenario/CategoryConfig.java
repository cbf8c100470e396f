package com.mk.fx.qa.benchmark.execution.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Per-category run selection.
 *
 * @param selectedVariants variants to run; {@code null} means every variant of the category
 * @param selectedLimits limits to run; {@code null} means {@code parameters.recordLimit} only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CategoryConfig(
    boolean enabled,
    List<String> selectedVariants,
    List<Integer> selectedLimits,
    Parameters parameters) {

  public static CategoryConfig enabledWithLimit(int recordLimit) {
    return new CategoryConfig(true, null, null, new Parameters(recordLimit));
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Parameters(Integer recordLimit) {}
}
