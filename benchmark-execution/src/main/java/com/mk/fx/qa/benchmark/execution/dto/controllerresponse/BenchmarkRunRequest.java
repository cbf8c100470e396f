package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.benchmark.execution.scenario.CategoryConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.Map;
import lombok.Data;

/**
 * Request to start a benchmark run. {@code categories} selects the matrix per category key;
 * {@code iterations} optionally overrides the configured attempts per single-resource trial.
 */
@Data
public class BenchmarkRunRequest {

  @NotEmpty
  @JsonProperty("categories")
  private Map<String, CategoryConfig> categories;

  @Min(1)
  @JsonProperty("iterations")
  private Integer iterations;
}
