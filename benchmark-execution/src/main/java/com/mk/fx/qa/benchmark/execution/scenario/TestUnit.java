package com.mk.fx.qa.benchmark.execution.scenario;

/** One cell of the expanded test matrix. */
public record TestUnit(String category, String variant, int recordLimit) {

  public String unitId() {
    return category + "-" + variant + "-" + recordLimit;
  }

  public String displayName(String categoryTitle) {
    return categoryTitle + " - " + variant + " (" + recordLimit + " records)";
  }
}
