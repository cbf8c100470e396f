package com.mk.fx.qa.benchmark.execution.compare;

import java.util.List;

/** Comparison of one call of a composite scenario. */
public record TableComparison(
    String table,
    int recordCountA,
    int recordCountB,
    int dataConsistency,
    List<FieldMismatch> fieldMismatches,
    List<String> issues) {

  public TableComparison {
    fieldMismatches = List.copyOf(fieldMismatches);
    issues = List.copyOf(issues);
  }
}
