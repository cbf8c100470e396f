package com.mk.fx.qa.benchmark.execution.compare;

import java.util.List;

/**
 * Equivalence of the data returned by both styles.
 *
 * @param dataConsistency percentage of field comparisons that matched, rounded down so that any
 *     mismatch keeps it below 100
 * @param tables per-call breakdown, empty for single-resource scenarios
 * @param onlyKnownIssues true when every mismatch is a known representation difference
 */
public record ComparisonReport(
    boolean equivalent,
    boolean recordCountMatch,
    int dataConsistency,
    int recordCountA,
    int recordCountB,
    List<FieldMismatch> fieldMismatches,
    List<String> issues,
    List<TableComparison> tables,
    boolean onlyKnownIssues) {

  public ComparisonReport {
    fieldMismatches = List.copyOf(fieldMismatches);
    issues = List.copyOf(issues);
    tables = List.copyOf(tables);
  }

  /** Report used when the comparison itself could not be carried out. */
  public static ComparisonReport empty(String reason) {
    return new ComparisonReport(
        false, false, 0, 0, 0, List.of(), List.of(reason), List.of(), false);
  }
}
