package com.mk.fx.qa.benchmark.execution.compare;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares a Table API result set ({@code {"result": [...]}}) with a {@code GlideRecord_Query}
 * result set ({@code {"data": {"GlideRecord_Query": {"<table>": {"_results": [...]}}}}}).
 *
 * <p>Both sides are sorted by {@code sys_id} and compared position by position on the expected
 * fields. Values are trimmed and blank strings are treated as null. Structured values are read
 * from their {@code value} member, and dot-walked paths are followed through {@code _reference}.
 * A Table API reference object ({@code {link, value}}) whose value equals the structured value is
 * counted as a match and reported as a warning.
 */
@Slf4j
public class RecordSetComparator implements ResponseComparator {

  static final int MAX_MISMATCHES = 100;
  static final int MAX_MISMATCHES_PER_TABLE = 50;

  private static final String SORT_FIELD = "sys_id";

  @Override
  public ComparisonReport compare(
      JsonNode bodyA, JsonNode bodyB, String table, List<String> fields) {
    var recordsA = directRecords(bodyA);
    var recordsB = structuredRecords(queryRoot(bodyB), table);
    var countMatch = recordsA.size() == recordsB.size();

    List<String> issues = new ArrayList<>();
    if (!countMatch) {
      issues.add(
          "Record count mismatch: style A returned "
              + recordsA.size()
              + ", style B returned "
              + recordsB.size());
    }
    if (recordsA.isEmpty() && recordsB.isEmpty()) {
      return new ComparisonReport(true, true, 100, 0, 0, List.of(), List.of(), List.of(), false);
    }

    var tally = compareRecords(recordsA, recordsB, fields, MAX_MISMATCHES);
    var consistency = tally.consistency();
    var equivalent = countMatch && tally.mismatches.isEmpty() && consistency == 100;
    describe(tally, consistency, issues, "");

    return new ComparisonReport(
        equivalent,
        countMatch,
        consistency,
        recordsA.size(),
        recordsB.size(),
        tally.mismatches,
        issues,
        List.of(),
        tally.onlyWarnings());
  }

  @Override
  public ComparisonReport compareComposite(
      List<JsonNode> bodiesA, JsonNode bodyB, List<ResourceQuery> calls) {
    if (bodiesA.size() != calls.size()) {
      return ComparisonReport.empty(
          "Mismatch between style A responses ("
              + bodiesA.size()
              + ") and calls ("
              + calls.size()
              + ")");
    }

    var root = queryRoot(bodyB);
    List<String> issues = new ArrayList<>();
    List<FieldMismatch> allMismatches = new ArrayList<>();
    List<TableComparison> tables = new ArrayList<>();
    Set<String> seenTables = new HashSet<>();
    var total = new Tally();
    var totalA = 0;
    var totalB = 0;

    for (int i = 0; i < calls.size(); i++) {
      var call = calls.get(i);
      var identifier = call.table() + "_" + i;
      var recordsA = directRecords(bodiesA.get(i));
      var recordsB = structuredRecords(root, call.table());
      totalA += recordsA.size();
      totalB += recordsB.size();

      List<String> tableIssues = new ArrayList<>();
      if (!seenTables.add(call.table())) {
        tableIssues.add(
            "Table " + call.table() + " appears multiple times in query, results may be combined");
      }

      int consistency;
      List<FieldMismatch> mismatches;
      if (recordsA.isEmpty() && recordsB.isEmpty()) {
        consistency = 100;
        mismatches = List.of();
      } else {
        var tally = compareRecords(recordsA, recordsB, call.fields(), MAX_MISMATCHES_PER_TABLE);
        total.add(tally);
        consistency = tally.consistency();
        mismatches = tally.mismatches;
      }
      allMismatches.addAll(mismatches);
      tables.add(
          new TableComparison(
              identifier, recordsA.size(), recordsB.size(), consistency, mismatches, tableIssues));
      if (!tableIssues.isEmpty()) {
        issues.add("Table " + identifier + ": " + String.join(", ", tableIssues));
      }
    }

    var countMatch = totalA == totalB;
    if (!countMatch) {
      issues.add(
          "Overall record count mismatch: style A returned "
              + totalA
              + ", style B returned "
              + totalB);
    }
    total.mismatches.clear();
    total.mismatches.addAll(allMismatches);
    var consistency = total.consistency();
    describe(total, consistency, issues, " across all tables");

    return new ComparisonReport(
        countMatch && allMismatches.isEmpty() && consistency == 100,
        countMatch,
        consistency,
        totalA,
        totalB,
        allMismatches,
        issues,
        tables,
        total.onlyWarnings());
  }

  private static void describe(Tally tally, int consistency, List<String> issues, String scope) {
    if (consistency < 100) {
      issues.add(
          "Data consistency"
              + scope
              + ": "
              + consistency
              + "% ("
              + tally.matching
              + "/"
              + tally.comparisons
              + " field comparisons matched)");
    }
    var warnings = tally.mismatches.stream().filter(FieldMismatch::warning).count();
    var errors = tally.mismatches.size() - warnings;
    if (errors > 0) {
      issues.add(errors + " field mismatches found" + scope);
    }
    if (warnings > 0) {
      issues.add(warnings + " reference field format differences (known issue)" + scope);
    }
  }

  private static Tally compareRecords(
      List<JsonNode> recordsA, List<JsonNode> recordsB, List<String> fields, int maxMismatches) {
    var sortedA = sortBy(recordsA, r -> r.path(SORT_FIELD).asText(""));
    var sortedB =
        sortBy(
            recordsB,
            r -> {
              var id = normalize(structuredValue(r, SORT_FIELD));
              return id == null ? "" : id.asText("");
            });

    var tally = new Tally();
    var shared = Math.min(sortedA.size(), sortedB.size());
    for (int i = 0; i < shared; i++) {
      var recordA = sortedA.get(i);
      var recordB = sortedB.get(i);
      for (String field : fields) {
        tally.comparisons++;
        // the Table API returns dot-walked values under the full dotted key
        var valueA = normalize(recordA.get(field));
        var valueB = normalize(structuredValue(recordB, field));
        if (Objects.equals(valueA, valueB)) {
          tally.matching++;
          continue;
        }
        var knownDifference = isReferenceFormatDifference(valueA, valueB);
        if (knownDifference) {
          tally.matching++;
        }
        if (tally.mismatches.size() < maxMismatches) {
          tally.mismatches.add(new FieldMismatch(i, field, valueA, valueB, knownDifference));
        }
      }
    }
    return tally;
  }

  private static List<JsonNode> sortBy(List<JsonNode> records, Function<JsonNode, String> key) {
    List<JsonNode> sorted = new ArrayList<>(records);
    sorted.sort(Comparator.comparing(key));
    return sorted;
  }

  private static List<JsonNode> directRecords(JsonNode body) {
    if (body == null) {
      return List.of();
    }
    var result = body.path("result");
    if (result.isArray()) {
      return toList(result);
    }
    return body.isArray() ? toList(body) : List.of();
  }

  private static JsonNode queryRoot(JsonNode body) {
    return body == null ? null : body.path("data").path("GlideRecord_Query");
  }

  private static List<JsonNode> structuredRecords(JsonNode queryRoot, String table) {
    if (queryRoot == null || table == null) {
      return List.of();
    }
    var results = queryRoot.path(table).path("_results");
    return results.isArray() ? toList(results) : List.of();
  }

  private static List<JsonNode> toList(JsonNode array) {
    List<JsonNode> records = new ArrayList<>(array.size());
    array.forEach(records::add);
    return records;
  }

  /** Value of {@code path} in a structured record, following {@code _reference} per segment. */
  static JsonNode structuredValue(JsonNode record, String path) {
    var parts = path.split("\\.");
    var current = record;
    for (int i = 0; i < parts.length; i++) {
      if (current == null || !current.isObject()) {
        return null;
      }
      var node = current.get(parts[i]);
      if (i == parts.length - 1) {
        return leafValue(node);
      }
      if (node == null || !node.has("_reference")) {
        return null;
      }
      current = node.get("_reference");
    }
    return null;
  }

  private static JsonNode leafValue(JsonNode field) {
    if (field == null || !field.isObject()) {
      return null;
    }
    return field.has("value") ? field.get("value") : field.get("displayValue");
  }

  static JsonNode normalize(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isTextual()) {
      var trimmed = value.asText().trim();
      return trimmed.isEmpty() ? null : TextNode.valueOf(trimmed);
    }
    return value;
  }

  private static boolean isReferenceFormatDifference(JsonNode valueA, JsonNode valueB) {
    if (valueA == null || valueB == null || !valueA.isObject() || !valueB.isTextual()) {
      return false;
    }
    var link = valueA.path("link");
    var value = valueA.path("value");
    return link.isTextual()
        && !link.asText().isEmpty()
        && value.isTextual()
        && !value.asText().isEmpty()
        && value.asText().equals(valueB.asText());
  }

  private static final class Tally {
    private int comparisons;
    private int matching;
    private final List<FieldMismatch> mismatches = new ArrayList<>();

    void add(Tally other) {
      comparisons += other.comparisons;
      matching += other.matching;
    }

    int consistency() {
      if (comparisons == 0) {
        return 0;
      }
      if (mismatches.isEmpty()) {
        return 100;
      }
      return (int) Math.floor(matching * 100.0 / comparisons);
    }

    boolean onlyWarnings() {
      return !mismatches.isEmpty() && mismatches.stream().allMatch(FieldMismatch::warning);
    }
  }
}
