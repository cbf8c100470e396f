package com.mk.fx.qa.benchmark.execution.request;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Input checks shared by the request builders. Every method returns an empty list when valid. */
final class QueryValidator {

  static final int MIN_LIMIT = 1;
  static final int MAX_LIMIT = 10_000;
  static final int MAX_BATCHED_TABLES = 10;
  static final int MAX_COMPLEXITY = 500;

  private static final Pattern TABLE_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
  private static final Pattern FIELD_PATH =
      Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)*$");
  private static final List<Pattern> SUSPICIOUS_SQL =
      List.of("DROP", "DELETE", "UPDATE", "INSERT", "ALTER", "CREATE").stream()
          .map(word -> Pattern.compile("\\b" + word + "\\b", Pattern.CASE_INSENSITIVE))
          .toList();
  private static final Pattern JAVASCRIPT_EXPRESSION = Pattern.compile("javascript:[^;]+");
  private static final List<Pattern> DANGEROUS_JAVASCRIPT =
      List.of(
          "eval\\s*\\(",
          "Function\\s*\\(",
          "setTimeout\\s*\\(",
          "setInterval\\s*\\(",
          "XMLHttpRequest",
          "fetch\\s*\\(",
          "document\\.",
          "window\\.",
          "location\\.",
          "alert\\s*\\(",
          "confirm\\s*\\(",
          "prompt\\s*\\(")
          .stream()
          .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
          .toList();

  private QueryValidator() {
    // Utility class, no instantiation
  }

  static List<ValidationError> validateTable(String table) {
    List<ValidationError> errors = new ArrayList<>();
    if (table == null || table.isBlank()) {
      errors.add(new ValidationError("table", "Table name is required"));
    } else if (!TABLE_NAME.matcher(table).matches()) {
      errors.add(new ValidationError("table", "Invalid table name format", table));
    }
    return errors;
  }

  static List<ValidationError> validateFields(List<String> fields) {
    List<ValidationError> errors = new ArrayList<>();
    for (String field : fields) {
      if (field == null || field.isBlank()) {
        errors.add(new ValidationError("fields", "Field name cannot be empty"));
      } else if (!FIELD_PATH.matcher(field).matches()) {
        errors.add(new ValidationError("fields", "Invalid field name format", field));
      }
    }
    return errors;
  }

  static List<ValidationError> validateLimit(int limit) {
    if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
      return List.of(
          new ValidationError(
              "limit", "Limit must be an integer between " + MIN_LIMIT + " and " + MAX_LIMIT, limit));
    }
    return List.of();
  }

  static List<ValidationError> validateFilter(String filter) {
    List<ValidationError> errors = new ArrayList<>();
    if (filter == null || filter.isEmpty()) {
      return errors;
    }
    if (SUSPICIOUS_SQL.stream().anyMatch(p -> p.matcher(filter).find())) {
      errors.add(
          new ValidationError("filter", "Filter contains potentially malicious content", filter));
    }
    if (filter.contains("javascript:")) {
      if (!JAVASCRIPT_EXPRESSION.matcher(filter).find()) {
        errors.add(new ValidationError("filter", "Invalid JavaScript expression in filter", filter));
      }
      if (DANGEROUS_JAVASCRIPT.stream().anyMatch(p -> p.matcher(filter).find())) {
        errors.add(
            new ValidationError("filter", "Filter contains potentially dangerous JavaScript", filter));
      }
    } else if (filter.contains(";")) {
      errors.add(new ValidationError("filter", "Filter contains invalid characters", filter));
    }
    return errors;
  }

  /** Validates table, fields and filter of one query, prefixing error fields when asked. */
  static List<ValidationError> validateQuery(ResourceQuery query, String prefix) {
    List<ValidationError> errors = new ArrayList<>();
    validateTable(query.table()).forEach(e -> errors.add(prefixed(e, prefix)));
    validateFields(query.fields()).forEach(e -> errors.add(prefixed(e, prefix)));
    validateFilter(query.filter()).forEach(e -> errors.add(prefixed(e, prefix)));
    return errors;
  }

  /**
   * Relative cost of a batched query: 10 per table, 2 per field, 5 per dot-walked field and extra
   * weight for scripted or disjunctive filters.
   */
  static int complexityScore(List<ResourceQuery> queries) {
    int score = 0;
    for (ResourceQuery query : queries) {
      score += 10;
      score += query.fields().size() * 2;
      score += (int) query.fields().stream().filter(f -> f.contains(".")).count() * 5;
      String filter = query.filter();
      if (filter.contains("javascript:")) score += 15;
      if (filter.contains("^OR")) score += 10;
      if (filter.contains("^AND")) score += 5;
    }
    return score;
  }

  /** Removes characters that would break out of a quoted query string. */
  static String sanitize(String input) {
    if (input == null) {
      return "";
    }
    return input.replaceAll("[<>'\"&]", "");
  }

  private static ValidationError prefixed(ValidationError error, String prefix) {
    return prefix == null ? error : error.withField(prefix + "." + error.field());
  }
}
