package com.mk.fx.qa.benchmark.execution.request;

import com.mk.fx.qa.benchmark.rest.HttpMethod;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds Table API fetches (style A) and {@code GlideRecord_Query} GraphQL queries (style B).
 *
 * <p>Both shapes always request {@code sys_id} and order by it, so the two result sets line up
 * record by record when compared.
 */
public class TableApiRequestBuilder implements RequestBuilder {

  public static final String TABLE_API_PATH = "api/now/table/";
  public static final String GRAPHQL_PATH = "api/now/graphql";
  static final String SORT_FIELD = "sys_id";

  private static final Map<String, String> JSON_HEADERS = Map.of("Accept", "application/json");

  @Override
  public RequestDescriptor directFetch(ResourceQuery query, int limit) {
    List<ValidationError> errors = new ArrayList<>(QueryValidator.validateQuery(query, null));
    errors.addAll(QueryValidator.validateLimit(limit));
    if (!errors.isEmpty()) {
      return RequestDescriptor.invalid(errors);
    }

    var table = QueryValidator.sanitize(query.table());
    var fields = withSortField(query.fields());

    var target =
        TABLE_API_PATH
            + encode(table)
            + "?sysparm_fields="
            + String.join(",", fields)
            + "&sysparm_limit="
            + limit
            + "&sysparm_query="
            + encode(orderedConditions(query.filter()));
    return new RequestDescriptor(HttpMethod.GET, target, JSON_HEADERS, null, List.of());
  }

  @Override
  public RequestDescriptor structuredQuery(ResourceQuery query, int limit) {
    List<ValidationError> errors = new ArrayList<>(QueryValidator.validateQuery(query, null));
    errors.addAll(QueryValidator.validateLimit(limit));
    if (!errors.isEmpty()) {
      return RequestDescriptor.invalid(errors);
    }
    return graphqlDescriptor(wrapQuery(tableSelection(query, limit)));
  }

  @Override
  public RequestDescriptor structuredBatchQuery(List<ResourceQuery> queries, int limit) {
    List<ValidationError> errors = new ArrayList<>(validateComposite(queries));
    errors.addAll(QueryValidator.validateLimit(limit));
    if (!errors.isEmpty()) {
      return RequestDescriptor.invalid(errors);
    }
    var selections = new StringBuilder();
    for (ResourceQuery query : queries) {
      selections.append(tableSelection(query, limit));
    }
    return graphqlDescriptor(wrapQuery(selections.toString()));
  }

  @Override
  public List<ValidationError> validateComposite(List<ResourceQuery> queries) {
    if (queries == null || queries.isEmpty()) {
      return List.of(new ValidationError("calls", "At least one REST call is required"));
    }
    if (queries.size() > QueryValidator.MAX_BATCHED_TABLES) {
      return List.of(
          new ValidationError(
              "calls",
              "Maximum " + QueryValidator.MAX_BATCHED_TABLES + " tables allowed in multi-table query",
              queries.size()));
    }
    var complexity = QueryValidator.complexityScore(queries);
    if (complexity > QueryValidator.MAX_COMPLEXITY) {
      return List.of(
          new ValidationError(
              "calls",
              "Query complexity ("
                  + complexity
                  + ") exceeds maximum ("
                  + QueryValidator.MAX_COMPLEXITY
                  + ")",
              complexity));
    }
    List<ValidationError> errors = new ArrayList<>();
    for (int i = 0; i < queries.size(); i++) {
      errors.addAll(QueryValidator.validateQuery(queries.get(i), "calls[" + i + "]"));
    }
    return errors;
  }

  @Override
  public int complexityScore(List<ResourceQuery> queries) {
    return QueryValidator.complexityScore(queries);
  }

  private static String wrapQuery(String selections) {
    return "query {\n    GlideRecord_Query {\n" + selections + "    }\n  }";
  }

  private RequestDescriptor graphqlDescriptor(String graphql) {
    return new RequestDescriptor(
        HttpMethod.POST, GRAPHQL_PATH, JSON_HEADERS, Map.of("query", graphql), List.of());
  }

  private String tableSelection(ResourceQuery query, int limit) {
    var table = QueryValidator.sanitize(query.table());
    var conditions = orderedConditions(query.filter()).replace("\\", "\\\\").replace("\"", "\\\"");
    var selection = new StringBuilder();
    selection
        .append("      ")
        .append(table)
        .append("(queryConditions: \"")
        .append(conditions)
        .append("\", pagination: { limit: ")
        .append(limit)
        .append(" }) {\n")
        .append("        _results {\n");
    appendFields(selection, toFieldTree(withSortField(query.fields())), 10);
    selection.append("        }\n").append("      }\n");
    return selection.toString();
  }

  /** Turns {@code a.b.c} paths into nested maps; a null value marks a leaf. */
  private static Map<String, Object> toFieldTree(List<String> fields) {
    Map<String, Object> root = new LinkedHashMap<>();
    for (String field : fields) {
      var parts = field.split("\\.");
      Map<String, Object> current = root;
      for (int i = 0; i < parts.length; i++) {
        if (i == parts.length - 1) {
          current.putIfAbsent(parts[i], null);
        } else {
          // a leaf requested earlier under the same name (null value) is upgraded to a reference
          @SuppressWarnings("unchecked")
          var next =
              (Map<String, Object>) current.computeIfAbsent(parts[i], k -> new LinkedHashMap<>());
          current = next;
        }
      }
    }
    return root;
  }

  @SuppressWarnings("unchecked")
  private static void appendFields(StringBuilder out, Map<String, Object> tree, int indent) {
    var spaces = " ".repeat(indent);
    for (var entry : tree.entrySet()) {
      if (entry.getValue() == null) {
        out.append(spaces).append(entry.getKey()).append(" {\n");
        out.append(spaces).append("  value, displayValue\n");
        out.append(spaces).append("}\n");
      } else {
        out.append(spaces).append(entry.getKey()).append(" {\n");
        out.append(spaces).append("  _reference {\n");
        appendFields(out, (Map<String, Object>) entry.getValue(), indent + 4);
        out.append(spaces).append("  }\n");
        out.append(spaces).append("}\n");
      }
    }
  }

  private static List<String> withSortField(List<String> fields) {
    Set<String> ordered = new LinkedHashSet<>();
    fields.forEach(f -> ordered.add(QueryValidator.sanitize(f)));
    ordered.add(SORT_FIELD);
    return List.copyOf(ordered);
  }

  private static String orderedConditions(String filter) {
    var sanitized = QueryValidator.sanitize(filter);
    return sanitized.isEmpty()
        ? "ORDERBY" + SORT_FIELD
        : sanitized + "^ORDERBY" + SORT_FIELD;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
