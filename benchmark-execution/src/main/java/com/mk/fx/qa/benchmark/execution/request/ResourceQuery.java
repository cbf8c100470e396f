package com.mk.fx.qa.benchmark.execution.request;

import java.util.List;

/**
 * What to fetch from one table: the fields (dot-walked paths allowed) and an optional encoded
 * filter.
 */
public record ResourceQuery(String table, List<String> fields, String filter) {

  public ResourceQuery {
    fields = fields == null ? List.of() : List.copyOf(fields);
    filter = filter == null ? "" : filter;
  }
}
