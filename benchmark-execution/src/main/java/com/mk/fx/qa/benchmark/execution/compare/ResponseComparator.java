package com.mk.fx.qa.benchmark.execution.compare;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import java.util.List;

/**
 * Compares the data returned by both styles. Implementations must accept missing bodies and
 * missing or null fields without throwing.
 */
public interface ResponseComparator {

  ComparisonReport compare(JsonNode bodyA, JsonNode bodyB, String table, List<String> fields);

  /** @param bodiesA one body per call, in call order; entries may be null */
  ComparisonReport compareComposite(
      List<JsonNode> bodiesA, JsonNode bodyB, List<ResourceQuery> calls);
}
