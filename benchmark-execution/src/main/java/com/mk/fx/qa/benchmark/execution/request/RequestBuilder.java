package com.mk.fx.qa.benchmark.execution.request;

import java.util.List;

/**
 * Builds the two competing request shapes for the same data. Implementations are pure: they never
 * perform I/O and report bad input through {@link RequestDescriptor#errors()} rather than
 * throwing.
 */
public interface RequestBuilder {

  /** Style A: one direct resource fetch for {@code query}. */
  RequestDescriptor directFetch(ResourceQuery query, int limit);

  /** Style B: one structured query for {@code query}. */
  RequestDescriptor structuredQuery(ResourceQuery query, int limit);

  /** Style B for composite scenarios: every query batched into a single request. */
  RequestDescriptor structuredBatchQuery(List<ResourceQuery> queries, int limit);

  /** Structural validation of a composite scenario; empty when it can be executed. */
  List<ValidationError> validateComposite(List<ResourceQuery> queries);

  /** Relative cost of batching {@code queries} into one structured request. */
  int complexityScore(List<ResourceQuery> queries);
}
