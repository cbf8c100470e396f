package com.mk.fx.qa.benchmark.execution.compare;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One field that differs between the two styles for the same record position.
 *
 * @param warning true for a known representation difference that still counts as a match
 */
public record FieldMismatch(
    int recordIndex, String field, JsonNode valueA, JsonNode valueB, boolean warning) {}
