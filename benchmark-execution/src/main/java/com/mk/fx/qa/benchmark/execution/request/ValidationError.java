package com.mk.fx.qa.benchmark.execution.request;

/**
 * A single field-level or structural problem found while building a request.
 *
 * @param field the offending input, e.g. {@code table} or {@code calls[1].fields}
 * @param message what is wrong with it
 * @param value the rejected value, may be null
 */
public record ValidationError(String field, String message, Object value) {

  public ValidationError(String field, String message) {
    this(field, message, null);
  }

  public ValidationError withField(String newField) {
    return new ValidationError(newField, message, value);
  }

  @Override
  public String toString() {
    return value == null ? field + ": " + message : field + ": " + message + " (" + value + ")";
  }
}
