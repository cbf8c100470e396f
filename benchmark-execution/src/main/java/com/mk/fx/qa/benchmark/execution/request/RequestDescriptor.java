package com.mk.fx.qa.benchmark.execution.request;

import com.mk.fx.qa.benchmark.rest.HttpMethod;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Transport-ready description of one call. {@code target} is a path relative to the instance or
 * an absolute URL. A descriptor carrying validation errors must never be dispatched.
 */
public record RequestDescriptor(
    HttpMethod method,
    String target,
    Map<String, String> headers,
    Object body,
    List<ValidationError> errors) {

  public RequestDescriptor {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static RequestDescriptor invalid(List<ValidationError> errors) {
    return new RequestDescriptor(null, "", Map.of(), null, errors);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public String describeErrors() {
    return errors.stream().map(ValidationError::toString).collect(Collectors.joining("; "));
  }
}
