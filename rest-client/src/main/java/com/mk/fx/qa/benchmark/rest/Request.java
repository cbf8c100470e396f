package com.mk.fx.qa.benchmark.rest;

import java.util.Map;
import lombok.Data;

/**
 * A single outbound request. {@code path} is either relative to the client's base URL or an
 * absolute {@code http(s)} URL, and may already carry a query string.
 */
@Data
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Object body;
}
