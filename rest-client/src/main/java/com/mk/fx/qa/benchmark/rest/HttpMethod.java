package com.mk.fx.qa.benchmark.rest;

/** HTTP verbs supported by {@link RestHttpClient}. */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE
}
