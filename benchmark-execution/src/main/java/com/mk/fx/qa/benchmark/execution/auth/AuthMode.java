package com.mk.fx.qa.benchmark.execution.auth;

import java.util.Arrays;

/** How outbound calls authenticate against the instance. */
public enum AuthMode {
  /** Basic auth from a stored username and password; absolute URLs against the session base. */
  CREDENTIAL,
  /** Session token header; calls stay relative to the transport's own origin. */
  TOKEN;

  public static AuthMode fromValue(String value) {
    return Arrays.stream(values())
        .filter(mode -> mode.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported auth mode: " + value));
  }
}
