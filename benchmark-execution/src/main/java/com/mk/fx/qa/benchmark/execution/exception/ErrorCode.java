package com.mk.fx.qa.benchmark.execution.exception;

/** Failure classes surfaced by a benchmark run, each with the message shown to users. */
public enum ErrorCode {
  VALIDATION_ERROR("The scenario or request is invalid."),
  AUTH_FAILED("Authentication failed. Please check your credentials."),
  NETWORK_ERROR("Network error occurred. Please check your connection."),
  TOKEN_REFRESH_FAILED("Unable to authenticate with the instance. Please check your session."),
  CONFIGURATION_ERROR("The benchmark configuration is invalid.");

  private final String userMessage;

  ErrorCode(String userMessage) {
    this.userMessage = userMessage;
  }

  public String userMessage() {
    return userMessage;
  }
}
