package com.mk.fx.qa.benchmark.execution.exception;

/** Raised before any network activity when the run configuration cannot be executed. */
public class ConfigurationException extends BenchmarkException {

  public ConfigurationException(String message) {
    super(ErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
