package com.mk.fx.qa.benchmark.execution.exception;

/** Raised when a scenario or request descriptor fails validation. Never retried. */
public class ValidationException extends BenchmarkException {

  public ValidationException(String message) {
    super(ErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(ErrorCode.VALIDATION_ERROR, message, cause);
  }
}
