package com.mk.fx.qa.benchmark.execution.exception;

/**
 * Base type for every failure the benchmark engine classifies. The {@link ErrorCode} decides how
 * far the failure travels: attempt-level codes are absorbed into a measurement, setup codes fail
 * the unit.
 */
public abstract class BenchmarkException extends RuntimeException {

  private final ErrorCode errorCode;

  protected BenchmarkException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  protected BenchmarkException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /** Human-readable description safe to show in progress events. */
  public String describe() {
    return getMessage() != null ? getMessage() : errorCode.userMessage();
  }
}
