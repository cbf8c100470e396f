package com.mk.fx.qa.benchmark.execution.exception;

/** Raised when the instance rejects the credentials and no further retry is allowed. */
public class AuthFailedException extends BenchmarkException {

  public AuthFailedException(String message) {
    super(ErrorCode.AUTH_FAILED, message);
  }

  public AuthFailedException(String message, Throwable cause) {
    super(ErrorCode.AUTH_FAILED, message, cause);
  }
}
