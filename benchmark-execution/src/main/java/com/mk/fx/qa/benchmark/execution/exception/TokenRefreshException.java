package com.mk.fx.qa.benchmark.execution.exception;

/** Raised when a fresh session token could not be obtained. */
public class TokenRefreshException extends BenchmarkException {

  public TokenRefreshException(String message) {
    super(ErrorCode.TOKEN_REFRESH_FAILED, message);
  }

  public TokenRefreshException(String message, Throwable cause) {
    super(ErrorCode.TOKEN_REFRESH_FAILED, message, cause);
  }
}
