package com.mk.fx.qa.benchmark.execution.exception;

/** Raised when a call could not reach the instance. The gateway never retries these. */
public class NetworkException extends BenchmarkException {

  public NetworkException(String message) {
    super(ErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(ErrorCode.NETWORK_ERROR, message, cause);
  }
}
