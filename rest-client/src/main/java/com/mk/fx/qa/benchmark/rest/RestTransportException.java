package com.mk.fx.qa.benchmark.rest;

/**
 * Raised when a request could not be exchanged with the remote server at all (connection refused,
 * unknown host, timeout, interrupted send). HTTP error statuses are never reported this way.
 */
public class RestTransportException extends RuntimeException {

  private final boolean timedOut;

  public RestTransportException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public RestTransportException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
