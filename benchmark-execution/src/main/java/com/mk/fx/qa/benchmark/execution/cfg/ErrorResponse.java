package com.mk.fx.qa.benchmark.execution.cfg;

import com.mk.fx.qa.benchmark.execution.exception.BenchmarkException;
import com.mk.fx.qa.benchmark.execution.exception.ErrorCode;

/**
 * Body of every error answer from the HTTP API.
 *
 * <p>{@code code} and {@code hint} are only set for failures raised by the benchmark engine.
 * Rejected request bodies and server errors carry a title and details alone.
 *
 * @param error short title, the error code name for engine failures
 * @param details what went wrong for this request
 * @param code engine failure class, {@code null} otherwise
 * @param hint user-facing advice attached to {@code code}
 */
public record ErrorResponse(String error, String details, ErrorCode code, String hint) {

  public static ErrorResponse of(String error, String details) {
    return new ErrorResponse(error, details, null, null);
  }

  public static ErrorResponse of(BenchmarkException ex) {
    var code = ex.getErrorCode();
    return new ErrorResponse(code.name(), ex.describe(), code, code.userMessage());
  }
}
