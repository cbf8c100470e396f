package com.mk.fx.qa.benchmark.execution.resource;

import com.mk.fx.qa.benchmark.execution.cfg.ErrorResponse;
import com.mk.fx.qa.benchmark.execution.exception.BenchmarkException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid Argument", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    var details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Rejected request body: {}", details);
    return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid Request", details));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of("Invalid Request", "Request body is not valid JSON"));
  }

  @ExceptionHandler(BenchmarkException.class)
  public ResponseEntity<ErrorResponse> handleBenchmark(BenchmarkException ex) {
    log.warn("Benchmark error {}: {}", ex.getErrorCode(), ex.getMessage());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of(ex));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(ErrorResponse.of("Server Error", ex.getMessage()));
  }
}
