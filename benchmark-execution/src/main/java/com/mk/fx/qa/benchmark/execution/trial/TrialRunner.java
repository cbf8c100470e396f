package com.mk.fx.qa.benchmark.execution.trial;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.mk.fx.qa.benchmark.execution.auth.AuthGateway;
import com.mk.fx.qa.benchmark.execution.auth.AuthSession;
import com.mk.fx.qa.benchmark.execution.exception.BenchmarkException;
import com.mk.fx.qa.benchmark.execution.exception.ConfigurationException;
import com.mk.fx.qa.benchmark.execution.exception.ValidationException;
import com.mk.fx.qa.benchmark.rest.JsonUtil;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one logical request a fixed number of times and summarises the attempts.
 *
 * <p>Attempts run one after another. Each is timed with a {@link Stopwatch} around the gateway call
 * only; the settle delay between attempts is not measured. A failed attempt records a duration of
 * 0 and the trial continues. The reported duration is the element at index {@code n / 2} of the
 * sorted durations, zeros included.
 */
@Slf4j
public class TrialRunner {

  private final AuthGateway gateway;
  private final Duration settleDelay;
  private final Ticker ticker;

  public TrialRunner(AuthGateway gateway, Duration settleDelay) {
    this(gateway, settleDelay, Ticker.systemTicker());
  }

  public TrialRunner(AuthGateway gateway, Duration settleDelay, Ticker ticker) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.settleDelay = settleDelay == null ? Duration.ZERO : settleDelay;
    this.ticker = Objects.requireNonNull(ticker, "ticker");
  }

  /**
   * Executes {@code iterations} attempts of the request produced by {@code source}.
   *
   * @throws ConfigurationException if {@code iterations} is less than 1
   * @throws ValidationException if the source produces an invalid descriptor
   */
  public TrialOutcome run(
      RequestSource source, AuthSession session, int iterations, AttemptListener listener) {
    if (iterations < 1) {
      throw new ConfigurationException("Iterations must be at least 1, got " + iterations);
    }
    Objects.requireNonNull(source, "source");
    var progress = listener == null ? AttemptListener.NONE : listener;

    var current = session;
    List<Long> durations = new ArrayList<>(iterations);
    var allSucceeded = true;
    String lastError = null;
    JsonNode lastBody = null;

    for (int attempt = 0; attempt < iterations; attempt++) {
      progress.beforeAttempt(attempt, iterations);
      var descriptor = source.next();
      if (!descriptor.isValid()) {
        throw new ValidationException("Request is invalid: " + descriptor.describeErrors());
      }

      var stopwatch = Stopwatch.createStarted(ticker);
      JsonNode body = null;
      String failure = null;
      long elapsed;
      try {
        var authenticated = gateway.execute(descriptor, current);
        elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        current = authenticated.session();
        var response = authenticated.response();
        if (response.getStatusCode() >= 400) {
          failure = "HTTP " + response.getStatusCode();
        } else {
          body = parseBody(response.getBody());
          if (body == null) {
            failure = "Response body is not valid JSON";
          }
        }
      } catch (BenchmarkException e) {
        failure = e.getMessage();
        elapsed = 0;
      }

      if (failure == null) {
        durations.add(elapsed);
        log.debug("Attempt {}/{} succeeded in {} ms", attempt + 1, iterations, elapsed);
      } else {
        durations.add(0L);
        allSucceeded = false;
        lastError = failure;
        log.warn("Attempt {}/{} failed: {}", attempt + 1, iterations, failure);
      }
      if (attempt == iterations - 1) {
        lastBody = body;
      } else {
        settle();
      }
    }

    var measurement =
        new TrialMeasurement(
            median(durations),
            allSucceeded,
            lastBody,
            JsonUtil.serializedSize(lastBody),
            durations,
            1,
            lastError);
    return new TrialOutcome(measurement, current);
  }

  /** Element at index {@code size / 2} of the sorted durations. */
  static long median(List<Long> durations) {
    if (durations.isEmpty()) {
      return 0;
    }
    var sorted = new ArrayList<>(durations);
    sorted.sort(null);
    return sorted.get(sorted.size() / 2);
  }

  private static JsonNode parseBody(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      var node = JsonUtil.readTree(body);
      return node == null || node.isMissingNode() ? null : node;
    } catch (JsonProcessingException e) {
      log.debug("Unparseable response body: {}", e.getOriginalMessage());
      return null;
    }
  }

  private void settle() {
    if (settleDelay.isZero() || settleDelay.isNegative()) {
      return;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(settleDelay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Settle delay interrupted");
    }
  }
}
