package com.mk.fx.qa.benchmark.execution.trial;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Timing and payload of one trial.
 *
 * @param durationMs median attempt duration, or the summed duration of a fused composite trial
 * @param success true only when every attempt succeeded
 * @param responseBody body of the last attempt, {@code null} when that attempt failed
 * @param payloadSizeBytes UTF-8 size of the compact JSON form of {@code responseBody}
 * @param allDurationsMs one entry per attempt (or per fused call), failed attempts record 0
 * @param requestCount number of HTTP calls that make up one logical request
 * @param error last failure message, if any attempt failed
 */
public record TrialMeasurement(
    long durationMs,
    boolean success,
    JsonNode responseBody,
    long payloadSizeBytes,
    List<Long> allDurationsMs,
    int requestCount,
    String error) {

  public TrialMeasurement {
    allDurationsMs = List.copyOf(allDurationsMs);
  }
}
