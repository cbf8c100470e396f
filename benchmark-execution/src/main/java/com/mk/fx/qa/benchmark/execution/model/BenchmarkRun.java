package com.mk.fx.qa.benchmark.execution.model;

import com.mk.fx.qa.benchmark.execution.scenario.TestConfiguration;
import java.time.Instant;
import java.util.UUID;

/**
 * A benchmark run as submitted: the matrix selection plus an optional override of the attempts
 * per single-resource trial. A null {@code iterations} means the configured default applies.
 */
public class BenchmarkRun {

  private final UUID id;
  private final Instant createdAt;
  private final TestConfiguration configuration;
  private final Integer iterations;

  public BenchmarkRun(
      UUID id, Instant createdAt, TestConfiguration configuration, Integer iterations) {
    this.id = id;
    this.createdAt = createdAt;
    this.configuration = configuration;
    this.iterations = iterations;
  }

  public UUID getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public TestConfiguration getConfiguration() {
    return configuration;
  }

  public Integer getIterations() {
    return iterations;
  }
}
