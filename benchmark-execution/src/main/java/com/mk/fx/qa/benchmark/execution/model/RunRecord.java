package com.mk.fx.qa.benchmark.execution.model;

import com.mk.fx.qa.benchmark.execution.progress.RunStateProgressReporter;
import com.mk.fx.qa.benchmark.execution.run.RunSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable bookkeeping for one submitted run. Status transitions are synchronized; the progress
 * state is filled in by the run's reporter while it executes.
 */
public class RunRecord {

  private final BenchmarkRun run;
  private final Instant submittedAt;
  private final RunStateProgressReporter state = new RunStateProgressReporter();
  private final AtomicBoolean stopRequested = new AtomicBoolean();

  private RunStatus status = RunStatus.QUEUED;
  private Instant startedAt;
  private Instant completedAt;
  private String errorMessage;
  private RunSummary summary;

  public RunRecord(BenchmarkRun run, Instant submittedAt) {
    this.run = run;
    this.submittedAt = submittedAt;
  }

  public UUID getRunId() {
    return run.getId();
  }

  public BenchmarkRun getRun() {
    return run;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public RunStateProgressReporter getState() {
    return state;
  }

  public synchronized RunStatus getStatus() {
    return status;
  }

  public synchronized Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public synchronized Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public synchronized Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public synchronized Optional<RunSummary> getSummary() {
    return Optional.ofNullable(summary);
  }

  public boolean requestStop() {
    return stopRequested.compareAndSet(false, true);
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  public synchronized void markProcessing(Instant at) {
    status = RunStatus.PROCESSING;
    startedAt = at;
  }

  public synchronized void markCompleted(Instant at, RunSummary result) {
    status = RunStatus.COMPLETED;
    completedAt = at;
    summary = result;
  }

  public synchronized void markCancelled(Instant at, RunSummary result) {
    status = RunStatus.CANCELLED;
    completedAt = at;
    summary = result;
  }

  public synchronized void markErrored(Instant at, String message) {
    status = RunStatus.ERROR;
    completedAt = at;
    errorMessage = message;
  }

  /** Milliseconds between start and completion, or until now for a run still processing. */
  public synchronized long getProcessingDurationMillis() {
    if (startedAt == null) {
      return 0;
    }
    var end = completedAt == null ? Instant.now() : completedAt;
    return Duration.between(startedAt, end).toMillis();
  }
}
