package com.mk.fx.qa.benchmark.execution.progress;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands events to a delegate on a single background thread, so a slow consumer never delays the
 * run. Events reach the delegate in the order they were reported.
 */
@Slf4j
public class AsyncProgressReporter implements ProgressReporter, AutoCloseable {

  private final ProgressReporter delegate;
  private final ExecutorService dispatcher;
  private final Duration closeTimeout;

  public AsyncProgressReporter(
      ProgressReporter delegate, String threadName, Duration closeTimeout) {
    this.delegate = delegate;
    this.closeTimeout = closeTimeout;
    this.dispatcher =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable);
              thread.setName(threadName);
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public void onUnitStatus(UnitStatusEvent event) {
    dispatch(() -> delegate.onUnitStatus(event), event.unitId());
  }

  @Override
  public void onRunCompleted(AggregateEvent event) {
    dispatch(() -> delegate.onRunCompleted(event), "run-completed");
  }

  private void dispatch(Runnable delivery, String label) {
    try {
      dispatcher.execute(
          () -> {
            try {
              delivery.run();
            } catch (RuntimeException e) {
              log.warn("Progress delivery for {} failed: {}", label, e.getMessage());
            }
          });
    } catch (RejectedExecutionException e) {
      log.warn("Progress reporter closed, dropping event for {}", label);
    }
  }

  /** Stops accepting events and waits for queued ones to be delivered. */
  @Override
  public void close() {
    dispatcher.shutdown();
    try {
      if (!dispatcher.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Progress events still pending after {}", closeTimeout);
        dispatcher.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      dispatcher.shutdownNow();
    }
  }
}
