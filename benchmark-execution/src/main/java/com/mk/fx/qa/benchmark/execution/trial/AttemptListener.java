package com.mk.fx.qa.benchmark.execution.trial;

/** Notified before each attempt of a trial starts. */
@FunctionalInterface
public interface AttemptListener {

  AttemptListener NONE = (attemptIndex, iterations) -> {};

  /**
   * @param attemptIndex zero-based index of the attempt about to run
   * @param iterations total attempts requested for this trial
   */
  void beforeAttempt(int attemptIndex, int iterations);
}
