package com.mk.fx.qa.benchmark.execution.verdict;

import com.mk.fx.qa.benchmark.execution.trial.TrialMeasurement;

/** Decides which style won a unit. */
public final class Verdict {

  private Verdict() {
    // Utility class, no instantiation
  }

  /**
   * A style wins when it succeeded and the other style either failed or was slower. Everything
   * else, including both failing or equal durations, is a tie.
   */
  public static Winner decide(TrialMeasurement a, TrialMeasurement b) {
    if (beats(a, b)) {
      return Winner.A;
    }
    if (beats(b, a)) {
      return Winner.B;
    }
    return Winner.TIE;
  }

  private static boolean beats(TrialMeasurement self, TrialMeasurement other) {
    return self.success() && (!other.success() || self.durationMs() < other.durationMs());
  }
}
