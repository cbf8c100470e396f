package com.mk.fx.qa.benchmark.execution.verdict;

/**
 * Totals over the units completed so far. Averages and the success rate are derived on read and
 * are 0 while no unit has completed.
 */
public record RunningTotals(
    int unitsCompleted,
    int winsA,
    int winsB,
    long sumDurationA,
    long sumDurationB,
    long sumPayloadA,
    long sumPayloadB) {

  public static final RunningTotals EMPTY = new RunningTotals(0, 0, 0, 0, 0, 0, 0);

  public double averageDurationA() {
    return average(sumDurationA);
  }

  public double averageDurationB() {
    return average(sumDurationB);
  }

  public double averagePayloadA() {
    return average(sumPayloadA);
  }

  public double averagePayloadB() {
    return average(sumPayloadB);
  }

  /** Percentage of completed units that produced a winner rather than a tie. */
  public double successRate() {
    return unitsCompleted == 0 ? 0 : (winsA + winsB) * 100.0 / unitsCompleted;
  }

  private double average(long sum) {
    return unitsCompleted == 0 ? 0 : (double) sum / unitsCompleted;
  }
}
