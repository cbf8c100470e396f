package com.mk.fx.qa.benchmark.execution.run;

import com.mk.fx.qa.benchmark.execution.auth.AuthSession;
import com.mk.fx.qa.benchmark.execution.exception.BenchmarkException;
import com.mk.fx.qa.benchmark.execution.exception.ConfigurationException;
import com.mk.fx.qa.benchmark.execution.executor.DualStyleExecutor;
import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import com.mk.fx.qa.benchmark.execution.progress.AggregateEvent;
import com.mk.fx.qa.benchmark.execution.progress.ProgressReporter;
import com.mk.fx.qa.benchmark.execution.progress.UnitProgress;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioCategory;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioExpander;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibrary;
import com.mk.fx.qa.benchmark.execution.scenario.TestConfiguration;
import com.mk.fx.qa.benchmark.execution.scenario.TestUnit;
import com.mk.fx.qa.benchmark.execution.verdict.RunningTotals;
import com.mk.fx.qa.benchmark.execution.verdict.RunningTotalsAggregator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a whole run: expands the configuration, executes the units one after another, folds
 * each result into the running totals and reports the final totals once.
 *
 * <p>A unit that fails is reported as FAILED and the run moves on; it does not enter the totals.
 * The stop signal is checked between units, so a unit already running always finishes. JVM
 * errors are not caught and abort the run.
 */
@Slf4j
public class BenchmarkRunner {

  private final ScenarioLibrary library;
  private final ScenarioExpander expander;
  private final DualStyleExecutor executor;
  private final Clock clock;

  public BenchmarkRunner(
      ScenarioLibrary library, ScenarioExpander expander, DualStyleExecutor executor, Clock clock) {
    this.library = library;
    this.expander = expander;
    this.executor = executor;
    this.clock = clock;
  }

  public BenchmarkRunner withIterations(int iterations) {
    return new BenchmarkRunner(library, expander, executor.withIterations(iterations), clock);
  }

  /**
   * @throws ConfigurationException if the configuration cannot be expanded; nothing is executed
   *     or reported in that case
   */
  public RunSummary run(
      TestConfiguration configuration,
      AuthSession session,
      ProgressReporter reporter,
      BooleanSupplier stopRequested) {
    var units = expander.expand(configuration);
    List<UnitProgress> trackers = new ArrayList<>(units.size());
    for (TestUnit unit : units) {
      var tracker =
          new UnitProgress(unit.unitId(), unit.displayName(titleOf(unit)), reporter, clock);
      tracker.queued();
      trackers.add(tracker);
    }

    var totals = RunningTotals.EMPTY;
    var current = session;
    var cancelled = false;
    var failed = 0;
    List<UnitResult> results = new ArrayList<>();

    for (int i = 0; i < units.size(); i++) {
      if (stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
        log.info("Stop requested, {} of {} units not run", units.size() - i, units.size());
        cancelled = true;
        break;
      }
      var unit = units.get(i);
      var tracker = trackers.get(i);
      log.info("Running unit {} ({}/{})", unit.unitId(), i + 1, units.size());
      try {
        var spec =
            library
                .variant(unit.category(), unit.variant())
                .orElseThrow(
                    () -> new ConfigurationException("No scenario for unit " + unit.unitId()));
        var execution = executor.executeUnit(unit, spec, current, tracker);
        current = execution.session();
        totals = RunningTotalsAggregator.fold(execution.result(), totals);
        results.add(execution.result());
        tracker.completed(execution.result());
      } catch (BenchmarkException e) {
        failed++;
        log.warn("Unit {} failed ({}): {}", unit.unitId(), e.getErrorCode(), e.describe());
        tracker.failed(e.describe());
      } catch (RuntimeException e) {
        failed++;
        log.error("Unit {} failed unexpectedly: {}", unit.unitId(), e.getMessage(), e);
        tracker.failed("Unexpected error: " + e.getMessage());
      }
    }

    reporter.onRunCompleted(AggregateEvent.of(totals, cancelled));
    return new RunSummary(units.size(), failed, totals, results, cancelled);
  }

  private String titleOf(TestUnit unit) {
    return library.category(unit.category()).map(ScenarioCategory::title).orElse(unit.category());
  }
}
