package com.mk.fx.qa.benchmark.execution.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.mk.fx.qa.benchmark.execution.auth.AuthSession;
import com.mk.fx.qa.benchmark.execution.compare.ComparisonReport;
import com.mk.fx.qa.benchmark.execution.compare.ResponseComparator;
import com.mk.fx.qa.benchmark.execution.exception.ConfigurationException;
import com.mk.fx.qa.benchmark.execution.exception.ValidationException;
import com.mk.fx.qa.benchmark.execution.progress.UnitProgress;
import com.mk.fx.qa.benchmark.execution.request.RequestBuilder;
import com.mk.fx.qa.benchmark.execution.request.ValidationError;
import com.mk.fx.qa.benchmark.execution.scenario.CompositeScenario;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioSpec;
import com.mk.fx.qa.benchmark.execution.scenario.SingleResourceScenario;
import com.mk.fx.qa.benchmark.execution.scenario.TestUnit;
import com.mk.fx.qa.benchmark.execution.trial.TrialMeasurement;
import com.mk.fx.qa.benchmark.execution.trial.TrialRunner;
import com.mk.fx.qa.benchmark.execution.verdict.Verdict;
import com.mk.fx.qa.benchmark.rest.JsonUtil;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one unit in both styles and scores it.
 *
 * <p>Single-resource scenarios run the direct fetch and the structured query {@code iterations}
 * times each. Composite scenarios run every direct call once and fuse them into one measurement,
 * then run the batched structured query once. Style A reports the first half of the unit's
 * progress and style B the second half.
 */
@Slf4j
public class DualStyleExecutor {

  private final RequestBuilder requestBuilder;
  private final TrialRunner trialRunner;
  private final ResponseComparator comparator;
  private final int iterations;
  private final Clock clock;

  public DualStyleExecutor(
      RequestBuilder requestBuilder,
      TrialRunner trialRunner,
      ResponseComparator comparator,
      int iterations,
      Clock clock) {
    this.requestBuilder = requestBuilder;
    this.trialRunner = trialRunner;
    this.comparator = comparator;
    this.iterations = iterations;
    this.clock = clock;
  }

  /** Same executor running {@code iterations} attempts per single-resource trial. */
  public DualStyleExecutor withIterations(int iterations) {
    return new DualStyleExecutor(requestBuilder, trialRunner, comparator, iterations, clock);
  }

  public int iterations() {
    return iterations;
  }

  /**
   * @throws ConfigurationException if the configured iterations are less than 1
   * @throws ValidationException if the scenario cannot be turned into valid requests
   */
  public UnitExecution executeUnit(
      TestUnit unit, ScenarioSpec spec, AuthSession session, UnitProgress progress) {
    if (iterations < 1) {
      throw new ConfigurationException("Iterations must be at least 1, got " + iterations);
    }
    progress.running(0);
    return switch (spec.kind()) {
      case SINGLE_RESOURCE -> executeSingle(
          unit, (SingleResourceScenario) spec, session, progress);
      case COMPOSITE -> executeComposite(unit, (CompositeScenario) spec, session, progress);
    };
  }

  private UnitExecution executeSingle(
      TestUnit unit, SingleResourceScenario spec, AuthSession session, UnitProgress progress) {
    var query = spec.query();
    var limit = unit.recordLimit();

    var outcomeA =
        trialRunner.run(
            () -> requestBuilder.directFetch(query, limit),
            session,
            iterations,
            (attempt, total) -> progress.running(share(attempt + 1, total)));
    var outcomeB =
        trialRunner.run(
            () -> requestBuilder.structuredQuery(query, limit),
            outcomeA.session(),
            iterations,
            (attempt, total) -> progress.running(50 + share(attempt + 1, total)));

    var a = outcomeA.measurement();
    var b = outcomeB.measurement();
    var report =
        safeCompare(
            unit,
            () ->
                comparator.compare(
                    a.responseBody(), b.responseBody(), query.table(), query.fields()));
    return new UnitExecution(result(unit, progress, a, b, report), outcomeB.session());
  }

  private UnitExecution executeComposite(
      TestUnit unit, CompositeScenario spec, AuthSession session, UnitProgress progress) {
    var calls = spec.calls();
    List<ValidationError> errors = new ArrayList<>(requestBuilder.validateComposite(calls));
    if (!spec.declaredTablesMatchCalls()) {
      errors.add(
          new ValidationError(
              "tables", "Declared tables do not match the calls", spec.tables()));
    }
    if (!errors.isEmpty()) {
      throw new ValidationException(
          "Invalid composite scenario: "
              + errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
    }

    var limit = unit.recordLimit();
    var current = session;
    List<TrialMeasurement> perCall = new ArrayList<>(calls.size());
    for (int i = 0; i < calls.size(); i++) {
      var call = calls.get(i);
      var percent = share(i + 1, calls.size());
      var outcome =
          trialRunner.run(
              () -> requestBuilder.directFetch(call, limit),
              current,
              1,
              (attempt, total) -> progress.running(percent));
      perCall.add(outcome.measurement());
      current = outcome.session();
    }
    var a = fuse(perCall);

    var outcomeB =
        trialRunner.run(
            () -> requestBuilder.structuredBatchQuery(calls, limit),
            current,
            1,
            (attempt, total) -> progress.running(50 + share(attempt + 1, total)));
    var b = outcomeB.measurement();

    List<JsonNode> bodiesA = perCall.stream().map(TrialMeasurement::responseBody).toList();
    var report =
        safeCompare(unit, () -> comparator.compareComposite(bodiesA, b.responseBody(), calls));
    return new UnitExecution(result(unit, progress, a, b, report), outcomeB.session());
  }

  /** Combines sequential single-attempt calls into one logical measurement. */
  static TrialMeasurement fuse(List<TrialMeasurement> perCall) {
    ArrayNode bodies = JsonUtil.mapper().createArrayNode();
    long duration = 0;
    long payload = 0;
    var success = true;
    String error = null;
    List<Long> durations = new ArrayList<>(perCall.size());
    for (TrialMeasurement call : perCall) {
      duration += call.durationMs();
      payload += call.payloadSizeBytes();
      durations.add(call.durationMs());
      success &= call.success();
      if (call.error() != null) {
        error = call.error();
      }
      bodies.add(call.responseBody() == null ? NullNode.getInstance() : call.responseBody());
    }
    return new TrialMeasurement(
        duration, success, bodies, payload, durations, perCall.size(), error);
  }

  private UnitResult result(
      TestUnit unit,
      UnitProgress progress,
      TrialMeasurement a,
      TrialMeasurement b,
      ComparisonReport report) {
    var winner = Verdict.decide(a, b);
    log.debug(
        "Unit {} scored: A={}ms/{} B={}ms/{} winner={}",
        unit.unitId(),
        a.durationMs(),
        a.success(),
        b.durationMs(),
        b.success(),
        winner);
    return new UnitResult(
        unit.unitId(), progress.displayName(), a, b, winner, report, clock.instant());
  }

  private static ComparisonReport safeCompare(
      TestUnit unit, Supplier<ComparisonReport> comparison) {
    try {
      return comparison.get();
    } catch (RuntimeException e) {
      log.warn("Comparison failed for unit {}: {}", unit.unitId(), e.getMessage());
      return ComparisonReport.empty("Comparison failed: " + e.getMessage());
    }
  }

  /** Percentage of a 50-point half reached after {@code done} of {@code total} steps. */
  private static int share(int done, int total) {
    return (int) ((double) done / total * 50);
  }
}
