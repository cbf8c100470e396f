package com.mk.fx.qa.benchmark.execution.service;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.benchmark.execution.auth.AuthMode;
import com.mk.fx.qa.benchmark.execution.auth.AuthSessionFactory;
import com.mk.fx.qa.benchmark.execution.cfg.BenchmarkProperties;
import com.mk.fx.qa.benchmark.execution.compare.RecordSetComparator;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.benchmark.execution.exception.ConfigurationException;
import com.mk.fx.qa.benchmark.execution.executor.DualStyleExecutor;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkRun;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import com.mk.fx.qa.benchmark.execution.progress.UnitStatus;
import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import com.mk.fx.qa.benchmark.execution.request.TableApiRequestBuilder;
import com.mk.fx.qa.benchmark.execution.run.BenchmarkRunner;
import com.mk.fx.qa.benchmark.execution.run.RunSummary;
import com.mk.fx.qa.benchmark.execution.scenario.CategoryConfig;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioCategory;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioExpander;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibrary;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibraryValidator;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioSpec;
import com.mk.fx.qa.benchmark.execution.scenario.SingleResourceScenario;
import com.mk.fx.qa.benchmark.execution.scenario.TestConfiguration;
import com.mk.fx.qa.benchmark.execution.support.ScriptedInstance;
import com.mk.fx.qa.benchmark.execution.trial.TrialRunner;
import com.mk.fx.qa.benchmark.execution.verdict.RunningTotals;
import com.mk.fx.qa.benchmark.execution.verdict.Winner;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;

class BenchmarkRunServiceTest {

  private static final ScenarioLibrary LIBRARY = library();

  private static ScenarioLibrary library() {
    Map<String, ScenarioSpec> variants = new LinkedHashMap<>();
    variants.put(
        "v1",
        new SingleResourceScenario(
            "incidents", new ResourceQuery("incident", List.of("number"), null), List.of(100)));
    return new ScenarioLibrary(
        List.of(new ScenarioCategory("perf", "Performance", "Scale tests", variants)));
  }

  private static BenchmarkProperties cfg(int history) {
    BenchmarkProperties cfg = new BenchmarkProperties();
    cfg.getRuns().setHistorySize(history);
    cfg.getInstance().setBaseUrl("https://dev.example.com");
    return cfg;
  }

  private static AuthSessionFactory credentials() {
    return new AuthSessionFactory(
        AuthMode.CREDENTIAL, "admin", "secret", "https://dev.example.com", null);
  }

  private static BenchmarkRunner scriptedRunner(ScriptedInstance instance) {
    var trialRunner = new TrialRunner(instance.gateway(), Duration.ZERO, instance.ticker());
    var executor =
        new DualStyleExecutor(
            new TableApiRequestBuilder(),
            trialRunner,
            new RecordSetComparator(),
            3,
            Clock.systemUTC());
    return new BenchmarkRunner(LIBRARY, new ScenarioExpander(LIBRARY), executor, Clock.systemUTC());
  }

  private static BenchmarkRunService service(BenchmarkRunner runner, int history) {
    return new BenchmarkRunService(
        cfg(history),
        runner,
        credentials(),
        LIBRARY,
        new ScenarioLibraryValidator(new TableApiRequestBuilder()));
  }

  private static BenchmarkRun newRun() {
    return newRun(null);
  }

  private static BenchmarkRun newRun(Integer iterations) {
    var configuration =
        new TestConfiguration(
            Map.of("perf", new CategoryConfig(true, List.of("v1"), List.of(100), null)));
    return new BenchmarkRun(UUID.randomUUID(), Instant.now(), configuration, iterations);
  }

  private static RunSummary emptySummary(boolean cancelled) {
    return new RunSummary(0, 0, RunningTotals.EMPTY, List.of(), cancelled);
  }

  @Test
  void submitRun_completesAndExposesResults() throws Exception {
    var instance = new ScriptedInstance().directTimes(10, 12, 11).structuredTimes(40, 42, 41);
    var service = service(scriptedRunner(instance), 10);
    var run = newRun();

    var outcome = service.submitRun(run).orElseThrow();
    assertEquals(run.getId(), outcome.runId());
    assertTrue(
        outcome.status() == RunStatus.QUEUED
            || outcome.status() == RunStatus.PROCESSING
            || outcome.status() == RunStatus.COMPLETED,
        "Expected QUEUED/PROCESSING/COMPLETED at submission, but was " + outcome.status());

    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);

    var status = service.getRunStatus(run.getId()).orElseThrow();
    assertEquals(1, status.unitsPlanned());
    assertEquals(1, status.unitsCompleted());
    assertEquals(0, status.unitsFailed());
    assertEquals(UnitStatus.COMPLETED, status.units().get(0).status());
    assertEquals(100, status.units().get(0).percent());
    assertNotNull(status.totals());
    assertEquals(11.0, status.totals().averageDurationA(), 1e-9);

    var results = service.getRunResults(run.getId()).orElseThrow();
    assertEquals(1, results.results().size());
    assertEquals(Winner.A, results.results().get(0).winner());
    assertEquals(1, results.totals().winsA());
    assertFalse(results.totals().cancelled());

    awaitHistory(service, 1);
    var history = service.getRunHistory();
    assertEquals(RunStatus.COMPLETED, history.get(0).status());
    assertEquals(1, history.get(0).winsA());
  }

  @Test
  void submitRun_perRunIterationsOverrideDefault() throws Exception {
    var instance = new ScriptedInstance();
    var service = service(scriptedRunner(instance), 10);
    var run = newRun(1);

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);

    assertEquals(2, instance.dispatched().size());
  }

  @Test
  void submitRun_duplicateIdIsRejected() throws Exception {
    var service = service(scriptedRunner(new ScriptedInstance()), 10);
    var run = newRun();

    service.submitRun(run);
    var duplicate = service.submitRun(run).orElseThrow();

    assertEquals(RunStatus.ERROR, duplicate.status());
    assertEquals("Run ID already exists", duplicate.message());
  }

  @Test
  void submitRun_runnerFailureMarksRunErrored() throws Exception {
    var runner = mock(BenchmarkRunner.class);
    when(runner.run(any(), any(), any(), any()))
        .thenThrow(new ConfigurationException("Category perf has an invalid record limit: 0"));
    var service = service(runner, 10);
    var run = newRun();

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.ERROR, 5);

    var status = service.getRunStatus(run.getId()).orElseThrow();
    assertTrue(status.errorMessage().contains("invalid record limit"));
    awaitHistory(service, 1);
    assertEquals(RunStatus.ERROR, service.getRunHistory().get(0).status());
  }

  @Test
  void submitRun_missingCredentialsMarksRunErrored() throws Exception {
    var service =
        new BenchmarkRunService(
            cfg(10),
            scriptedRunner(new ScriptedInstance()),
            new AuthSessionFactory(AuthMode.CREDENTIAL, null, null, "https://x", null),
            LIBRARY,
            new ScenarioLibraryValidator(new TableApiRequestBuilder()));
    var run = newRun();

    service.submitRun(run);

    awaitStatus(service, run.getId(), RunStatus.ERROR, 5);
    assertTrue(
        service.getRunStatus(run.getId()).orElseThrow().errorMessage().contains("Username"));
  }

  @Test
  void cancelRun_whenQueued_cancelsImmediately() throws Exception {
    var started = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var runner = mock(BenchmarkRunner.class);
    when(runner.run(any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              started.countDown();
              release.await(5, TimeUnit.SECONDS);
              return emptySummary(false);
            });
    var service = service(runner, 10);
    var first = newRun();
    var second = newRun();

    service.submitRun(first);
    assertTrue(started.await(2, TimeUnit.SECONDS));
    service.submitRun(second);

    var cancelResult = service.cancelRun(second.getId());
    assertEquals(
        BenchmarkRunService.CancellationResult.CancellationState.CANCELLED,
        cancelResult.getState());
    assertEquals(RunStatus.CANCELLED, cancelResult.getRunStatus());

    release.countDown();
    awaitStatus(service, first.getId(), RunStatus.COMPLETED, 5);
    assertEquals(
        RunStatus.CANCELLED,
        service.getRunStatus(second.getId()).map(RunStatusResponse::status).orElseThrow());
  }

  @Test
  void cancelRun_whenProcessing_stopsAfterCurrentUnit() throws Exception {
    var started = new CountDownLatch(1);
    var runner = mock(BenchmarkRunner.class);
    when(runner.run(any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              BooleanSupplier stop = invocation.getArgument(3);
              started.countDown();
              long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
              while (!stop.getAsBoolean() && System.nanoTime() < deadline) {
                Thread.sleep(10);
              }
              return emptySummary(stop.getAsBoolean());
            });
    var service = service(runner, 10);
    var run = newRun();

    service.submitRun(run);
    assertTrue(started.await(2, TimeUnit.SECONDS));

    var cancelResult = service.cancelRun(run.getId());
    assertEquals(
        BenchmarkRunService.CancellationResult.CancellationState.CANCELLATION_REQUESTED,
        cancelResult.getState());
    assertNotEquals(RunStatus.QUEUED, cancelResult.getRunStatus());

    awaitStatus(service, run.getId(), RunStatus.CANCELLED, 5);
    var results = service.getRunResults(run.getId()).orElseThrow();
    assertTrue(results.totals().cancelled());
  }

  @Test
  void cancelRun_unknownAndFinishedRuns() throws Exception {
    var service = service(scriptedRunner(new ScriptedInstance()), 10);
    var run = newRun();

    assertEquals(
        BenchmarkRunService.CancellationResult.CancellationState.NOT_FOUND,
        service.cancelRun(UUID.randomUUID()).getState());

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);

    var result = service.cancelRun(run.getId());
    assertEquals(
        BenchmarkRunService.CancellationResult.CancellationState.NOT_CANCELLABLE,
        result.getState());
    assertEquals(RunStatus.COMPLETED, result.getRunStatus());
  }

  @Test
  void history_isBoundedNewestFirst() throws Exception {
    var service = service(scriptedRunner(new ScriptedInstance()), 2);
    var runs = List.of(newRun(1), newRun(1), newRun(1));

    for (int i = 0; i < runs.size(); i++) {
      service.submitRun(runs.get(i));
      awaitStatus(service, runs.get(i).getId(), RunStatus.COMPLETED, 5);
      awaitHistory(service, Math.min(i + 1, 2));
    }
    await()
        .atMost(Duration.ofSeconds(5))
        .until(() -> service.getRunHistory().get(0).runId().equals(runs.get(2).getId()));

    var history = service.getRunHistory();
    assertEquals(2, history.size());
    assertEquals(runs.get(2).getId(), history.get(0).runId());
    assertEquals(runs.get(1).getId(), history.get(1).runId());
    await().atMost(Duration.ofSeconds(5)).until(() -> service.getAllRuns().size() == 2);
    assertTrue(service.getRunStatus(runs.get(0).getId()).isEmpty());
  }

  @Test
  void runsLeavingHistory_releaseTheirResults() throws Exception {
    var instance =
        new ScriptedInstance()
            .directBody("{\"result\":[{\"sys_id\":\"x\",\"number\":\"INC1\"}]}");
    var service = service(scriptedRunner(instance), 1);
    var runs = List.of(newRun(1), newRun(1), newRun(1), newRun(1));

    for (BenchmarkRun run : runs) {
      service.submitRun(run);
      awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);
      assertEquals(1, service.getRunResults(run.getId()).orElseThrow().results().size());
    }
    await()
        .atMost(Duration.ofSeconds(5))
        .until(() -> service.getAllRuns().size() == 1);

    var survivor = runs.get(3).getId();
    assertEquals(survivor, service.getAllRuns().iterator().next().runId());
    for (BenchmarkRun run : runs.subList(0, 3)) {
      assertTrue(service.getRunResults(run.getId()).isEmpty());
      assertTrue(service.getRunStatus(run.getId()).isEmpty());
    }
  }

  @Test
  void finishedRuns_leaveNoActiveEntries() throws Exception {
    var service = service(scriptedRunner(new ScriptedInstance()), 50);
    var runs = new ArrayList<BenchmarkRun>();
    for (int i = 0; i < 20; i++) {
      var run = newRun(1);
      runs.add(run);
      service.submitRun(run);
    }

    for (BenchmarkRun run : runs) {
      awaitStatus(service, run.getId(), RunStatus.COMPLETED, 10);
    }
    await().atMost(Duration.ofSeconds(5)).until(() -> service.activeRunCount() == 0);
    awaitHistory(service, 20);
  }

  @Test
  void shutdown_stopsAcceptingRuns() {
    var service = service(scriptedRunner(new ScriptedInstance()), 10);
    assertTrue(service.isHealthy());

    service.shutdown();

    assertFalse(service.isHealthy());
    assertTrue(service.submitRun(newRun()).isEmpty());
  }

  @Test
  void scenarioQueries_delegateToLibrary() {
    var service = service(scriptedRunner(new ScriptedInstance()), 10);

    assertEquals(1, service.getScenarioCategories().size());
    assertEquals(0, service.validateScenarioLibrary().totalComposites());
    assertTrue(service.getRunResults(UUID.randomUUID()).isEmpty());
  }

  private static void awaitHistory(BenchmarkRunService service, int size) {
    await().atMost(Duration.ofSeconds(5)).until(() -> service.getRunHistory().size() == size);
  }

  private static void awaitStatus(
      BenchmarkRunService service, UUID runId, RunStatus expected, int timeoutSeconds)
      throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
    while (System.nanoTime() < deadline) {
      var status = service.getRunStatus(runId).map(RunStatusResponse::status).orElse(null);
      if (status == expected) {
        return;
      }
      Thread.sleep(10);
    }
    fail("Timed out waiting for status " + expected + " for run " + runId);
  }
}
