package com.mk.fx.qa.benchmark.execution.service;

import static java.util.concurrent.Executors.newSingleThreadExecutor;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.benchmark.execution.auth.AuthSessionFactory;
import com.mk.fx.qa.benchmark.execution.cfg.BenchmarkProperties;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunHistoryEntry;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunResultsResponse;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunSubmissionOutcome;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.UnitStatusView;
import com.mk.fx.qa.benchmark.execution.executor.UnitResult;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkRun;
import com.mk.fx.qa.benchmark.execution.model.RunRecord;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import com.mk.fx.qa.benchmark.execution.progress.AggregateEvent;
import com.mk.fx.qa.benchmark.execution.progress.AsyncProgressReporter;
import com.mk.fx.qa.benchmark.execution.progress.CompositeProgressReporter;
import com.mk.fx.qa.benchmark.execution.progress.LoggingProgressReporter;
import com.mk.fx.qa.benchmark.execution.progress.UnitStatus;
import com.mk.fx.qa.benchmark.execution.progress.UnitStatusEvent;
import com.mk.fx.qa.benchmark.execution.run.BenchmarkRunner;
import com.mk.fx.qa.benchmark.execution.run.RunSummary;
import com.mk.fx.qa.benchmark.execution.scenario.LibraryValidationSummary;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioCategory;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibrary;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibraryValidator;
import com.mk.fx.qa.benchmark.execution.verdict.RunningTotals;
import com.mk.fx.qa.benchmark.execution.verdict.RunningTotalsAggregator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Accepts benchmark runs, executes them one at a time on a dedicated worker and keeps their state
 * in memory for status, results and history queries.
 *
 * <p>Runs move QUEUED → PROCESSING → COMPLETED/ERROR/CANCELLED. A queued run is cancelled
 * outright. A processing run is asked to stop: the unit in flight finishes, the remaining units
 * are skipped and the run ends CANCELLED with the totals gathered so far. Running units are never
 * interrupted since an interrupt would surface as a failed request and skew the measurements.
 */
@Slf4j
@Service
public class BenchmarkRunService {

  private final BenchmarkProperties properties;
  private final BenchmarkRunner runner;
  private final AuthSessionFactory sessionFactory;
  private final ScenarioLibrary library;
  private final ScenarioLibraryValidator libraryValidator;
  private final ExecutorService executor;
  private final Map<UUID, RunRecord> runRecords;
  private final Map<UUID, Future<?>> activeRuns;
  private final Deque<RunRecord> runHistory;
  private final AtomicBoolean acceptingRuns;
  private final AtomicLong totalCompleted;
  private final AtomicLong totalFailed;
  private final AtomicLong totalCancelled;
  private final LoggingProgressReporter loggingReporter = new LoggingProgressReporter();

  public BenchmarkRunService(
      BenchmarkProperties properties,
      BenchmarkRunner runner,
      AuthSessionFactory sessionFactory,
      ScenarioLibrary library,
      ScenarioLibraryValidator libraryValidator) {
    this.properties = properties;
    this.runner = runner;
    this.sessionFactory = sessionFactory;
    this.library = library;
    this.libraryValidator = libraryValidator;
    this.executor = createExecutor();
    this.runRecords = new ConcurrentHashMap<>();
    this.activeRuns = new ConcurrentHashMap<>();
    this.runHistory = new ConcurrentLinkedDeque<>();
    this.acceptingRuns = new AtomicBoolean(true);
    this.totalCompleted = new AtomicLong();
    this.totalFailed = new AtomicLong();
    this.totalCancelled = new AtomicLong();
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "BenchmarkRunService initialised with instance={} authMode={} iterations={} historySize={}",
        properties.getInstance().getBaseUrl(),
        sessionFactory.mode(),
        properties.getExecution().getIterations(),
        properties.getRuns().getHistorySize());
  }

  private ExecutorService createExecutor() {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("benchmark-run-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    return newSingleThreadExecutor(threadFactory);
  }

  /**
   * Queues a run for execution.
   *
   * @return empty if the service no longer accepts runs, otherwise the outcome at submission time
   */
  public Optional<RunSubmissionOutcome> submitRun(BenchmarkRun run) {
    if (!acceptingRuns.get()) {
      return Optional.empty();
    }

    var record = new RunRecord(run, Instant.now());
    var previous = runRecords.putIfAbsent(run.getId(), record);
    if (previous != null) {
      return Optional.of(
          new RunSubmissionOutcome(run.getId(), RunStatus.ERROR, "Run ID already exists"));
    }

    // registered before it can run so the worker's removal always finds it
    var task = new FutureTask<Void>(() -> executeRun(record), null);
    activeRuns.put(run.getId(), task);
    try {
      executor.execute(task);
      log.info(
          "Run {} submitted with categories {}",
          run.getId(),
          run.getConfiguration().categories().keySet());
      var statusSnapshot = record.getStatus();
      var message =
          switch (statusSnapshot) {
            case QUEUED -> "Run queued";
            case PROCESSING -> "Run is processing";
            case COMPLETED -> "Run completed";
            case ERROR -> "Run failed";
            case CANCELLED -> "Run cancelled";
          };
      return Optional.of(new RunSubmissionOutcome(run.getId(), statusSnapshot, message));
    } catch (RejectedExecutionException ex) {
      log.warn("Run {} rejected: {}", run.getId(), ex.getMessage());
      activeRuns.remove(run.getId());
      runRecords.remove(run.getId());
      return Optional.of(
          new RunSubmissionOutcome(run.getId(), RunStatus.ERROR, "Service is shutting down"));
    }
  }

  private void executeRun(RunRecord record) {
    var runId = record.getRunId();
    try {
      if (record.isStopRequested()) {
        record.markCancelled(Instant.now(), null);
        totalCancelled.incrementAndGet();
        log.info("Run {} cancelled before start", runId);
        return;
      }

      record.markProcessing(Instant.now());
      log.info("Run {} started", runId);

      var session = sessionFactory.open();
      var runRunner = runnerFor(record.getRun());
      RunSummary summary;
      try (var reporter =
          new AsyncProgressReporter(
              new CompositeProgressReporter(List.of(loggingReporter, record.getState())),
              "benchmark-progress-" + runId,
              properties.getRuns().getProgressDrainTimeout())) {
        summary =
            runRunner.run(
                record.getRun().getConfiguration(), session, reporter, record::isStopRequested);
      }

      if (summary.cancelled()) {
        record.markCancelled(Instant.now(), summary);
        totalCancelled.incrementAndGet();
        log.info("Run {} cancelled after {} units", runId, summary.totals().unitsCompleted());
      } else {
        record.markCompleted(Instant.now(), summary);
        totalCompleted.incrementAndGet();
        log.info(
            "Run {} completed: {} units, {} failed",
            runId,
            summary.unitsPlanned(),
            summary.unitsFailed());
      }
    } catch (Exception ex) {
      record.markErrored(Instant.now(), ex.getMessage());
      totalFailed.incrementAndGet();
      log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
    } finally {
      activeRuns.remove(runId);
      addToHistory(record);
    }
  }

  private BenchmarkRunner runnerFor(BenchmarkRun run) {
    return run.getIterations() == null ? runner : runner.withIterations(run.getIterations());
  }

  /** Finished runs that fall out of the history are forgotten entirely, results included. */
  private synchronized void addToHistory(RunRecord record) {
    runHistory.addFirst(record);
    while (runHistory.size() > properties.getRuns().getHistorySize()) {
      var evicted = runHistory.pollLast();
      if (evicted != null) {
        runRecords.remove(evicted.getRunId());
        log.debug("Run {} evicted from history", evicted.getRunId());
      }
    }
  }

  public Optional<RunStatusResponse> getRunStatus(UUID runId) {
    return Optional.ofNullable(runRecords.get(runId)).map(this::toStatusResponse);
  }

  /** Results of the units completed so far, with totals folded from them. */
  public Optional<RunResultsResponse> getRunResults(UUID runId) {
    var record = runRecords.get(runId);
    if (record == null) {
      return Optional.empty();
    }
    List<UnitResult> results = record.getState().results();
    var totals = RunningTotals.EMPTY;
    for (UnitResult result : results) {
      totals = RunningTotalsAggregator.fold(result, totals);
    }
    var status = record.getStatus();
    return Optional.of(
        new RunResultsResponse(
            runId, status, results, AggregateEvent.of(totals, status == RunStatus.CANCELLED)));
  }

  public Collection<RunStatusResponse> getAllRuns() {
    List<RunStatusResponse> responses = new ArrayList<>();
    for (RunRecord record : runRecords.values()) {
      responses.add(toStatusResponse(record));
    }
    return responses;
  }

  /** Most recent finished runs, newest first, up to the configured history size. */
  public List<RunHistoryEntry> getRunHistory() {
    List<RunHistoryEntry> snapshot = new ArrayList<>();
    for (RunRecord record : runHistory) {
      var totals = record.getSummary().map(RunSummary::totals).orElse(RunningTotals.EMPTY);
      snapshot.add(
          new RunHistoryEntry(
              record.getRunId(),
              record.getStatus(),
              record.getStartedAt().orElse(null),
              record.getCompletedAt().orElse(null),
              record.getProcessingDurationMillis(),
              totals.unitsCompleted(),
              totals.winsA(),
              totals.winsB(),
              record.getErrorMessage().orElse(null)));
    }
    return snapshot;
  }

  public List<ScenarioCategory> getScenarioCategories() {
    return library.categories();
  }

  public LibraryValidationSummary validateScenarioLibrary() {
    return libraryValidator.validate(library);
  }

  /**
   * Cancels a queued run or asks a processing run to stop after its current unit.
   *
   * @param runId id of the run to cancel
   * @return the cancellation outcome and the run's status at that point
   */
  public CancellationResult cancelRun(UUID runId) {
    var record = runRecords.get(runId);
    if (record == null) {
      return CancellationResult.notFound();
    }
    var status = record.getStatus();
    if (status.isTerminal()) {
      return CancellationResult.notCancellable(status);
    }

    record.requestStop();
    Future<?> future = activeRuns.get(runId);
    if (status == RunStatus.QUEUED && future != null && future.cancel(false)) {
      record.markCancelled(Instant.now(), null);
      totalCancelled.incrementAndGet();
      activeRuns.remove(runId);
      addToHistory(record);
      log.info("Run {} cancelled while queued", runId);
      return CancellationResult.cancelled(record.getStatus());
    }

    log.info("Run {} stop requested", runId);
    return CancellationResult.cancellationRequested(record.getStatus());
  }

  /** Stops accepting runs and lets the current one finish. */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      runRecords.values().stream()
          .filter(r -> r.getStatus() == RunStatus.PROCESSING)
          .forEach(RunRecord::requestStop);
      executor.shutdown();
    }
  }

  @PreDestroy
  void onShutdown() {
    log.info(
        "Shutting down: completed={} failed={} cancelled={}",
        totalCompleted.get(),
        totalFailed.get(),
        totalCancelled.get());
    shutdown();
  }

  @VisibleForTesting
  int activeRunCount() {
    return activeRuns.size();
  }

  public boolean isHealthy() {
    return acceptingRuns.get() && !executor.isShutdown();
  }

  private RunStatusResponse toStatusResponse(RunRecord record) {
    var state = record.getState();
    List<UnitStatusView> units = state.unitStates().stream().map(this::toView).toList();
    return new RunStatusResponse(
        record.getRunId(),
        record.getStatus(),
        record.getSubmittedAt(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getProcessingDurationMillis(),
        record.getErrorMessage().orElse(null),
        units.size(),
        (int) state.count(UnitStatus.COMPLETED),
        (int) state.count(UnitStatus.FAILED),
        units,
        state.aggregate().orElse(null));
  }

  private UnitStatusView toView(UnitStatusEvent event) {
    return new UnitStatusView(
        event.unitId(),
        event.displayName(),
        event.status(),
        event.percent(),
        event.startedAt(),
        event.endedAt(),
        event.error());
  }

  /** Describes the outcome of a cancellation attempt for a run. */
  @Getter
  public static class CancellationResult {
    public enum CancellationState {
      CANCELLED,
      CANCELLATION_REQUESTED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final RunStatus runStatus;

    private CancellationResult(CancellationState state, RunStatus runStatus) {
      this.state = state;
      this.runStatus = runStatus;
    }

    public static CancellationResult cancelled(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLED, status);
    }

    public static CancellationResult cancellationRequested(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, status);
    }

    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    public static CancellationResult notCancellable(RunStatus status) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, status);
    }
  }
}
