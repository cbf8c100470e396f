package com.mk.fx.qa.benchmark.execution.resource;

import static com.mk.fx.qa.benchmark.execution.model.RunStatus.CANCELLED;
import static com.mk.fx.qa.benchmark.execution.model.RunStatus.PROCESSING;

import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.BenchmarkRunRequest;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunCancellationResponse;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunHistoryEntry;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunSubmissionOutcome;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunSubmissionResponse;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.ScenarioCatalogEntry;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkRun;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import com.mk.fx.qa.benchmark.execution.scenario.LibraryValidationSummary;
import com.mk.fx.qa.benchmark.execution.service.BenchmarkRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Benchmark Runs",
    description = "Endpoints for starting, monitoring and stopping Table API vs GraphQL runs")
@RestController
@RequestMapping("/api/benchmarks")
@Validated
@RequiredArgsConstructor
public class BenchmarkController {

  private final BenchmarkRunService runService;
  private final RunMapper runMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Run submission
  // -----------------------------------------------------
  @Operation(
      summary = "Start a benchmark run",
      description = "Queues a run over the selected categories, variants and record limits.")
  @PostMapping
  public ResponseEntity<RunSubmissionResponse> submitRun(
      @Valid @RequestBody BenchmarkRunRequest request) {
    log.info("Received benchmark run for categories {}", request.getCategories().keySet());
    BenchmarkRun run = runMapper.toDomain(request);
    Optional<RunSubmissionOutcome> outcomeOpt = runService.submitRun(run);

    if (outcomeOpt.isEmpty()) {
      return responseFactory.unavailable(
          new RunSubmissionResponse(null, CANCELLED, "Service not accepting new runs"));
    }

    RunSubmissionOutcome outcome = outcomeOpt.get();
    log.info("Run {} submitted with status {}", outcome.runId(), outcome.status());
    return ResponseEntity.status(mapStatus(outcome.status()))
        .body(new RunSubmissionResponse(outcome.runId(), outcome.status(), outcome.message()));
  }

  // -----------------------------------------------------
  // Run status, results and control
  // -----------------------------------------------------
  @Operation(summary = "Get run status", description = "Returns a run's status and unit states.")
  @GetMapping("/{runId}")
  public ResponseEntity<RunStatusResponse> getRunStatus(@PathVariable UUID runId) {
    return runService
        .getRunStatus(runId)
        .map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Run {} not found", runId);
              return ResponseEntity.notFound().build();
            });
  }

  @Operation(
      summary = "Get run results",
      description = "Returns the results of completed units with their running totals.")
  @GetMapping("/{runId}/results")
  public ResponseEntity<?> getRunResults(@PathVariable UUID runId) {
    return runService
        .getRunResults(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () ->
                responseFactory.error(
                    HttpStatus.NOT_FOUND, "Not Found", "Results not found for run: " + runId));
  }

  @Operation(
      summary = "Stop run",
      description = "Cancels a queued run or stops a running one after its current unit.")
  @DeleteMapping("/{runId}")
  public ResponseEntity<?> cancelRun(@PathVariable UUID runId) {
    var result = runService.cancelRun(runId);
    log.info("Cancellation requested for {} -> {}", runId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.error(HttpStatus.NOT_FOUND, "Not Found", "Run not found");
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Run cannot be cancelled in its current state");
      case CANCELLED -> ResponseEntity.ok(
          new RunCancellationResponse(runId, CANCELLED, "Run cancelled"));
      case CANCELLATION_REQUESTED -> {
        RunStatus current =
            runService
                .getRunStatus(runId)
                .map(RunStatusResponse::status)
                .orElse(PROCESSING);
        yield ResponseEntity.ok(
            new RunCancellationResponse(runId, current, "Stop requested after current unit"));
      }
    };
  }

  // -----------------------------------------------------
  // Listings and history
  // -----------------------------------------------------
  @Operation(summary = "List runs", description = "Lists every run known to this instance.")
  @GetMapping
  public ResponseEntity<Collection<RunStatusResponse>> getRuns() {
    return ResponseEntity.ok(runService.getAllRuns());
  }

  @Operation(summary = "Run history", description = "Returns recently finished runs.")
  @GetMapping("/history")
  public ResponseEntity<List<RunHistoryEntry>> getRunHistory() {
    return ResponseEntity.ok(runService.getRunHistory());
  }

  // -----------------------------------------------------
  // Scenario library
  // -----------------------------------------------------
  @Operation(summary = "Scenario catalogue", description = "Lists categories and their variants.")
  @GetMapping("/scenarios")
  public ResponseEntity<List<ScenarioCatalogEntry>> getScenarios() {
    return ResponseEntity.ok(
        runService.getScenarioCategories().stream().map(runMapper::toCatalogEntry).toList());
  }

  @Operation(
      summary = "Validate scenario library",
      description = "Checks every composite scenario and reports its complexity.")
  @GetMapping("/scenarios/validation")
  public ResponseEntity<LibraryValidationSummary> validateScenarios() {
    return ResponseEntity.ok(runService.validateScenarioLibrary());
  }

  // -----------------------------------------------------
  // Misc endpoints
  // -----------------------------------------------------
  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = runService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------
  private HttpStatus mapStatus(RunStatus status) {
    return switch (status) {
      case COMPLETED -> HttpStatus.OK;
      case PROCESSING, QUEUED -> HttpStatus.ACCEPTED;
      case ERROR -> HttpStatus.BAD_REQUEST;
      case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }
}
