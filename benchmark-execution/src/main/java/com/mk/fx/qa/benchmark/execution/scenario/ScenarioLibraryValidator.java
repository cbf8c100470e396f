package com.mk.fx.qa.benchmark.execution.scenario;

import com.mk.fx.qa.benchmark.execution.request.RequestBuilder;
import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import com.mk.fx.qa.benchmark.execution.request.ValidationError;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks every composite scenario of a library against the builder's structural rules and flags
 * the ones likely to perform poorly.
 */
@Slf4j
public class ScenarioLibraryValidator {

  static final int HIGH_COMPLEXITY = 300;
  static final int MANY_TABLES = 5;
  static final int MANY_FIELDS = 50;
  static final int MANY_TRAVERSALS = 10;

  private final RequestBuilder requestBuilder;

  public ScenarioLibraryValidator(RequestBuilder requestBuilder) {
    this.requestBuilder = requestBuilder;
  }

  public LibraryValidationSummary validate(ScenarioLibrary library) {
    List<CompositeCheck> checks = new ArrayList<>();
    for (ScenarioCategory category : library.categories()) {
      category.variants().forEach(
          (key, spec) -> {
            if (spec instanceof CompositeScenario composite) {
              checks.add(check(category.key(), key, composite));
            }
          });
    }

    var failed = (int) checks.stream().filter(c -> !c.valid()).count();
    var highComplexity =
        (int) checks.stream().filter(c -> c.complexityScore() > HIGH_COMPLEXITY).count();
    LibraryValidationSummary.Status status;
    if (failed > 0) {
      status = LibraryValidationSummary.Status.FAILED;
    } else if (highComplexity > checks.size() * 0.3) {
      status = LibraryValidationSummary.Status.WARNING;
    } else {
      status = LibraryValidationSummary.Status.READY;
    }

    var summary =
        new LibraryValidationSummary(
            status, checks.size(), checks.size() - failed, failed, highComplexity, checks);
    log.info(
        "Scenario library check: status={} composites={} failed={} highComplexity={}",
        status,
        checks.size(),
        failed,
        highComplexity);
    checks.stream()
        .filter(c -> !c.valid())
        .forEach(
            c -> log.warn("Composite {}.{} is invalid: {}", c.category(), c.variant(), c.errors()));
    return summary;
  }

  CompositeCheck check(String category, String variant, CompositeScenario scenario) {
    List<String> errors = new ArrayList<>();
    requestBuilder.validateComposite(scenario.calls()).stream()
        .map(ValidationError::toString)
        .forEach(errors::add);
    if (!scenario.declaredTablesMatchCalls()) {
      errors.add(
          "tables: declared " + scenario.tables() + " but calls use " + scenario.callTables());
    }

    var calls = scenario.calls();
    var complexity = requestBuilder.complexityScore(calls);
    var totalFields = calls.stream().mapToInt(c -> c.fields().size()).sum();
    var traversals =
        calls.stream()
            .map(ResourceQuery::fields)
            .mapToLong(fields -> fields.stream().filter(f -> f.contains(".")).count())
            .sum();

    List<String> warnings = new ArrayList<>();
    if (complexity > HIGH_COMPLEXITY) {
      warnings.add("High query complexity (" + complexity + ") may impact performance");
    }
    if (calls.size() > MANY_TABLES) {
      warnings.add(
          "Query spans " + calls.size() + " tables, consider breaking into smaller queries");
    }
    if (totalFields > MANY_FIELDS) {
      warnings.add("Total field count (" + totalFields + ") is high");
    }
    if (traversals > MANY_TRAVERSALS) {
      warnings.add("High number of relationship traversals (" + traversals + ")");
    }

    return new CompositeCheck(
        category,
        variant,
        errors.isEmpty(),
        errors,
        warnings,
        complexity,
        calls.size(),
        totalFields,
        (int) traversals);
  }

  public record CompositeCheck(
      String category,
      String variant,
      boolean valid,
      List<String> errors,
      List<String> warnings,
      int complexityScore,
      int tableCount,
      int totalFields,
      int dotWalkingFields) {}
}
