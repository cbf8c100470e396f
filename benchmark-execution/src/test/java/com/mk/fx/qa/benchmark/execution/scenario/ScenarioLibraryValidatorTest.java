package com.mk.fx.qa.benchmark.execution.scenario;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import com.mk.fx.qa.benchmark.execution.request.TableApiRequestBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ScenarioLibraryValidatorTest {

  private final ScenarioLibraryValidator validator =
      new ScenarioLibraryValidator(new TableApiRequestBuilder());

  private static ScenarioLibrary libraryOf(Map<String, ScenarioSpec> variants) {
    return new ScenarioLibrary(List.of(new ScenarioCategory("multi", "Multi", "", variants)));
  }

  private static CompositeScenario composite(List<String> tables, ResourceQuery... calls) {
    return new CompositeScenario("", List.of(calls), tables, List.of());
  }

  @Test
  void validate_bundledLibraryIsReady() {
    var library =
        new ScenarioLibraryLoader(new ObjectMapper())
            .loadClasspath(ScenarioLibraryLoader.DEFAULT_RESOURCE);

    var summary = validator.validate(library);

    assertThat(summary.status()).isEqualTo(LibraryValidationSummary.Status.READY);
    assertThat(summary.totalComposites()).isEqualTo(13);
    assertThat(summary.failedComposites()).isZero();
  }

  @Test
  void validate_failsWhenDeclaredTablesDifferFromCalls() {
    Map<String, ScenarioSpec> variants = new LinkedHashMap<>();
    variants.put(
        "good",
        composite(List.of(), new ResourceQuery("incident", List.of("number"), null)));
    variants.put(
        "bad",
        composite(
            List.of("incident", "problem"),
            new ResourceQuery("incident", List.of("number"), null)));
    variants.put(
        "single",
        new SingleResourceScenario("", new ResourceQuery("incident", List.of(), null), List.of()));

    var summary = validator.validate(libraryOf(variants));

    assertThat(summary.status()).isEqualTo(LibraryValidationSummary.Status.FAILED);
    assertThat(summary.totalComposites()).isEqualTo(2);
    assertThat(summary.validComposites()).isEqualTo(1);
    var bad =
        summary.checks().stream().filter(c -> c.variant().equals("bad")).findFirst().orElseThrow();
    assertThat(bad.errors()).hasSize(1);
    assertThat(bad.errors().get(0)).startsWith("tables:");
  }

  @Test
  void check_flagsWideQueries() {
    List<ResourceQuery> calls = new ArrayList<>();
    IntStream.range(0, 6)
        .forEach(
            i ->
                calls.add(
                    new ResourceQuery(
                        "table_" + i,
                        List.of("number", "assigned_to.name", "caller_id.email"),
                        "active=true^ORpriority=1")));
    var scenario = new CompositeScenario("", calls, List.of(), List.of());

    var check = validator.check("multi", "wide", scenario);

    assertThat(check.valid()).isTrue();
    assertThat(check.tableCount()).isEqualTo(6);
    assertThat(check.totalFields()).isEqualTo(18);
    assertThat(check.dotWalkingFields()).isEqualTo(12);
    // 6 * (10 + 3*2 + 2*5 + 10)
    assertThat(check.complexityScore()).isEqualTo(216);
    assertThat(check.warnings())
        .anyMatch(w -> w.startsWith("Query spans 6 tables"))
        .anyMatch(w -> w.startsWith("High number of relationship traversals"));
  }

  @Test
  void validate_warnsWhenManyCompositesAreComplex() {
    List<ResourceQuery> heavy = new ArrayList<>();
    IntStream.range(0, 8)
        .forEach(
            i ->
                heavy.add(
                    new ResourceQuery(
                        "t" + i, List.of("a.b", "c.d", "e.f"), "x=1^ORy=2")));
    Map<String, ScenarioSpec> variants = new LinkedHashMap<>();
    variants.put("heavy", new CompositeScenario("", heavy, List.of(), List.of()));
    variants.put(
        "light", composite(List.of(), new ResourceQuery("incident", List.of("number"), null)));

    var summary = validator.validate(libraryOf(variants));

    assertThat(summary.highComplexityComposites()).isEqualTo(1);
    assertThat(summary.status()).isEqualTo(LibraryValidationSummary.Status.WARNING);
  }
}
