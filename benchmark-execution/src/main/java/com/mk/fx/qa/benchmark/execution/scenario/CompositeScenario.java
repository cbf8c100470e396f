package com.mk.fx.qa.benchmark.execution.scenario;

import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import java.util.HashSet;
import java.util.List;

/**
 * Several direct calls fused into one logical request.
 *
 * @param calls the direct calls, executed in order
 * @param tables tables the scenario declares; empty when undeclared
 */
public record CompositeScenario(
    String description, List<ResourceQuery> calls, List<String> tables, List<Integer> recordLimits)
    implements ScenarioSpec {

  public CompositeScenario {
    calls = calls == null ? List.of() : List.copyOf(calls);
    tables = tables == null ? List.of() : List.copyOf(tables);
    recordLimits = recordLimits == null ? List.of() : List.copyOf(recordLimits);
  }

  /** Distinct tables named by the calls, in call order. */
  public List<String> callTables() {
    return calls.stream().map(ResourceQuery::table).distinct().toList();
  }

  /** True when no tables are declared or the declared set equals the tables of the calls. */
  public boolean declaredTablesMatchCalls() {
    return tables.isEmpty() || new HashSet<>(tables).equals(new HashSet<>(callTables()));
  }

  @Override
  public ScenarioKind kind() {
    return ScenarioKind.COMPOSITE;
  }
}
