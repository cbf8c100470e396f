package com.mk.fx.qa.benchmark.execution.resource;

import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.BenchmarkRunRequest;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.ScenarioCatalogEntry;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkRun;
import com.mk.fx.qa.benchmark.execution.scenario.CompositeScenario;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioCategory;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioSpec;
import com.mk.fx.qa.benchmark.execution.scenario.SingleResourceScenario;
import com.mk.fx.qa.benchmark.execution.scenario.TestConfiguration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(
    componentModel = "spring",
    imports = {UUID.class, Instant.class, TestConfiguration.class})
public interface RunMapper {

  @Mapping(target = "id", expression = "java(UUID.randomUUID())")
  @Mapping(target = "createdAt", expression = "java(Instant.now())")
  @Mapping(
      target = "configuration",
      expression = "java(new TestConfiguration(request.getCategories()))")
  BenchmarkRun toDomain(BenchmarkRunRequest request);

  default ScenarioCatalogEntry toCatalogEntry(ScenarioCategory category) {
    List<ScenarioCatalogEntry.Variant> variants = new ArrayList<>();
    for (Map.Entry<String, ScenarioSpec> entry : category.variants().entrySet()) {
      variants.add(toVariant(entry.getKey(), entry.getValue()));
    }
    return new ScenarioCatalogEntry(
        category.key(), category.title(), category.description(), variants);
  }

  default ScenarioCatalogEntry.Variant toVariant(String key, ScenarioSpec spec) {
    List<String> tables;
    if (spec instanceof SingleResourceScenario single) {
      tables = List.of(single.query().table());
    } else if (spec instanceof CompositeScenario composite) {
      tables = composite.callTables();
    } else {
      tables = List.of();
    }
    return new ScenarioCatalogEntry.Variant(
        key, spec.kind(), spec.description(), tables, spec.recordLimits());
  }
}
