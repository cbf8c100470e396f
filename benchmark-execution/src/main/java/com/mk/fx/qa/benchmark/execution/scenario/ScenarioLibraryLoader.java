package com.mk.fx.qa.benchmark.execution.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.benchmark.execution.exception.ConfigurationException;
import com.mk.fx.qa.benchmark.execution.request.ResourceQuery;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a scenario library from JSON.
 *
 * <p>A variant with a non-empty {@code calls} array becomes a {@link CompositeScenario}; any other
 * variant must name a {@code table} and becomes a {@link SingleResourceScenario}.
 */
@Slf4j
public class ScenarioLibraryLoader {

  public static final String DEFAULT_RESOURCE = "scenarios.json";

  private final ObjectMapper mapper;

  public ScenarioLibraryLoader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /** Loads {@code resource} from the classpath. */
  public ScenarioLibrary loadClasspath(String resource) {
    try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigurationException("Scenario library not found on classpath: " + resource);
      }
      return load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read scenario library " + resource, e);
    }
  }

  public ScenarioLibrary load(InputStream in) throws IOException {
    var document = mapper.readValue(in, LibraryDocument.class);
    List<ScenarioCategory> categories = new ArrayList<>();
    for (CategoryDocument category : document.getCategories()) {
      if (category.getKey() == null || category.getKey().isBlank()) {
        throw new ConfigurationException("Scenario category without a key");
      }
      Map<String, ScenarioSpec> variants = new LinkedHashMap<>();
      category
          .getVariants()
          .forEach((key, variant) -> variants.put(key, toSpec(category, key, variant)));
      categories.add(
          new ScenarioCategory(
              category.getKey(), category.getTitle(), category.getDescription(), variants));
    }
    log.info(
        "Loaded scenario library with {} categories and {} variants",
        categories.size(),
        categories.stream().mapToInt(c -> c.variants().size()).sum());
    return new ScenarioLibrary(categories);
  }

  private static ScenarioSpec toSpec(
      CategoryDocument category, String key, VariantDocument variant) {
    if (variant.getCalls() != null && !variant.getCalls().isEmpty()) {
      var calls =
          variant.getCalls().stream()
              .map(c -> new ResourceQuery(c.getTable(), c.getFields(), c.getFilter()))
              .toList();
      return new CompositeScenario(
          variant.getDescription(), calls, variant.getTables(), variant.getRecordLimits());
    }
    if (variant.getTable() == null) {
      throw new ConfigurationException(
          "Variant " + category.getKey() + "." + key + " declares neither a table nor calls");
    }
    return new SingleResourceScenario(
        variant.getDescription(),
        new ResourceQuery(variant.getTable(), variant.getFields(), variant.getFilter()),
        variant.getRecordLimits());
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class LibraryDocument {
    private List<CategoryDocument> categories = new ArrayList<>();
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class CategoryDocument {
    private String key;
    private String title;
    private String description;
    private LinkedHashMap<String, VariantDocument> variants = new LinkedHashMap<>();
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class VariantDocument {
    private String description;
    private String table;
    private List<String> fields = new ArrayList<>();
    private String filter;
    private List<CallDocument> calls;
    private List<String> tables;
    private List<Integer> recordLimits;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class CallDocument {
    private String table;
    private List<String> fields = new ArrayList<>();
    private String filter;
  }
}
