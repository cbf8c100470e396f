package com.mk.fx.qa.benchmark.execution.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.benchmark.execution.auth.AuthGateway;
import com.mk.fx.qa.benchmark.execution.auth.AuthMode;
import com.mk.fx.qa.benchmark.execution.auth.AuthSessionFactory;
import com.mk.fx.qa.benchmark.execution.auth.AuthTokenProvider;
import com.mk.fx.qa.benchmark.execution.auth.SessionTokenProvider;
import com.mk.fx.qa.benchmark.execution.compare.RecordSetComparator;
import com.mk.fx.qa.benchmark.execution.compare.ResponseComparator;
import com.mk.fx.qa.benchmark.execution.executor.DualStyleExecutor;
import com.mk.fx.qa.benchmark.execution.request.RequestBuilder;
import com.mk.fx.qa.benchmark.execution.request.TableApiRequestBuilder;
import com.mk.fx.qa.benchmark.execution.run.BenchmarkRunner;
import com.mk.fx.qa.benchmark.execution.scenario.LibraryValidationSummary;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioExpander;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibrary;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibraryLoader;
import com.mk.fx.qa.benchmark.execution.scenario.ScenarioLibraryValidator;
import com.mk.fx.qa.benchmark.execution.trial.TrialRunner;
import com.mk.fx.qa.benchmark.rest.RestHttpClient;
import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the benchmark engine from {@link BenchmarkProperties}. */
@Slf4j
@Configuration
public class BenchmarkBeansCfg {

  @Bean
  public Clock benchmarkClock() {
    return Clock.systemUTC();
  }

  @Bean
  public RestHttpClient benchmarkHttpClient(BenchmarkProperties properties) {
    var instance = properties.getInstance();
    return new RestHttpClient(
        instance.getBaseUrl(),
        instance.getConnectTimeoutSeconds(),
        instance.getRequestTimeoutSeconds(),
        Map.of());
  }

  @Bean
  public AuthTokenProvider authTokenProvider(
      RestHttpClient benchmarkHttpClient, BenchmarkProperties properties) {
    return new SessionTokenProvider(
        benchmarkHttpClient, properties.getAuth().getTokenEndpoint());
  }

  @Bean
  public AuthSessionFactory authSessionFactory(
      BenchmarkProperties properties, AuthTokenProvider authTokenProvider) {
    var auth = properties.getAuth();
    return new AuthSessionFactory(
        auth.getMode(),
        auth.getUsername(),
        auth.getPassword(),
        properties.getInstance().getBaseUrl(),
        auth.getMode() == AuthMode.TOKEN ? authTokenProvider : null);
  }

  @Bean
  public AuthGateway authGateway(
      RestHttpClient benchmarkHttpClient, AuthTokenProvider authTokenProvider) {
    return new AuthGateway(benchmarkHttpClient, authTokenProvider);
  }

  @Bean
  public RequestBuilder requestBuilder() {
    return new TableApiRequestBuilder();
  }

  @Bean
  public ResponseComparator responseComparator() {
    return new RecordSetComparator();
  }

  @Bean
  public TrialRunner trialRunner(AuthGateway authGateway, BenchmarkProperties properties) {
    return new TrialRunner(authGateway, properties.getExecution().getSettleDelay());
  }

  @Bean
  public ScenarioLibraryValidator scenarioLibraryValidator(RequestBuilder requestBuilder) {
    return new ScenarioLibraryValidator(requestBuilder);
  }

  @Bean
  public ScenarioLibrary scenarioLibrary(
      ObjectMapper objectMapper,
      BenchmarkProperties properties,
      ScenarioLibraryValidator scenarioLibraryValidator) {
    var library =
        new ScenarioLibraryLoader(objectMapper).loadClasspath(properties.getScenarioLibrary());
    var summary = scenarioLibraryValidator.validate(library);
    if (summary.status() == LibraryValidationSummary.Status.FAILED) {
      log.warn(
          "Scenario library has {} invalid composite scenarios; those units will fail when run",
          summary.failedComposites());
    }
    return library;
  }

  @Bean
  public ScenarioExpander scenarioExpander(ScenarioLibrary scenarioLibrary) {
    return new ScenarioExpander(scenarioLibrary);
  }

  @Bean
  public DualStyleExecutor dualStyleExecutor(
      RequestBuilder requestBuilder,
      TrialRunner trialRunner,
      ResponseComparator responseComparator,
      BenchmarkProperties properties,
      Clock benchmarkClock) {
    return new DualStyleExecutor(
        requestBuilder,
        trialRunner,
        responseComparator,
        properties.getExecution().getIterations(),
        benchmarkClock);
  }

  @Bean
  public BenchmarkRunner benchmarkRunner(
      ScenarioLibrary scenarioLibrary,
      ScenarioExpander scenarioExpander,
      DualStyleExecutor dualStyleExecutor,
      Clock benchmarkClock) {
    return new BenchmarkRunner(
        scenarioLibrary, scenarioExpander, dualStyleExecutor, benchmarkClock);
  }
}
