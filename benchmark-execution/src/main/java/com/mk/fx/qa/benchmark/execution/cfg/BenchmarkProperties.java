package com.mk.fx.qa.benchmark.execution.cfg;

import com.mk.fx.qa.benchmark.execution.auth.AuthMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "benchmark")
public class BenchmarkProperties {

  /** Classpath resource holding the scenario library. */
  @NotBlank private String scenarioLibrary = "scenarios.json";

  @Valid private Instance instance = new Instance();
  @Valid private Auth auth = new Auth();
  @Valid private Execution execution = new Execution();
  @Valid private Runs runs = new Runs();

  @Data
  public static class Instance {
    /** Instance under test; there is no default. */
    @NotBlank private String baseUrl;

    @Min(1)
    private int connectTimeoutSeconds = 10;

    /** Upper bound for every single HTTP call, including each trial attempt. */
    @Min(1)
    private int requestTimeoutSeconds = 30;
  }

  @Data
  public static class Auth {
    @NotNull private AuthMode mode = AuthMode.CREDENTIAL;
    private String username;
    private String password;
    @NotBlank private String tokenEndpoint = "/api/elosa/api_benchmark/get-token";
  }

  @Data
  public static class Execution {
    @Min(1)
    @Max(100)
    private int iterations = 3;

    @NotNull private Duration settleDelay = Duration.ofMillis(100);
  }

  @Data
  public static class Runs {
    @Positive private int historySize = 50;
    @NotNull private Duration progressDrainTimeout = Duration.ofSeconds(5);
  }
}
