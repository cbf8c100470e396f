package com.mk.fx.qa.benchmark.execution.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("API Benchmark Runner")
                .description(
                    "Runs Table API versus GraphQL benchmark matrices and reports the verdicts."));
  }
}
