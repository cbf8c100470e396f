package com.mk.fx.qa.benchmark.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BenchmarkApplication {

  public static void main(String[] args) {
    SpringApplication.run(BenchmarkApplication.class, args);
  }
}
