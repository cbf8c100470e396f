package com.mk.fx.qa.benchmark.execution.verdict;

public enum Winner {
  A,
  B,
  TIE
}
