package com.mk.fx.qa.kv.bench.exception;

/** Base type of the failures that abort a benchmark run. */
public abstract class BenchmarkException extends RuntimeException {

  protected BenchmarkException(String message) {
    super(message);
  }

  protected BenchmarkException(String message, Throwable cause) {
    super(message, cause);
  }
}
