package com.mk.fx.qa.kv.bench.exception;

/** The issuer or collector task failed, or did not stop after the deadline. */
public class BenchmarkExecutionException extends BenchmarkException {

  public BenchmarkExecutionException(String message) {
    super(message);
  }

  public BenchmarkExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
