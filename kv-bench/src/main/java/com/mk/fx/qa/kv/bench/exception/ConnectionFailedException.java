package com.mk.fx.qa.kv.bench.exception;

/** The server endpoint could not be dialled. The run stops instead of using a dead connection. */
public class ConnectionFailedException extends BenchmarkException {

  public ConnectionFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
