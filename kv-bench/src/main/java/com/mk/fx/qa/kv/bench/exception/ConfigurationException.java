package com.mk.fx.qa.kv.bench.exception;

/** Invalid run configuration. Raised before any request is issued. */
public class ConfigurationException extends BenchmarkException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
