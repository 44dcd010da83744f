package com.mk.fx.qa.kv.bench.trace;

import java.io.Closeable;

/**
 * Sink for invocation and response events, consumed offline by a linearizability checker. The
 * issuer and the collector append concurrently.
 */
public interface OperationTrace extends Closeable {

  /** Trace that drops every event. */
  OperationTrace NONE =
      new OperationTrace() {
        @Override
        public void record(TraceEvent event) {}

        @Override
        public void close() {}
      };

  void record(TraceEvent event);

  @Override
  void close();
}
