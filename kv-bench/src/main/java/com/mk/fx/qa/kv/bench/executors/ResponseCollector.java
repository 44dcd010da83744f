package com.mk.fx.qa.kv.bench.executors;

import com.mk.fx.qa.kv.bench.metrics.Summary;

/** Consumes acknowledgements until the deadline and owns the run's {@link Summary}. */
public interface ResponseCollector {

  Summary collect() throws InterruptedException;
}
