package com.mk.fx.qa.kv.bench.executors;

import com.mk.fx.qa.kv.bench.metrics.Summary;

/**
 * Outcome of one run.
 *
 * @param summary the collector's measurements
 * @param issuedBatches batches written by the issuer
 * @param outstandingUnits admission units still reserved when the run ended
 */
public record BenchmarkResult(Summary summary, long issuedBatches, long outstandingUnits) {}
