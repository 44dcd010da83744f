package com.mk.fx.qa.kv.bench.executors.abd;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.kv.bench.admission.AdmissionLedger;
import com.mk.fx.qa.kv.bench.admission.RunDeadline;
import com.mk.fx.qa.kv.bench.executors.ResponseCollector;
import com.mk.fx.qa.kv.bench.metrics.Summary;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.trace.TraceEvent;
import com.mk.fx.qa.kv.bench.wire.codec.WireFormatException;
import com.mk.fx.qa.kv.bench.wire.model.Response;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Matches decoded responses to transactions. A transaction may be acknowledged in fragments; its
 * admission unit is released exactly once, when the acknowledged total first reaches the
 * transaction's size. A fragment whose size lies outside the transaction's size is counted as a
 * decode failure and skipped; totals are clamped, so duplicate fragments cannot release twice.
 */
@Slf4j
public final class AbdResponseCollector implements ResponseCollector {

  private static final long POLL_MILLIS = 50L;

  private final RunParameters parameters;
  private final BlockingQueue<DecodeResult> results;
  private final AdmissionLedger ledger;
  private final RunDeadline deadline;
  private final OperationTrace trace;
  private final Clock clock;
  private final Summary summary;
  // entries stay after completion so that late fragments are ignored
  private final Map<Long, Integer> acknowledged = new HashMap<>();
  private long released;

  public AbdResponseCollector(
      RunParameters parameters,
      BlockingQueue<DecodeResult> results,
      AdmissionLedger ledger,
      RunDeadline deadline,
      OperationTrace trace,
      Clock clock) {
    this.parameters = parameters;
    this.results = results;
    this.ledger = ledger;
    this.deadline = deadline;
    this.trace = trace;
    this.clock = clock;
    this.summary = new Summary(parameters.requestCount());
  }

  @Override
  public Summary collect() throws InterruptedException {
    while (!deadline.expired()) {
      DecodeResult result = results.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (result == null) {
        continue;
      }
      switch (result.status()) {
        case DECODED -> onResponse(result.response());
        case FAILED -> onFailure(result);
        case STREAM_ENDED -> {
          onFailure(result);
          // nothing more will arrive
          deadline.await();
        }
      }
    }
    log.info(
        "ABD collector done: {} operations acknowledged, {} transactions completed,"
            + " {} decode failures",
        summary.getAcknowledged(),
        released,
        summary.getDecodeFailures());
    return summary;
  }

  @VisibleForTesting
  void onResponse(Response response) {
    int size = response.size();
    int expected = expectedSize(response.transactionId());
    if (size <= 0 || size > expected) {
      onMalformed(response, expected);
      return;
    }
    long latency = clock.millis() - response.timestamp();
    summary.recordAcknowledged(size, latency);
    if (response.carriesValues()) {
      summary.recordReads(size);
      if (response.tookSlowPath()) {
        summary.recordSlow(size);
      }
    }

    int previous = acknowledged.getOrDefault(response.transactionId(), 0);
    if (previous < expected) {
      int total = Math.min(expected, previous + size);
      acknowledged.put(response.transactionId(), total);
      if (total == expected) {
        ledger.release(1);
        released++;
      }
    }
    traceResponse(response);
  }

  /**
   * Operations in the transaction with the given id. Every batch is full except possibly the last
   * one, whose id is the request count.
   */
  private int expectedSize(long transactionId) {
    int batchSize = parameters.batchSize();
    int remainder = parameters.requestCount() % batchSize;
    if (remainder != 0 && transactionId == parameters.requestCount()) {
      return remainder;
    }
    return batchSize;
  }

  private void onMalformed(Response response, int expected) {
    summary.recordDecodeFailure(
        new WireFormatException(
            "transaction "
                + response.transactionId()
                + " acknowledged "
                + response.size()
                + " operations, expected 1.."
                + expected));
    log.warn(
        "Skipping response for transaction {}: size {} outside 1..{}",
        response.transactionId(),
        response.size(),
        expected);
  }

  private void onFailure(DecodeResult result) {
    if (deadline.expired()) {
      return;
    }
    summary.recordDecodeFailure(result.failure());
    log.warn(
        "Response decode failure ({}): {}",
        result.status(),
        result.failure() == null ? "unknown" : result.failure().getMessage());
  }

  private void traceResponse(Response response) {
    long now = clock.millis();
    if (!response.carriesValues()) {
      trace.record(TraceEvent.response(parameters.clientId(), response.transactionId(), null, now));
      return;
    }
    for (Long value : response.values()) {
      trace.record(
          TraceEvent.response(parameters.clientId(), response.transactionId(), value, now));
    }
  }

  @VisibleForTesting
  Summary summary() {
    return summary;
  }

  @VisibleForTesting
  long completedTransactions() {
    return released;
  }
}
