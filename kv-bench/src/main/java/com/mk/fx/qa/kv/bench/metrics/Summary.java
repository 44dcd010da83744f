package com.mk.fx.qa.kv.bench.metrics;

import java.util.Arrays;
import java.util.Map;

/**
 * Measurements of one run. Mutated only by the collector thread while the run is in progress and
 * handed to the aggregator once the collector has returned; no internal synchronization.
 */
public final class Summary {

  private long[] latencies;
  private int recorded;
  private long acknowledged;
  private long cumulativeLatencyMs;
  private long maxLatencyMs;
  private long reads;
  private long slow;
  private final DecodeFailureTracker decodeFailures = new DecodeFailureTracker();

  /**
   * @param expectedOperations initial capacity of the latency array, normally the request count
   */
  public Summary(int expectedOperations) {
    this.latencies = new long[Math.max(16, expectedOperations)];
  }

  /** Records {@code operations} acknowledgements that all observed the same latency. */
  public void recordAcknowledged(int operations, long latencyMs) {
    if (operations <= 0) {
      return;
    }
    ensureCapacity(recorded + operations);
    Arrays.fill(latencies, recorded, recorded + operations, latencyMs);
    recorded += operations;
    acknowledged += operations;
    cumulativeLatencyMs += latencyMs * operations;
    if (latencyMs > maxLatencyMs) {
      maxLatencyMs = latencyMs;
    }
  }

  public void recordReads(long count) {
    reads += count;
  }

  public void recordSlow(long count) {
    slow += count;
  }

  public void recordDecodeFailure(Throwable failure) {
    decodeFailures.record(failure);
  }

  private void ensureCapacity(int required) {
    if (required > latencies.length) {
      latencies = Arrays.copyOf(latencies, Math.max(required, latencies.length * 2));
    }
  }

  public long getAcknowledged() {
    return acknowledged;
  }

  public long getCumulativeLatencyMs() {
    return cumulativeLatencyMs;
  }

  public long getMaxLatencyMs() {
    return maxLatencyMs;
  }

  public long getReads() {
    return reads;
  }

  public long getWrites() {
    return acknowledged - reads;
  }

  public long getSlow() {
    return slow;
  }

  public long getDecodeFailures() {
    return decodeFailures.total();
  }

  public Map<String, Long> getDecodeFailureBreakdown() {
    return decodeFailures.breakdownSnapshot();
  }

  /** Copy of the recorded latencies in acknowledgement order. */
  public long[] latencies() {
    return Arrays.copyOf(latencies, recorded);
  }
}
