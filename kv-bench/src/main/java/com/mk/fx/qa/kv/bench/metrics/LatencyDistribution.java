package com.mk.fx.qa.kv.bench.metrics;

import java.util.Arrays;

/**
 * Order statistics over a set of latency samples. Percentiles use the nearest-rank method, the
 * same index rule as the live reservoir of the load runner.
 */
final class LatencyDistribution {

  private final long[] sorted;

  private LatencyDistribution(long[] sorted) {
    this.sorted = sorted;
  }

  static LatencyDistribution of(long[] samples) {
    long[] copy = Arrays.copyOf(samples, samples.length);
    Arrays.sort(copy);
    return new LatencyDistribution(copy);
  }

  boolean isEmpty() {
    return sorted.length == 0;
  }

  long min() {
    return isEmpty() ? 0 : sorted[0];
  }

  long max() {
    return isEmpty() ? 0 : sorted[sorted.length - 1];
  }

  double mean() {
    if (isEmpty()) return 0.0;
    double sum = 0;
    for (long v : sorted) sum += v;
    return sum / sorted.length;
  }

  double standardDeviation() {
    if (sorted.length < 2) return 0.0;
    double mean = mean();
    double squares = 0;
    for (long v : sorted) {
      double d = v - mean;
      squares += d * d;
    }
    return Math.sqrt(squares / sorted.length);
  }

  long percentile(double p) {
    if (p < 0 || p > 100)
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    if (isEmpty()) return 0;
    int c = sorted.length;
    int idx = Math.min(c - 1, Math.max(0, (int) Math.ceil((p / 100.0) * c) - 1));
    return sorted[idx];
  }
}
