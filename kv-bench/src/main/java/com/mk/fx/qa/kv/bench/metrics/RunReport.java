package com.mk.fx.qa.kv.bench.metrics;

import com.mk.fx.qa.kv.bench.model.Protocol;
import java.util.Map;

/** Final figures of one client's run. Latencies in milliseconds. */
public record RunReport(
    int clientId,
    Protocol protocol,
    int durationSeconds,
    long acknowledged,
    long throughput,
    double averageLatencyMs,
    long minLatencyMs,
    long medianLatencyMs,
    long p95LatencyMs,
    long p99LatencyMs,
    long p999LatencyMs,
    long maxLatencyMs,
    double stdDevLatencyMs,
    long reads,
    long writes,
    long slow,
    double slowRate,
    long decodeFailures,
    Map<String, Long> decodeFailureBreakdown,
    long outstandingUnits) {

  public RunReport {
    decodeFailureBreakdown =
        decodeFailureBreakdown == null ? Map.of() : Map.copyOf(decodeFailureBreakdown);
  }
}
