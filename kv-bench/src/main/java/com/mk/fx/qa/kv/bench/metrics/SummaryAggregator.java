package com.mk.fx.qa.kv.bench.metrics;

import com.mk.fx.qa.kv.bench.model.RunParameters;
import java.util.Locale;
import java.util.Objects;

/** Turns the collector's {@link Summary} into a {@link RunReport}. */
public final class SummaryAggregator {

  private SummaryAggregator() {
    throw new UnsupportedOperationException("SummaryAggregator cannot be instantiated");
  }

  public static RunReport aggregate(
      Summary summary, RunParameters parameters, long outstandingUnits) {
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(parameters, "parameters");

    long ack = summary.getAcknowledged();
    // whole operations per second, truncated
    long throughput = ack / parameters.durationSeconds();
    double average = ack == 0 ? 0.0 : (double) summary.getCumulativeLatencyMs() / ack;
    double slowRate =
        summary.getReads() == 0 ? 0.0 : (double) summary.getSlow() / summary.getReads();

    var distribution = LatencyDistribution.of(summary.latencies());
    return new RunReport(
        parameters.clientId(),
        parameters.protocol(),
        parameters.durationSeconds(),
        ack,
        throughput,
        average,
        distribution.min(),
        distribution.percentile(50),
        distribution.percentile(95),
        distribution.percentile(99),
        distribution.percentile(99.9),
        Math.max(summary.getMaxLatencyMs(), distribution.max()),
        distribution.standardDeviation(),
        summary.getReads(),
        summary.getWrites(),
        summary.getSlow(),
        slowRate,
        summary.getDecodeFailures(),
        summary.getDecodeFailureBreakdown(),
        outstandingUnits);
  }

  /** Single-line rendering for the log. */
  public static String describe(RunReport report) {
    StringBuilder sb = new StringBuilder();
    sb.append("client=").append(report.clientId());
    sb.append(", protocol=").append(report.protocol().label());
    sb.append(", duration=").append(report.durationSeconds()).append("s");
    sb.append(", acknowledged=").append(report.acknowledged());
    sb.append(", throughput=").append(report.throughput()).append(" ops/s");
    sb.append(", avgLatency=").append(format(report.averageLatencyMs())).append("ms");
    sb.append(", minLatency=").append(report.minLatencyMs()).append("ms");
    sb.append(", median=").append(report.medianLatencyMs()).append("ms");
    sb.append(", p95=").append(report.p95LatencyMs()).append("ms");
    sb.append(", p99=").append(report.p99LatencyMs()).append("ms");
    sb.append(", p999=").append(report.p999LatencyMs()).append("ms");
    sb.append(", maxLatency=").append(report.maxLatencyMs()).append("ms");
    sb.append(", stdDev=").append(format(report.stdDevLatencyMs()));
    sb.append(", reads=").append(report.reads());
    sb.append(", writes=").append(report.writes());
    sb.append(", slow=").append(report.slow());
    sb.append(", slowRate=").append(format(report.slowRate()));
    if (report.decodeFailures() > 0) {
      sb.append(", decodeFailures=").append(report.decodeFailures());
      sb.append(" ").append(report.decodeFailureBreakdown());
    }
    sb.append(", outstanding=").append(report.outstandingUnits());
    return sb.toString();
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
