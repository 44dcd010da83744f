package com.mk.fx.qa.kv.bench.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.kv.bench.cfg.BenchConfig;
import com.mk.fx.qa.kv.bench.cfg.BenchConfigLoader;
import com.mk.fx.qa.kv.bench.cfg.ClientCfg;
import com.mk.fx.qa.kv.bench.cfg.Endpoint;
import com.mk.fx.qa.kv.bench.exception.ConfigurationException;
import com.mk.fx.qa.kv.bench.exception.ConnectionFailedException;
import com.mk.fx.qa.kv.bench.executors.BenchmarkExecutor;
import com.mk.fx.qa.kv.bench.executors.BenchmarkResult;
import com.mk.fx.qa.kv.bench.metrics.LatencyDump;
import com.mk.fx.qa.kv.bench.metrics.RunReport;
import com.mk.fx.qa.kv.bench.metrics.SummaryAggregator;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.trace.JsonLinesOperationTrace;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.wire.KvConnection;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one client: loads the configuration, dials the server, drives the benchmark until the
 * deadline and reports the results.
 */
@Slf4j
@Component
public class BenchmarkRunner implements CommandLineRunner {

  private final ClientCfg client;
  private final BenchConfigLoader configLoader;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Autowired
  public BenchmarkRunner(
      ClientCfg client, BenchConfigLoader configLoader, ObjectMapper objectMapper) {
    this(client, configLoader, objectMapper, Clock.systemUTC());
  }

  BenchmarkRunner(
      ClientCfg client, BenchConfigLoader configLoader, ObjectMapper objectMapper, Clock clock) {
    this.client = client;
    this.configLoader = configLoader;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public void run(String... args) throws Exception {
    runBenchmark();
  }

  public RunReport runBenchmark() throws InterruptedException {
    BenchConfig config = configLoader.load(Path.of(client.getConfigFile()));
    RunParameters parameters = config.toRunParameters(client);
    Endpoint endpoint = config.resolveEndpoint(client);
    Path outputDir = Path.of(client.getOutputDir());

    BenchmarkResult result;
    KvConnection connection = connect(endpoint);
    try (OperationTrace trace = openTrace(parameters, outputDir)) {
      result = BenchmarkExecutor.execute(parameters, connection, trace, clock);
    } finally {
      close(connection, endpoint);
    }

    RunReport report =
        SummaryAggregator.aggregate(result.summary(), parameters, result.outstandingUnits());
    log.info("Run report: {}", SummaryAggregator.describe(report));
    if (report.outstandingUnits() > 0) {
      log.warn(
          "{} admission units were never released; responses were lost or still in flight",
          report.outstandingUnits());
    }

    if (parameters.dumpLatency()) {
      try {
        LatencyDump.write(outputDir, parameters.clientId(), result.summary().latencies());
      } catch (IOException e) {
        log.error("Failed to write latency dump to {}: {}", outputDir, e.getMessage(), e);
      }
    }
    return report;
  }

  private KvConnection connect(Endpoint endpoint) {
    try {
      return KvConnection.open(endpoint.host(), endpoint.port(), client.getConnectTimeout());
    } catch (IOException e) {
      log.error("Failed to connect to {}: {}", endpoint, e.getMessage());
      throw new ConnectionFailedException("Failed to connect to " + endpoint, e);
    }
  }

  private static void close(KvConnection connection, Endpoint endpoint) {
    try {
      connection.close();
    } catch (IOException e) {
      log.warn("Closing connection to {} failed: {}", endpoint, e.getMessage());
    }
  }

  private OperationTrace openTrace(RunParameters parameters, Path outputDir) {
    if (!parameters.linearizabilityCheck()) {
      return OperationTrace.NONE;
    }
    try {
      return JsonLinesOperationTrace.open(objectMapper, outputDir, parameters.clientId());
    } catch (IOException e) {
      throw new ConfigurationException("Cannot open operation trace in " + outputDir, e);
    }
  }
}
