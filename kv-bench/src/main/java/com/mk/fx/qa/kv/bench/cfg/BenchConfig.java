package com.mk.fx.qa.kv.bench.cfg;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.kv.bench.exception.ConfigurationException;
import com.mk.fx.qa.kv.bench.model.Distribution;
import com.mk.fx.qa.kv.bench.model.Protocol;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Data;

/** Shape of the shared JSON run configuration file. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BenchConfig {

  /** Replica id to {@code host:port}. */
  @JsonProperty("address")
  private Map<String, String> addresses = new LinkedHashMap<>();

  @JsonProperty("BatchSize")
  private int batchSize = 1;

  @JsonProperty("BufferSize")
  private int bufferSize = 1024;

  @JsonProperty("benchmark")
  private Benchmark benchmark = new Benchmark();

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Benchmark {

    @JsonProperty("T")
    private int durationSeconds = 60;

    @JsonProperty("K")
    private int keySpace = 1000;

    @JsonProperty("W")
    private double writeRatio = 0.5;

    @JsonProperty("Throttle")
    private int requestCount = 1000;

    @JsonProperty("Concurrency")
    private int concurrency = 1;

    @JsonProperty("Distribution")
    private String distribution = "uniform";

    @JsonProperty("LinearizabilityCheck")
    private boolean linearizabilityCheck;

    @JsonProperty("Conflicts")
    private int conflicts;

    @JsonProperty("ZipfianTheta")
    private double zipfianTheta = 0.99;

    @JsonProperty("DumpLatency")
    private boolean dumpLatency;
  }

  public Optional<String> addressOf(int replicaId) {
    return Optional.ofNullable(addresses.get(String.valueOf(replicaId)));
  }

  /**
   * Combines the shared file with the per-process options into the parameters of this client's
   * run.
   *
   * @throws ConfigurationException if any value is out of range
   */
  public RunParameters toRunParameters(ClientCfg client) {
    Protocol protocol;
    try {
      protocol = Protocol.fromName(client.getAlgorithm());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
    return RunParameters.builder()
        .clientId(client.getId())
        .protocol(protocol)
        .durationSeconds(benchmark.getDurationSeconds())
        .requestCount(benchmark.getRequestCount())
        .concurrency(benchmark.getConcurrency())
        .batchSize(batchSize)
        .keySpace(benchmark.getKeySpace())
        .readRatio(1 - benchmark.getWriteRatio())
        .distribution(Distribution.fromName(benchmark.getDistribution()))
        .zipfianTheta(benchmark.getZipfianTheta())
        .conflictPercentage(benchmark.getConflicts())
        .startRange(client.getStartRange())
        .separateBatchTypes(client.isSeparate())
        .linearizabilityCheck(benchmark.isLinearizabilityCheck())
        .dumpLatency(benchmark.isDumpLatency())
        .bufferSize(bufferSize)
        .build();
  }

  /** An explicit port wins; otherwise the address map entry of the client id is used. */
  public Endpoint resolveEndpoint(ClientCfg client) {
    if (client.getPort() > 0) {
      return new Endpoint(client.getHost(), client.getPort());
    }
    return addressOf(client.getId())
        .map(Endpoint::parse)
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "No port given and no address configured for replica " + client.getId()));
  }
}
