package com.mk.fx.qa.kv.bench.cfg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.kv.bench.exception.ConfigurationException;
import com.mk.fx.qa.kv.bench.model.Distribution;
import com.mk.fx.qa.kv.bench.model.Protocol;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BenchConfigLoaderTest {

  private static final String CONFIG =
      """
      {
        // replicas
        "address": { "0": "tcp://10.0.0.1:7070", "1": "10.0.0.2:7071" },
        "BatchSize": 20,
        "BufferSize": 512,
        "benchmark": {
          "T": 30, "K": 5000, "W": 0.25, "Throttle": 4000, "Concurrency": 8,
          "Distribution": "zipfan", "LinearizabilityCheck": true, "Conflicts": 5,
          "ZipfianTheta": 0.8, "DumpLatency": true, "Unused": 1,
        },
      }
      """;

  private final BenchConfigLoader loader =
      new BenchConfigLoader(new ObjectMapperConfig().objectMapper());

  @TempDir Path dir;

  @Test
  void load_readsSharedSettings() throws Exception {
    Path file = Files.writeString(dir.resolve("config.json"), CONFIG);

    BenchConfig config = loader.load(file);

    assertEquals(20, config.getBatchSize());
    assertEquals(512, config.getBufferSize());
    assertEquals(30, config.getBenchmark().getDurationSeconds());
    assertEquals(4000, config.getBenchmark().getRequestCount());
    assertThat(config.addressOf(1)).contains("10.0.0.2:7071");
    assertThat(config.addressOf(9)).isEmpty();
  }

  @Test
  void toRunParameters_combinesFileAndClientOptions() throws Exception {
    BenchConfig config = loader.load(Files.writeString(dir.resolve("config.json"), CONFIG));
    var client = new ClientCfg();
    client.setId(3);
    client.setStartRange(100);
    client.setSeparate(true);
    client.setAlgorithm("abd");

    RunParameters params = config.toRunParameters(client);

    assertEquals(3, params.clientId());
    assertEquals(Protocol.ABD, params.protocol());
    assertEquals(0.75, params.readRatio(), 1e-9);
    assertEquals(Distribution.ZIPFIAN, params.distribution());
    assertEquals(8, params.concurrency());
    assertEquals(100, params.startRange());
    assertTrue(params.separateBatchTypes());
    assertTrue(params.linearizabilityCheck());
    assertTrue(params.dumpLatency());
    assertEquals(512, params.bufferSize());
  }

  @Test
  void unknownAlgorithm_isAConfigurationError() {
    var client = new ClientCfg();
    client.setAlgorithm("paxos-made-simple");
    assertThrows(ConfigurationException.class, () -> new BenchConfig().toRunParameters(client));
  }

  @Test
  void resolveEndpoint_prefersExplicitPort_thenAddressMap() throws Exception {
    BenchConfig config = loader.load(Files.writeString(dir.resolve("config.json"), CONFIG));
    var client = new ClientCfg();
    client.setId(0);
    client.setHost("localhost");
    client.setPort(9000);
    assertEquals(new Endpoint("localhost", 9000), config.resolveEndpoint(client));

    client.setPort(0);
    assertEquals(new Endpoint("10.0.0.1", 7070), config.resolveEndpoint(client));

    client.setId(7);
    assertThrows(ConfigurationException.class, () -> config.resolveEndpoint(client));
  }

  @Test
  void missingFile_isAConfigurationError() {
    assertThatThrownBy(() -> loader.load(dir.resolve("nope.json")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void brokenJson_isAConfigurationError() throws Exception {
    Path file = Files.writeString(dir.resolve("config.json"), "{ \"BatchSize\": [ }");
    assertThrows(ConfigurationException.class, () -> loader.load(file));
  }

  @Test
  void endpoint_parsesSchemeAndEmptyHost() {
    assertEquals(new Endpoint("127.0.0.1", 7070), Endpoint.parse(":7070"));
    assertEquals(new Endpoint("h", 1), Endpoint.parse("tcp://h:1"));
    assertThrows(ConfigurationException.class, () -> Endpoint.parse("h"));
    assertThrows(ConfigurationException.class, () -> Endpoint.parse("h:x"));
  }
}
