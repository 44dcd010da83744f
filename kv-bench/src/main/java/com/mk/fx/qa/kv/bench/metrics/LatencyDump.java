package com.mk.fx.qa.kv.bench.metrics;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Writes every recorded latency to {@code latency.<clientId>.out}, one value in ms per line. */
@Slf4j
public final class LatencyDump {

  private LatencyDump() {
    throw new UnsupportedOperationException("LatencyDump cannot be instantiated");
  }

  public static Path fileFor(Path directory, int clientId) {
    return directory.resolve("latency." + clientId + ".out");
  }

  public static Path write(Path directory, int clientId, long[] latencies) throws IOException {
    Files.createDirectories(directory);
    Path file = fileFor(directory, clientId);
    try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      for (long latency : latencies) {
        writer.write(Long.toString(latency));
        writer.newLine();
      }
    }
    log.info("Wrote {} latencies to {}", latencies.length, file);
    return file;
  }
}
