package com.mk.fx.qa.kv.bench.trace;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Writes one JSON document per event to {@code linearizability.<clientId>.out}. */
@Slf4j
public final class JsonLinesOperationTrace implements OperationTrace {

  private final ObjectMapper objectMapper;
  private final BufferedWriter writer;
  private final Path file;
  private long written;
  private long failed;
  private boolean closed;

  private JsonLinesOperationTrace(ObjectMapper objectMapper, BufferedWriter writer, Path file) {
    this.objectMapper = objectMapper;
    this.writer = writer;
    this.file = file;
  }

  public static Path fileFor(Path directory, int clientId) {
    return directory.resolve("linearizability." + clientId + ".out");
  }

  public static JsonLinesOperationTrace open(
      ObjectMapper objectMapper, Path directory, int clientId) throws IOException {
    Files.createDirectories(directory);
    Path file = fileFor(directory, clientId);
    var writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    log.info("Tracing operations to {}", file);
    return new JsonLinesOperationTrace(objectMapper, writer, file);
  }

  @Override
  public synchronized void record(TraceEvent event) {
    if (closed) {
      return;
    }
    try {
      writer.write(objectMapper.writeValueAsString(event));
      writer.newLine();
      written++;
    } catch (IOException e) {
      // the run goes on without a complete trace
      if (failed++ == 0) {
        log.warn("Failed to write operation trace to {}: {}", file, e.getMessage(), e);
      }
    }
  }

  public synchronized long written() {
    return written;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      writer.close();
      log.info("Operation trace closed: {} events written, {} failed", written, failed);
    } catch (IOException e) {
      log.warn("Failed to close operation trace {}: {}", file, e.getMessage(), e);
    }
  }
}
