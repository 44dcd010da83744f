package com.mk.fx.qa.kv.bench.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.kv.bench.exception.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads the shared run configuration file. */
@Slf4j
@Component
public class BenchConfigLoader {

  private final ObjectMapper objectMapper;

  public BenchConfigLoader(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public BenchConfig load(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Config file not found: " + file.toAbsolutePath());
    }
    try {
      BenchConfig config = objectMapper.readValue(file.toFile(), BenchConfig.class);
      log.info("Loaded run configuration from {}", file.toAbsolutePath());
      return config;
    } catch (IOException e) {
      throw new ConfigurationException("Couldn't load " + file + ": " + e.getMessage(), e);
    }
  }
}
