package com.mk.fx.qa.kv.bench.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Per-process client options, bound from {@code kv.bench.*} (application.yml or {@code
 * --kv.bench.id=3} style arguments). Shared run settings live in the JSON file named by {@link
 * #configFile}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "kv.bench")
public class ClientCfg {

  @Min(0)
  private int id = 0;

  @Min(0)
  private int startRange = 0;

  @NotBlank private String host = "127.0.0.1";

  /** 0 means: take the endpoint from the address map of the config file. */
  @Min(0)
  @Max(65535)
  private int port = 7074;

  private boolean separate = false;

  @NotBlank private String algorithm = "epaxos";

  @NotBlank private String configFile = "config.json";

  @NotBlank private String outputDir = ".";

  @NotNull private Duration connectTimeout = Duration.ofSeconds(5);
}
