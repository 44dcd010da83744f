package com.mk.fx.qa.kv.bench.model;

import java.util.Locale;

/** Replication protocol the target store runs, which selects the issuer/collector pair. */
public enum Protocol {
  ABD("abd"),
  FAST_PATH("fast-path");

  private final String label;

  Protocol(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Resolves a protocol name as given on the command line. {@code epaxos} is accepted as an alias
   * of the fast-path protocol.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static Protocol fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Protocol name must be provided");
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "abd" -> ABD;
      case "fast-path", "fast_path", "fastpath", "epaxos" -> FAST_PATH;
      default -> throw new IllegalArgumentException("Unsupported protocol: " + name);
    };
  }
}
