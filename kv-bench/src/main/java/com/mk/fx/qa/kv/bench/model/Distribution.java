package com.mk.fx.qa.kv.bench.model;

import java.util.Locale;

/** Key distribution of the generated workload. */
public enum Distribution {
  /** Skewed keys drawn from a Zipfian generator. */
  ZIPFIAN,
  /** A hot key with the configured conflict probability, unique keys otherwise. */
  CONFLICT;

  /** Any name other than {@code zipfian} (or the historical {@code zipfan}) selects CONFLICT. */
  public static Distribution fromName(String name) {
    if (name == null) {
      return CONFLICT;
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "zipfian", "zipfan" -> ZIPFIAN;
      default -> CONFLICT;
    };
  }
}
