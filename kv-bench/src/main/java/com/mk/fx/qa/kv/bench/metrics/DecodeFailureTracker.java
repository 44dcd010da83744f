package com.mk.fx.qa.kv.bench.metrics;

import com.mk.fx.qa.kv.bench.wire.codec.WireFormatException;
import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/** Counts inbound decode failures by class. Owned by the collector thread. */
final class DecodeFailureTracker {

  static final String MALFORMED_FRAME = "MALFORMED_FRAME";
  static final String STREAM_CLOSED = "STREAM_CLOSED";
  static final String SOCKET_TIMEOUT = "SOCKET_TIMEOUT";
  static final String SOCKET_ERROR = "SOCKET_ERROR";

  private long total;
  private final Map<String, Long> breakdown = new HashMap<>();

  void record(Throwable failure) {
    total++;
    breakdown.merge(classify(failure), 1L, Long::sum);
  }

  long total() {
    return total;
  }

  Map<String, Long> breakdownSnapshot() {
    return Map.copyOf(new TreeMap<>(breakdown));
  }

  static String classify(Throwable failure) {
    if (failure == null) return "UNKNOWN";
    if (failure instanceof WireFormatException) return MALFORMED_FRAME;
    if (failure instanceof EOFException) return STREAM_CLOSED;
    if (failure instanceof SocketTimeoutException) return SOCKET_TIMEOUT;
    if (failure instanceof SocketException) return SOCKET_ERROR;
    Throwable rootCause = failure;
    while (rootCause.getCause() != null) {
      rootCause = rootCause.getCause();
    }
    var clsName = rootCause.getClass().getSimpleName();
    return clsName.isBlank() ? "EXCEPTION" : clsName;
  }
}
