package com.mk.fx.qa.kv.bench.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.kv.bench.wire.codec.WireFormatException;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;

class DecodeFailureTrackerTest {

  @Test
  void classify_mapsKnownFailures() {
    assertEquals("MALFORMED_FRAME", DecodeFailureTracker.classify(new WireFormatException("x")));
    assertEquals("STREAM_CLOSED", DecodeFailureTracker.classify(new EOFException()));
    assertEquals("SOCKET_TIMEOUT", DecodeFailureTracker.classify(new SocketTimeoutException()));
    assertEquals("SOCKET_ERROR", DecodeFailureTracker.classify(new SocketException("reset")));
    assertEquals("UNKNOWN", DecodeFailureTracker.classify(null));
  }

  @Test
  void classify_fallsBackToRootCauseName() {
    var failure = new IOException("outer", new IllegalStateException("inner"));
    assertEquals("IllegalStateException", DecodeFailureTracker.classify(failure));
  }

  @Test
  void breakdown_isASnapshot() {
    var tracker = new DecodeFailureTracker();
    tracker.record(new EOFException());
    var snapshot = tracker.breakdownSnapshot();
    tracker.record(new EOFException());

    assertEquals(1L, snapshot.get("STREAM_CLOSED"));
    assertEquals(2, tracker.total());
  }
}
