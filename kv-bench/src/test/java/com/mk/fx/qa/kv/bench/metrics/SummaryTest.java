package com.mk.fx.qa.kv.bench.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.kv.bench.wire.codec.WireFormatException;
import java.io.EOFException;
import org.junit.jupiter.api.Test;

class SummaryTest {

  @Test
  void recordAcknowledged_addsOneSamplePerOperation() {
    var summary = new Summary(10);
    summary.recordAcknowledged(3, 12);
    summary.recordAcknowledged(1, 40);

    assertEquals(4, summary.getAcknowledged());
    assertEquals(3 * 12 + 40, summary.getCumulativeLatencyMs());
    assertEquals(40, summary.getMaxLatencyMs());
    assertThat(summary.latencies()).containsExactly(12, 12, 12, 40);
  }

  @Test
  void latencies_growBeyondInitialCapacity() {
    var summary = new Summary(2);
    for (int i = 0; i < 100; i++) {
      summary.recordAcknowledged(1, i);
    }
    assertEquals(100, summary.latencies().length);
    assertEquals(99, summary.latencies()[99]);
  }

  @Test
  void writes_areAcknowledgedMinusReads() {
    var summary = new Summary(10);
    summary.recordAcknowledged(10, 5);
    summary.recordReads(4);
    summary.recordSlow(1);

    assertEquals(4, summary.getReads());
    assertEquals(6, summary.getWrites());
    assertEquals(1, summary.getSlow());
  }

  @Test
  void decodeFailures_areClassified() {
    var summary = new Summary(1);
    summary.recordDecodeFailure(new WireFormatException("bad frame"));
    summary.recordDecodeFailure(new WireFormatException("bad frame"));
    summary.recordDecodeFailure(new EOFException());

    assertEquals(3, summary.getDecodeFailures());
    assertThat(summary.getDecodeFailureBreakdown())
        .containsEntry(DecodeFailureTracker.MALFORMED_FRAME, 2L)
        .containsEntry(DecodeFailureTracker.STREAM_CLOSED, 1L);
  }

  @Test
  void zeroOperations_recordNothing() {
    var summary = new Summary(1);
    summary.recordAcknowledged(0, 100);
    assertEquals(0, summary.getAcknowledged());
    assertEquals(0, summary.getMaxLatencyMs());
  }
}
