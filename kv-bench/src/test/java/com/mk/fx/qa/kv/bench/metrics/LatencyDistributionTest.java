package com.mk.fx.qa.kv.bench.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class LatencyDistributionTest {

  @Test
  void percentile_onSmallDataset_returnsExpectedQuantiles() {
    var d = LatencyDistribution.of(LongStream.rangeClosed(1, 100).toArray());
    assertEquals(50L, d.percentile(50));
    assertEquals(95L, d.percentile(95));
    assertEquals(99L, d.percentile(99));
    assertEquals(100L, d.percentile(99.9));
    assertEquals(1L, d.percentile(0));
    assertEquals(1L, d.min());
    assertEquals(100L, d.max());
    assertEquals(50.5, d.mean(), 1e-9);
  }

  @Test
  void unsortedInput_isNotModified() {
    long[] samples = {9, 1, 5};
    var d = LatencyDistribution.of(samples);
    assertEquals(5L, d.percentile(50));
    assertArrayEquals(new long[] {9, 1, 5}, samples);
  }

  @Test
  void standardDeviation_ofConstantSamples_isZero() {
    assertEquals(0.0, LatencyDistribution.of(new long[] {4, 4, 4}).standardDeviation(), 1e-12);
    var spread = LatencyDistribution.of(new long[] {2, 4, 4, 4, 5, 5, 7, 9});
    assertEquals(2.0, spread.standardDeviation(), 1e-12);
  }

  @Test
  void empty_yieldsZeros() {
    var d = LatencyDistribution.of(new long[0]);
    assertTrue(d.isEmpty());
    assertEquals(0L, d.percentile(99));
    assertEquals(0.0, d.mean());
    assertEquals(0L, d.max());
  }

  @Test
  void percentileOutOfRange_isRejected() {
    var d = LatencyDistribution.of(new long[] {1});
    assertThrows(IllegalArgumentException.class, () -> d.percentile(101));
  }
}
