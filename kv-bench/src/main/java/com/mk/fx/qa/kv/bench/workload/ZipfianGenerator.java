package com.mk.fx.qa.kv.bench.workload;

import java.util.Random;

/**
 * Zipfian key chooser over {@code [0, items)} using the rejection-free method of Gray et al.,
 * "Quickly Generating Billion-Record Synthetic Databases". Key 0 is the most popular.
 *
 * <p>Immutable. The caller's {@link Random} is the only mutable state.
 */
final class ZipfianGenerator {

  private final long items;
  private final double zetaN;
  private final double alpha;
  private final double eta;
  private final double secondKeyBound;

  ZipfianGenerator(long items, double theta) {
    if (items < 1) {
      throw new IllegalArgumentException("items must be >= 1, got " + items);
    }
    if (!(theta > 0.0 && theta < 1.0)) {
      throw new IllegalArgumentException("theta must be in (0,1), got " + theta);
    }
    this.items = items;
    this.zetaN = zeta(items, theta);
    this.alpha = 1.0 / (1.0 - theta);
    double zeta2 = zeta(2, theta);
    this.eta = (1 - Math.pow(2.0 / items, 1 - theta)) / (1 - zeta2 / zetaN);
    this.secondKeyBound = 1 + Math.pow(0.5, theta);
  }

  long next(Random random) {
    double u = random.nextDouble();
    double uz = u * zetaN;
    if (uz < 1.0) {
      return 0;
    }
    if (uz < secondKeyBound) {
      return Math.min(1, items - 1);
    }
    long value = (long) (items * Math.pow(eta * u - eta + 1, alpha));
    return Math.min(value, items - 1);
  }

  static double zeta(long n, double theta) {
    double sum = 0;
    for (long i = 0; i < n; i++) {
      sum += 1 / Math.pow(i + 1, theta);
    }
    return sum;
  }
}
