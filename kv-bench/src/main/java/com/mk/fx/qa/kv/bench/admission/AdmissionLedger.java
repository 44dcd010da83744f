package com.mk.fx.qa.kv.bench.admission;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Accounting of work that has been dispatched but not yet acknowledged. The issuer reserves units
 * before dispatching, the collector releases them once the server has answered for them.
 *
 * <p>Units that are never released stay outstanding for the rest of the run; with enough lost
 * responses the issuer can no longer reserve. {@link #outstanding()} makes that visible.
 */
public interface AdmissionLedger {

  /** Poll granularity used while waiting for capacity against a deadline. */
  Duration RESERVE_POLL = Duration.ofMillis(50);

  /** Blocks until the units can be reserved. */
  void reserve(int units) throws InterruptedException;

  /**
   * Reserves the units if capacity frees up within the timeout.
   *
   * @return true if reserved
   */
  boolean tryReserve(int units, Duration timeout) throws InterruptedException;

  /** Marks units as acknowledged. */
  void release(int units);

  /** Units reserved and not yet released. */
  long outstanding();

  /**
   * Waits for capacity until the deadline fires.
   *
   * @return true if reserved, false if the deadline fired first
   */
  default boolean reserveBefore(int units, RunDeadline deadline) throws InterruptedException {
    while (!deadline.expired()) {
      if (tryReserve(units, RESERVE_POLL)) {
        return true;
      }
    }
    return false;
  }

  static long toNanos(Duration timeout) {
    return TimeUnit.NANOSECONDS.convert(timeout);
  }
}
