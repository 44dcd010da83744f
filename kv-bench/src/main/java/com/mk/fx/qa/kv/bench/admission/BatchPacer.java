package com.mk.fx.qa.kv.bench.admission;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodic tick spreading batch emission evenly over the run. The issuer emits at most one batch
 * per tick. Like a ticker with a one-slot buffer, ticks that nobody consumes are dropped rather
 * than accumulated.
 */
@Slf4j
public final class BatchPacer implements AutoCloseable {

  /** Floor of the interval, so that a huge batch count cannot turn pacing into a busy loop. */
  static final long MIN_INTERVAL_NANOS = 1_000L;

  private static final long TICK_POLL_MILLIS = 50L;

  private final long intervalNanos;
  private final Semaphore ticks = new Semaphore(0);
  private volatile ScheduledFuture<?> timer;

  private BatchPacer(long intervalNanos) {
    this.intervalNanos = intervalNanos;
  }

  /** Interval between batches: the run duration divided by {@code batchCount} slots. */
  public static long intervalNanos(Duration duration, int batchCount) {
    return Math.max(MIN_INTERVAL_NANOS, duration.toNanos() / Math.max(1, batchCount));
  }

  /** Starts ticking immediately, then once per interval. */
  public static BatchPacer start(long intervalNanos, ScheduledExecutorService scheduler) {
    var pacer = new BatchPacer(Math.max(MIN_INTERVAL_NANOS, intervalNanos));
    pacer.timer =
        scheduler.scheduleAtFixedRate(pacer::tick, 0L, pacer.intervalNanos, TimeUnit.NANOSECONDS);
    log.debug("Batch pacer started with interval {} ns", pacer.intervalNanos);
    return pacer;
  }

  private void tick() {
    if (ticks.availablePermits() == 0) {
      ticks.release();
    }
  }

  /**
   * Waits for the next tick.
   *
   * @return true on a tick, false if the deadline fired first
   */
  public boolean awaitTick(RunDeadline deadline) throws InterruptedException {
    while (!deadline.expired()) {
      if (ticks.tryAcquire(TICK_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void close() {
    if (timer != null) {
      timer.cancel(false);
    }
  }
}
