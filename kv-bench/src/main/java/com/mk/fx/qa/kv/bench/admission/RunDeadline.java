package com.mk.fx.qa.kv.bench.admission;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * One-shot timer ending the run. Once fired, issuers stop emitting and collectors stop consuming;
 * whatever is still in flight is left out of the results.
 */
@Slf4j
public final class RunDeadline {

  private final Duration duration;
  private final CountDownLatch fired = new CountDownLatch(1);

  private RunDeadline(Duration duration) {
    this.duration = Objects.requireNonNull(duration, "duration");
  }

  /** Starts the timer on the given scheduler. */
  public static RunDeadline start(Duration duration, ScheduledExecutorService scheduler) {
    var deadline = new RunDeadline(duration);
    scheduler.schedule(deadline::fire, duration.toNanos(), TimeUnit.NANOSECONDS);
    return deadline;
  }

  /** A deadline that only fires through {@link #expireNow()}. */
  @VisibleForTesting
  public static RunDeadline manual(Duration duration) {
    return new RunDeadline(duration);
  }

  private void fire() {
    if (fired.getCount() > 0) {
      log.info("Run deadline of {} reached", duration);
    }
    fired.countDown();
  }

  @VisibleForTesting
  public void expireNow() {
    fire();
  }

  public boolean expired() {
    return fired.getCount() == 0;
  }

  /** Blocks until the deadline fires. */
  public void await() throws InterruptedException {
    fired.await();
  }

  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return fired.await(timeout, unit);
  }

  public Duration duration() {
    return duration;
  }
}
