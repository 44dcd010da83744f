package com.mk.fx.qa.kv.bench.admission;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ledger for protocols without transaction ids. Reserving announces a dispatched batch by pushing
 * its operation count to the collector, which then knows how many replies to read; one unit is one
 * operation. At most {@code concurrency} announcements can wait for the collector.
 */
public final class CountingLedger implements AdmissionLedger {

  private final BlockingQueue<Integer> announcements;
  private final AtomicLong outstanding = new AtomicLong();

  public CountingLedger(int concurrency) {
    this.announcements = new ArrayBlockingQueue<>(Math.max(1, concurrency));
  }

  @Override
  public void reserve(int units) throws InterruptedException {
    announcements.put(units);
    outstanding.addAndGet(units);
  }

  @Override
  public boolean tryReserve(int units, Duration timeout) throws InterruptedException {
    if (announcements.offer(units, AdmissionLedger.toNanos(timeout), TimeUnit.NANOSECONDS)) {
      outstanding.addAndGet(units);
      return true;
    }
    return false;
  }

  /**
   * Takes the next announced batch size.
   *
   * @return the operation count, or null if none was announced within the timeout
   */
  public Integer nextAnnouncement(Duration timeout) throws InterruptedException {
    return announcements.poll(AdmissionLedger.toNanos(timeout), TimeUnit.NANOSECONDS);
  }

  @Override
  public void release(int units) {
    outstanding.addAndGet(-units);
  }

  @Override
  public long outstanding() {
    return outstanding.get();
  }
}
