package com.mk.fx.qa.kv.bench.admission;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ledger backed by a counting semaphore. One unit is one outstanding transaction; at most {@code
 * concurrency} of them can be reserved at a time.
 */
public final class PermitLedger implements AdmissionLedger {

  private final Semaphore permits;
  private final AtomicLong outstanding = new AtomicLong();

  public PermitLedger(int concurrency) {
    this.permits = new Semaphore(Math.max(1, concurrency));
  }

  @Override
  public void reserve(int units) throws InterruptedException {
    permits.acquire(units);
    outstanding.addAndGet(units);
  }

  @Override
  public boolean tryReserve(int units, Duration timeout) throws InterruptedException {
    if (permits.tryAcquire(units, AdmissionLedger.toNanos(timeout), TimeUnit.NANOSECONDS)) {
      outstanding.addAndGet(units);
      return true;
    }
    return false;
  }

  @Override
  public void release(int units) {
    outstanding.addAndGet(-units);
    permits.release(units);
  }

  @Override
  public long outstanding() {
    return outstanding.get();
  }
}
