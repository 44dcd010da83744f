package com.mk.fx.qa.kv.bench.workload;

/**
 * Pre-generated request stream: the key and the read/write classification of every operation of
 * the run, indexed by operation number.
 */
public final class Workload {

  private final long[] keys;
  private final boolean[] reads;

  Workload(long[] keys, boolean[] reads) {
    if (keys.length != reads.length) {
      throw new IllegalArgumentException("keys and reads must have the same length");
    }
    this.keys = keys;
    this.reads = reads;
  }

  public int size() {
    return keys.length;
  }

  public long key(int index) {
    return keys[index];
  }

  public boolean isRead(int index) {
    return reads[index];
  }

  public long readCount() {
    long count = 0;
    for (boolean read : reads) {
      if (read) count++;
    }
    return count;
  }
}
