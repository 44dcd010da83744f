package com.mk.fx.qa.kv.bench.executors;

import java.io.IOException;

/** Emits the workload to the server, one paced batch at a time, until exhausted or deadline. */
public interface ProtocolIssuer {

  /**
   * Runs the issuing loop on the calling thread.
   *
   * @return number of batches written
   */
  long issue() throws IOException, InterruptedException;

  /** Batches written so far; readable from other threads. */
  long issuedBatches();
}
