package com.mk.fx.qa.kv.bench.executors.fastpath;

import com.mk.fx.qa.kv.bench.admission.BatchPacer;
import com.mk.fx.qa.kv.bench.admission.CountingLedger;
import com.mk.fx.qa.kv.bench.admission.RunDeadline;
import com.mk.fx.qa.kv.bench.executors.ProtocolIssuer;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.trace.TraceEvent;
import com.mk.fx.qa.kv.bench.wire.codec.FastPathCodec;
import com.mk.fx.qa.kv.bench.wire.model.Command;
import com.mk.fx.qa.kv.bench.wire.model.ProposeMessage;
import com.mk.fx.qa.kv.bench.workload.Workload;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends every operation as its own proposal. After each batch the number of proposals is announced
 * to the collector, which has no other way to tell how many replies to expect.
 */
@Slf4j
public final class FastPathIssuer implements ProtocolIssuer {

  static final long VALUE_BOUND = 10_000_000L;

  private final RunParameters parameters;
  private final Workload workload;
  private final OutputStream output;
  private final CountingLedger ledger;
  private final BatchPacer pacer;
  private final RunDeadline deadline;
  private final OperationTrace trace;
  private final Clock clock;
  private final Random values;
  private volatile long issuedBatches;

  public FastPathIssuer(
      RunParameters parameters,
      Workload workload,
      OutputStream output,
      CountingLedger ledger,
      BatchPacer pacer,
      RunDeadline deadline,
      OperationTrace trace,
      Clock clock) {
    this.parameters = parameters;
    this.workload = workload;
    this.output = output;
    this.ledger = ledger;
    this.pacer = pacer;
    this.deadline = deadline;
    this.trace = trace;
    this.clock = clock;
    this.values = new Random(parameters.clientId());
  }

  @Override
  public long issue() throws IOException, InterruptedException {
    Thread.sleep(Math.max(0, parameters.clientId()));

    long durationNanos = parameters.duration().toNanos();
    long startNanos = System.nanoTime();
    int next = 0;
    while (next < workload.size()) {
      if (System.nanoTime() - startNanos > durationNanos || deadline.expired()) {
        break;
      }
      int end = Math.min(next + parameters.batchSize(), workload.size());
      long timestamp = clock.millis();
      for (int i = next; i < end; i++) {
        long key = workload.key(i);
        Command command =
            workload.isRead(i) ? Command.get(key) : Command.put(key, values.nextLong(VALUE_BOUND));
        FastPathCodec.writePropose(output, new ProposeMessage(i, command, timestamp));
        trace.record(
            TraceEvent.invocation(
                parameters.clientId(),
                i,
                command.operation().name(),
                key,
                command.value(),
                timestamp));
      }
      if (!ledger.reserveBefore(end - next, deadline)) {
        break;
      }
      output.flush();
      issuedBatches++;
      next = end;

      if (!pacer.awaitTick(deadline)) {
        break;
      }
    }
    log.info(
        "Fast-path issuer done: {} batches, {} of {} operations sent",
        issuedBatches,
        next,
        workload.size());
    return issuedBatches;
  }

  @Override
  public long issuedBatches() {
    return issuedBatches;
  }
}
