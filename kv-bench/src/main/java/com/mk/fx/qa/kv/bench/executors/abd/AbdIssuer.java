package com.mk.fx.qa.kv.bench.executors.abd;

import com.mk.fx.qa.kv.bench.admission.AdmissionLedger;
import com.mk.fx.qa.kv.bench.admission.BatchPacer;
import com.mk.fx.qa.kv.bench.admission.RunDeadline;
import com.mk.fx.qa.kv.bench.executors.ProtocolIssuer;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.trace.TraceEvent;
import com.mk.fx.qa.kv.bench.wire.codec.AbdCodec;
import com.mk.fx.qa.kv.bench.wire.model.Command;
import com.mk.fx.qa.kv.bench.wire.model.Transaction;
import com.mk.fx.qa.kv.bench.workload.Workload;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends the workload as key-sorted transactions. Every transaction holds one admission unit until
 * the collector has seen all of its operations acknowledged.
 */
@Slf4j
public final class AbdIssuer implements ProtocolIssuer {

  /** Written values are drawn from [0, VALUE_BOUND). */
  static final long VALUE_BOUND = 10_000_000L;

  private final RunParameters parameters;
  private final Workload workload;
  private final OutputStream output;
  private final AbdCodec codec;
  private final AdmissionLedger ledger;
  private final BatchPacer pacer;
  private final RunDeadline deadline;
  private final OperationTrace trace;
  private final Clock clock;
  private final Random values;
  private volatile long issuedBatches;

  public AbdIssuer(
      RunParameters parameters,
      Workload workload,
      OutputStream output,
      AbdCodec codec,
      AdmissionLedger ledger,
      BatchPacer pacer,
      RunDeadline deadline,
      OperationTrace trace,
      Clock clock) {
    this.parameters = parameters;
    this.workload = workload;
    this.output = output;
    this.codec = codec;
    this.ledger = ledger;
    this.pacer = pacer;
    this.deadline = deadline;
    this.trace = trace;
    this.clock = clock;
    this.values = new Random(parameters.clientId());
  }

  @Override
  public long issue() throws IOException, InterruptedException {
    // clients started together do not all fire their first batch at once
    Thread.sleep(Math.max(0, parameters.clientId()));

    int batchSize = parameters.batchSize();
    int next = 0;
    while (next < workload.size() && !deadline.expired()) {
      int end = Math.min(next + batchSize, workload.size());
      List<Command> batch = nextBatch(next, end);

      if (!pacer.awaitTick(deadline)) {
        break;
      }
      long timestamp = clock.millis();
      if (!ledger.reserveBefore(1, deadline)) {
        break;
      }
      var transaction = Transaction.of(batch, timestamp, end);
      codec.writeTransaction(output, transaction);
      output.flush();
      traceInvocations(transaction);

      issuedBatches++;
      next = end;
    }
    log.info(
        "ABD issuer done: {} batches, {} of {} operations sent",
        issuedBatches,
        next,
        workload.size());
    return issuedBatches;
  }

  private List<Command> nextBatch(int from, int to) {
    List<Command> batch = new ArrayList<>(to - from);
    for (int i = from; i < to; i++) {
      long key = workload.key(i);
      batch.add(
          workload.isRead(i) ? Command.get(key) : Command.put(key, values.nextLong(VALUE_BOUND)));
    }
    return batch;
  }

  private void traceInvocations(Transaction transaction) {
    for (Command command : transaction.commands()) {
      trace.record(
          TraceEvent.invocation(
              parameters.clientId(),
              transaction.transactionId(),
              command.operation().name(),
              command.key(),
              command.value(),
              transaction.timestamp()));
    }
  }

  @Override
  public long issuedBatches() {
    return issuedBatches;
  }
}
