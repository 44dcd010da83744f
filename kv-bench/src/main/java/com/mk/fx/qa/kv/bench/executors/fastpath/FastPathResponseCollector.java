package com.mk.fx.qa.kv.bench.executors.fastpath;

import com.mk.fx.qa.kv.bench.admission.CountingLedger;
import com.mk.fx.qa.kv.bench.admission.RunDeadline;
import com.mk.fx.qa.kv.bench.executors.ResponseCollector;
import com.mk.fx.qa.kv.bench.metrics.Summary;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.trace.TraceEvent;
import com.mk.fx.qa.kv.bench.wire.codec.FastPathCodec;
import com.mk.fx.qa.kv.bench.wire.codec.WireFormatException;
import com.mk.fx.qa.kv.bench.wire.model.ProposeReply;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads exactly as many replies as each batch announcement says. The protocol does not tell reads
 * from writes, so every acknowledged reply is counted as a read.
 */
@Slf4j
public final class FastPathResponseCollector implements ResponseCollector {

  private static final Duration POLL = Duration.ofMillis(50);

  private final RunParameters parameters;
  private final InputStream input;
  private final CountingLedger ledger;
  private final RunDeadline deadline;
  private final OperationTrace trace;
  private final Clock clock;
  private final Summary summary;

  public FastPathResponseCollector(
      RunParameters parameters,
      InputStream input,
      CountingLedger ledger,
      RunDeadline deadline,
      OperationTrace trace,
      Clock clock) {
    this.parameters = parameters;
    this.input = input;
    this.ledger = ledger;
    this.deadline = deadline;
    this.trace = trace;
    this.clock = clock;
    this.summary = new Summary(parameters.requestCount());
  }

  @Override
  public Summary collect() throws InterruptedException {
    long batches = 0;
    boolean streamOpen = true;
    while (streamOpen && !deadline.expired()) {
      Integer announced = ledger.nextAnnouncement(POLL);
      if (announced == null) {
        continue;
      }
      int consumed = 0;
      while (consumed < announced && !deadline.expired()) {
        try {
          ProposeReply reply = FastPathCodec.readProposeReply(input);
          consumed++;
          onReply(reply);
        } catch (WireFormatException e) {
          consumed++;
          summary.recordDecodeFailure(e);
          log.warn("Skipping undecodable reply: {}", e.getMessage());
        } catch (IOException e) {
          if (!deadline.expired()) {
            summary.recordDecodeFailure(e);
            log.warn("Reply stream ended: {}", e.toString());
          }
          streamOpen = false;
          break;
        }
      }
      ledger.release(consumed);
      batches++;
    }
    if (!streamOpen) {
      deadline.await();
    }
    log.info(
        "Fast-path collector done: {} replies in {} batches, {} decode failures",
        summary.getAcknowledged(),
        batches,
        summary.getDecodeFailures());
    return summary;
  }

  private void onReply(ProposeReply reply) {
    long latency = clock.millis() - reply.timestamp();
    summary.recordAcknowledged(1, latency);
    summary.recordReads(1);
    trace.record(
        TraceEvent.response(
            parameters.clientId(), reply.commandId(), reply.value(), clock.millis()));
  }
}
