package com.mk.fx.qa.kv.bench.executors.abd;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.kv.bench.admission.BatchPacer;
import com.mk.fx.qa.kv.bench.admission.PermitLedger;
import com.mk.fx.qa.kv.bench.admission.RunDeadline;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.model.RunParametersFixture;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.trace.TraceEvent;
import com.mk.fx.qa.kv.bench.wire.codec.AbdCodec;
import com.mk.fx.qa.kv.bench.wire.model.Command;
import com.mk.fx.qa.kv.bench.wire.model.Operation;
import com.mk.fx.qa.kv.bench.wire.model.Transaction;
import com.mk.fx.qa.kv.bench.workload.WorkloadGenerator;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AbdIssuerTest {

  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
  private final AbdCodec codec = new AbdCodec();
  private final Clock clock = Clock.fixed(Instant.ofEpochMilli(777), ZoneOffset.UTC);

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  private List<Transaction> decodeAll(byte[] bytes) throws Exception {
    var in = new ByteArrayInputStream(bytes);
    List<Transaction> transactions = new ArrayList<>();
    while (in.available() > 0) {
      transactions.add(codec.readTransaction(in));
    }
    return transactions;
  }

  @Test
  void issuesSortedTransactionsWithCumulativeIds() throws Exception {
    RunParameters params =
        RunParametersFixture.abd()
            .requestCount(25)
            .batchSize(10)
            .concurrency(10)
            .conflictPercentage(50)
            .build();
    var out = new ByteArrayOutputStream();
    var ledger = new PermitLedger(params.concurrency());
    var deadline = RunDeadline.manual(Duration.ofSeconds(10));
    List<TraceEvent> events = new CopyOnWriteArrayList<>();
    OperationTrace trace =
        new OperationTrace() {
          @Override
          public void record(TraceEvent event) {
            events.add(event);
          }

          @Override
          public void close() {}
        };

    try (var pacer = BatchPacer.start(TimeUnit.MILLISECONDS.toNanos(5), scheduler)) {
      var issuer =
          new AbdIssuer(
              params,
              WorkloadGenerator.generate(params),
              out,
              codec,
              ledger,
              pacer,
              deadline,
              trace,
              clock);
      assertEquals(3, issuer.issue());
    }

    List<Transaction> transactions = decodeAll(out.toByteArray());
    assertThat(transactions).extracting(Transaction::transactionId).containsExactly(10L, 20L, 25L);
    assertThat(transactions).extracting(Transaction::size).containsExactly(10, 10, 5);
    for (Transaction transaction : transactions) {
      assertEquals(777, transaction.timestamp());
      assertThat(transaction.commands())
          .isSortedAccordingTo(Comparator.comparingLong(Command::key));
      boolean allGets =
          transaction.commands().stream().allMatch(c -> c.operation() == Operation.GET);
      assertEquals(allGets, transaction.readOnly());
      transaction.commands().stream()
          .filter(c -> c.operation() == Operation.PUT)
          .forEach(c -> assertThat(c.value()).isBetween(0L, 9_999_999L));
    }
    assertEquals(3, ledger.outstanding());
    assertEquals(25, events.size());
  }

  @Test
  void stopsAtAdmissionLimitUntilDeadline() throws Exception {
    RunParameters params =
        RunParametersFixture.abd().requestCount(100).batchSize(10).concurrency(1).build();
    var out = new ByteArrayOutputStream();
    var ledger = new PermitLedger(1);
    var deadline = RunDeadline.manual(Duration.ofSeconds(10));

    try (var pacer = BatchPacer.start(TimeUnit.MILLISECONDS.toNanos(5), scheduler)) {
      var issuer =
          new AbdIssuer(
              params,
              WorkloadGenerator.generate(params),
              out,
              codec,
              ledger,
              pacer,
              deadline,
              OperationTrace.NONE,
              clock);
      CompletableFuture<Long> issued =
          CompletableFuture.supplyAsync(
              () -> {
                try {
                  return issuer.issue();
                } catch (Exception e) {
                  throw new IllegalStateException(e);
                }
              });

      await().atMost(2, TimeUnit.SECONDS).until(() -> ledger.outstanding() == 1);
      TimeUnit.MILLISECONDS.sleep(200);
      deadline.expireNow();

      assertEquals(1L, issued.get(2, TimeUnit.SECONDS));
    }
    assertEquals(1, decodeAll(out.toByteArray()).size());
  }

  @Test
  void expiredDeadline_issuesNothing() throws Exception {
    RunParameters params = RunParametersFixture.abd().build();
    var out = new ByteArrayOutputStream();
    var deadline = RunDeadline.manual(Duration.ofSeconds(1));
    deadline.expireNow();

    try (var pacer = BatchPacer.start(TimeUnit.MILLISECONDS.toNanos(5), scheduler)) {
      var issuer =
          new AbdIssuer(
              params,
              WorkloadGenerator.generate(params),
              out,
              codec,
              new PermitLedger(1),
              pacer,
              deadline,
              OperationTrace.NONE,
              clock);
      assertEquals(0, issuer.issue());
    }
    assertEquals(0, out.size());
  }
}
