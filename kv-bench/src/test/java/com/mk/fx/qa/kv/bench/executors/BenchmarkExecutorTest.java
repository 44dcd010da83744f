package com.mk.fx.qa.kv.bench.executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.kv.bench.executors.StubKvServer.Behavior;
import com.mk.fx.qa.kv.bench.model.Protocol;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.model.RunParametersFixture;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.wire.KvConnection;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class BenchmarkExecutorTest {

  private static BenchmarkResult run(StubKvServer server, RunParameters params) throws Exception {
    try (var connection = KvConnection.open(server.host(), server.port(), Duration.ofSeconds(2))) {
      return BenchmarkExecutor.execute(params, connection, OperationTrace.NONE, Clock.systemUTC());
    }
  }

  @Test
  void abd_everyOperationAcknowledgedWithinDeadline() throws Exception {
    var params = RunParametersFixture.abd().requestCount(50).batchSize(10).concurrency(5).build();

    try (var server = StubKvServer.start(Protocol.ABD, Behavior.REPLY)) {
      BenchmarkResult result = run(server, params);

      assertEquals(5, result.issuedBatches());
      assertEquals(50, result.summary().getAcknowledged());
      assertEquals(0, result.outstandingUnits());
      assertEquals(50, server.receivedOperations());
      assertThat(result.summary().latencies()).hasSize(50);
    }
  }

  @Test
  void abd_singleOperationTransactions_eachAcknowledgedWithItsLatency() throws Exception {
    var params =
        RunParametersFixture.abd().requestCount(3).batchSize(1).concurrency(1).readRatio(0).build();

    try (var server = StubKvServer.start(Protocol.ABD, Behavior.REPLY)) {
      BenchmarkResult result = run(server, params);

      assertEquals(3, result.issuedBatches());
      assertEquals(3, result.summary().getAcknowledged());
      assertEquals(3, result.summary().getWrites());
      assertEquals(0, result.outstandingUnits());
      long[] latencies = result.summary().latencies();
      assertThat(latencies).hasSize(3);
      assertThat(Arrays.stream(latencies).min().getAsLong()).isNotNegative();
    }
  }

  @Test
  void abd_deadlineWithUnacknowledgedBatches_keepsPartialResults() throws Exception {
    var params =
        RunParametersFixture.abd()
            .durationSeconds(2)
            .requestCount(100)
            .batchSize(10)
            .concurrency(10)
            .build();

    try (var server = StubKvServer.answeringFirst(8)) {
      BenchmarkResult result = run(server, params);

      assertEquals(10, result.issuedBatches());
      assertEquals(80, result.summary().getAcknowledged());
      assertThat(result.summary().latencies()).hasSize(80);
      assertEquals(2, result.outstandingUnits());
      assertEquals(0, result.summary().getDecodeFailures());
    }
  }

  @Test
  void abd_fragmentedResponsesReleaseEachTransactionOnce() throws Exception {
    var params = RunParametersFixture.abd().requestCount(40).batchSize(10).concurrency(1).build();

    try (var server = StubKvServer.start(Protocol.ABD, Behavior.FRAGMENTED)) {
      BenchmarkResult result = run(server, params);

      assertEquals(4, result.issuedBatches());
      assertEquals(40, result.summary().getAcknowledged());
      assertEquals(0, result.outstandingUnits());
    }
  }

  @Test
  void abd_silentServerStarvesAdmission() throws Exception {
    var params = RunParametersFixture.abd().requestCount(100).batchSize(10).concurrency(2).build();

    try (var server = StubKvServer.start(Protocol.ABD, Behavior.SILENT)) {
      BenchmarkResult result = run(server, params);

      assertEquals(2, result.issuedBatches());
      assertEquals(0, result.summary().getAcknowledged());
      assertEquals(2, result.outstandingUnits());
    }
  }

  @Test
  void abd_readAccountingFollowsResponsesWithValues() throws Exception {
    var params =
        RunParametersFixture.abd()
            .requestCount(30)
            .batchSize(10)
            .readRatio(1.0)
            .separateBatchTypes(true)
            .build();

    try (var server = StubKvServer.start(Protocol.ABD, Behavior.REPLY)) {
      BenchmarkResult result = run(server, params);

      assertEquals(30, result.summary().getReads());
      assertEquals(0, result.summary().getWrites());
      assertEquals(0, result.summary().getSlow());
    }
  }

  @Test
  void fastPath_everyProposalAcknowledged() throws Exception {
    var params = RunParametersFixture.fastPath().requestCount(50).batchSize(10).build();

    try (var server = StubKvServer.start(Protocol.FAST_PATH, Behavior.REPLY)) {
      BenchmarkResult result = run(server, params);

      assertEquals(5, result.issuedBatches());
      assertEquals(50, result.summary().getAcknowledged());
      // replies do not tell reads from writes
      assertEquals(50, result.summary().getReads());
      assertEquals(0, result.outstandingUnits());
    }
  }

  @Test
  void fastPath_silentServerLeavesAnnouncedOperationsOutstanding() throws Exception {
    var params =
        RunParametersFixture.fastPath().requestCount(50).batchSize(10).concurrency(5).build();

    try (var server = StubKvServer.start(Protocol.FAST_PATH, Behavior.SILENT)) {
      BenchmarkResult result = run(server, params);

      assertEquals(0, result.summary().getAcknowledged());
      assertThat(result.outstandingUnits()).isPositive();
    }
  }
}
