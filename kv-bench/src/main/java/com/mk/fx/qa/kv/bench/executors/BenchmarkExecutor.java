package com.mk.fx.qa.kv.bench.executors;

import com.mk.fx.qa.kv.bench.admission.AdmissionLedger;
import com.mk.fx.qa.kv.bench.admission.BatchPacer;
import com.mk.fx.qa.kv.bench.admission.CountingLedger;
import com.mk.fx.qa.kv.bench.admission.PermitLedger;
import com.mk.fx.qa.kv.bench.admission.RunDeadline;
import com.mk.fx.qa.kv.bench.exception.BenchmarkExecutionException;
import com.mk.fx.qa.kv.bench.executors.abd.AbdIssuer;
import com.mk.fx.qa.kv.bench.executors.abd.AbdResponseCollector;
import com.mk.fx.qa.kv.bench.executors.abd.DecodeResult;
import com.mk.fx.qa.kv.bench.executors.abd.ResponseDecoder;
import com.mk.fx.qa.kv.bench.executors.fastpath.FastPathIssuer;
import com.mk.fx.qa.kv.bench.executors.fastpath.FastPathResponseCollector;
import com.mk.fx.qa.kv.bench.metrics.Summary;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import com.mk.fx.qa.kv.bench.trace.OperationTrace;
import com.mk.fx.qa.kv.bench.wire.KvConnection;
import com.mk.fx.qa.kv.bench.wire.codec.AbdCodec;
import com.mk.fx.qa.kv.bench.workload.Workload;
import com.mk.fx.qa.kv.bench.workload.WorkloadGenerator;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one benchmark over an open connection: generates the workload, starts the issuer and the
 * collector (plus the decoder for the quorum protocol) and returns once the deadline has fired and
 * the collector has handed over its summary.
 */
@Slf4j
public final class BenchmarkExecutor {

  /** How long the issuer and the collector get to stop after the deadline. */
  static final Duration STOP_GRACE = Duration.ofSeconds(2);

  private static final long WATCH_MILLIS = 50L;

  private BenchmarkExecutor() {
    throw new UnsupportedOperationException("BenchmarkExecutor cannot be instantiated");
  }

  public static BenchmarkResult execute(
      RunParameters parameters, KvConnection connection, OperationTrace trace, Clock clock)
      throws InterruptedException {
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(trace, "trace");
    Objects.requireNonNull(clock, "clock");

    Workload workload = WorkloadGenerator.generate(parameters);
    log.info(
        "Client {} starting {} run: duration={}s, requests={}, batchSize={}, concurrency={},"
            + " readRatio={}, distribution={}",
        parameters.clientId(),
        parameters.protocol().label(),
        parameters.durationSeconds(),
        parameters.requestCount(),
        parameters.batchSize(),
        parameters.concurrency(),
        parameters.readRatio(),
        parameters.distribution());

    ExecutorService tasks =
        Executors.newFixedThreadPool(3, daemonThreads("kv-bench-" + parameters.clientId()));
    ScheduledExecutorService timers =
        Executors.newScheduledThreadPool(
            2, daemonThreads("kv-bench-timer-" + parameters.clientId()));
    BatchPacer pacer = null;
    try {
      RunDeadline deadline = RunDeadline.start(parameters.duration(), timers);
      pacer =
          BatchPacer.start(
              BatchPacer.intervalNanos(parameters.duration(), parameters.batchCount()), timers);

      Pipeline pipeline =
          switch (parameters.protocol()) {
            case ABD ->
                abdPipeline(parameters, workload, connection, pacer, deadline, trace, clock);
            case FAST_PATH ->
                fastPathPipeline(parameters, workload, connection, pacer, deadline, trace, clock);
          };

      pipeline.background().forEach(tasks::execute);
      Future<Summary> collector = tasks.submit(pipeline.collector()::collect);
      Future<Long> issuer = tasks.submit(pipeline.issuer()::issue);

      while (!deadline.await(WATCH_MILLIS, TimeUnit.MILLISECONDS)) {
        failIfCrashed(issuer, "Issuer");
        failIfCrashed(collector, "Collector");
      }

      boolean forcedClose = false;
      long issued;
      try {
        issued = awaitStop(issuer, "Issuer", connection);
      } catch (ForcedStop stop) {
        forcedClose = true;
        issued = pipeline.issuer().issuedBatches();
      }
      Summary summary;
      try {
        summary = awaitStop(collector, "Collector", connection);
      } catch (ForcedStop stop) {
        throw new BenchmarkExecutionException(
            "Collector failed after the connection was closed", stop.getCause());
      }
      if (forcedClose) {
        log.warn("Issuer had to be stopped by closing the connection");
      }
      long outstanding = pipeline.ledger().outstanding();
      log.info(
          "Client {} run finished: {} batches issued, {} operations acknowledged,"
              + " {} units outstanding",
          parameters.clientId(),
          issued,
          summary.getAcknowledged(),
          outstanding);
      return new BenchmarkResult(summary, issued, outstanding);
    } finally {
      if (pacer != null) {
        pacer.close();
      }
      tasks.shutdownNow();
      timers.shutdownNow();
    }
  }

  private static Pipeline abdPipeline(
      RunParameters parameters,
      Workload workload,
      KvConnection connection,
      BatchPacer pacer,
      RunDeadline deadline,
      OperationTrace trace,
      Clock clock) {
    var codec = new AbdCodec();
    var ledger = new PermitLedger(parameters.concurrency());
    BlockingQueue<DecodeResult> results = new ArrayBlockingQueue<>(parameters.bufferSize());
    var issuer =
        new AbdIssuer(
            parameters,
            workload,
            connection.output(),
            codec,
            ledger,
            pacer,
            deadline,
            trace,
            clock);
    var collector = new AbdResponseCollector(parameters, results, ledger, deadline, trace, clock);
    var decoder = new ResponseDecoder(connection.input(), codec, results);
    return new Pipeline(issuer, collector, List.of(decoder), ledger);
  }

  private static Pipeline fastPathPipeline(
      RunParameters parameters,
      Workload workload,
      KvConnection connection,
      BatchPacer pacer,
      RunDeadline deadline,
      OperationTrace trace,
      Clock clock) {
    var ledger = new CountingLedger(parameters.concurrency());
    var issuer =
        new FastPathIssuer(
            parameters, workload, connection.output(), ledger, pacer, deadline, trace, clock);
    var collector =
        new FastPathResponseCollector(
            parameters, connection.input(), ledger, deadline, trace, clock);
    return new Pipeline(issuer, collector, List.of(), ledger);
  }

  private static void failIfCrashed(Future<?> future, String role) throws InterruptedException {
    if (!future.isDone()) {
      return;
    }
    try {
      future.get();
    } catch (ExecutionException e) {
      log.error("{} failed: {}", role, e.getCause().getMessage(), e.getCause());
      throw new BenchmarkExecutionException(role + " failed", e.getCause());
    }
  }

  /**
   * Waits for a task to finish after the deadline. A task still running after the grace period is
   * blocked on the socket, so the connection is closed under it.
   */
  private static <T> T awaitStop(Future<T> future, String role, KvConnection connection)
      throws InterruptedException {
    try {
      return future.get(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new BenchmarkExecutionException(role + " failed", e.getCause());
    } catch (TimeoutException e) {
      log.warn("{} still running {} after the deadline, closing connection", role, STOP_GRACE);
      closeQuietly(connection);
    }
    try {
      return future.get(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new ForcedStop(e.getCause());
    } catch (TimeoutException e) {
      throw new BenchmarkExecutionException(role + " did not stop after the connection was closed");
    }
  }

  private static void closeQuietly(KvConnection connection) {
    try {
      connection.close();
    } catch (IOException e) {
      log.debug("Closing connection failed: {}", e.getMessage());
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private record Pipeline(
      ProtocolIssuer issuer,
      ResponseCollector collector,
      List<Runnable> background,
      AdmissionLedger ledger) {}

  /** A task failed only because the connection was closed under it. */
  private static final class ForcedStop extends RuntimeException {
    ForcedStop(Throwable cause) {
      super(cause);
    }
  }
}
