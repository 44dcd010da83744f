package com.mk.fx.qa.kv.bench.workload;

import com.mk.fx.qa.kv.bench.model.Distribution;
import com.mk.fx.qa.kv.bench.model.RunParameters;
import java.util.Objects;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates the whole request stream of a run up front.
 *
 * <p>Keys: under {@link Distribution#ZIPFIAN} they come from a Zipfian generator; otherwise an
 * operation hits {@link #HOT_KEY} with the conflict probability and a key unique to this client
 * and index elsewhere. Reads: each operation draws against the read ratio, unless batches are
 * separated, in which case one draw per batch applies to all of its operations.
 *
 * <p>Both random sources are seeded with the client id, so a client regenerates the same stream.
 * Two clients with different ids get different streams.
 */
@Slf4j
public final class WorkloadGenerator {

  /** Key shared by all clients under the conflict distribution. */
  public static final long HOT_KEY = 42L;

  /** Unique keys start just above the hot key. */
  public static final long UNIQUE_KEY_OFFSET = 43L;

  private static final long CLASSIFICATION_SEED_MIX = 0x5DEECE66DL;

  private WorkloadGenerator() {
    throw new UnsupportedOperationException("WorkloadGenerator cannot be instantiated");
  }

  public static Workload generate(RunParameters parameters) {
    Objects.requireNonNull(parameters, "parameters");
    int n = parameters.requestCount();
    long[] keys = new long[n];
    boolean[] reads = new boolean[n];

    Random keyRandom = new Random(parameters.clientId());
    Random readRandom = new Random(parameters.clientId() ^ CLASSIFICATION_SEED_MIX);

    if (parameters.distribution() == Distribution.ZIPFIAN) {
      var zipfian = new ZipfianGenerator(parameters.keySpace(), parameters.zipfianTheta());
      for (int i = 0; i < n; i++) {
        keys[i] = zipfian.next(keyRandom);
      }
    } else {
      for (int i = 0; i < n; i++) {
        keys[i] =
            keyRandom.nextInt(100) < parameters.conflictPercentage()
                ? HOT_KEY
                : parameters.startRange() + UNIQUE_KEY_OFFSET + i;
      }
    }

    int batchSize = parameters.batchSize();
    for (int i = 0; i < n; ) {
      if (parameters.separateBatchTypes()) {
        boolean read = readRandom.nextDouble() < parameters.readRatio();
        int end = Math.min(n, i + batchSize);
        for (; i < end; i++) {
          reads[i] = read;
        }
      } else {
        reads[i] = readRandom.nextDouble() < parameters.readRatio();
        i++;
      }
    }

    var workload = new Workload(keys, reads);
    log.info(
        "Client {} generated {} operations: distribution={}, theta={}, conflicts={}%, readRatio={},"
            + " separate={}, reads={}",
        parameters.clientId(),
        n,
        parameters.distribution(),
        parameters.zipfianTheta(),
        parameters.conflictPercentage(),
        parameters.readRatio(),
        parameters.separateBatchTypes(),
        workload.readCount());
    return workload;
  }
}
