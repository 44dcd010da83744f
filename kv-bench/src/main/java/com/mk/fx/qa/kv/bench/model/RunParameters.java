package com.mk.fx.qa.kv.bench.model;

import com.mk.fx.qa.kv.bench.exception.ConfigurationException;
import java.time.Duration;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable parameters of one benchmark run. Built once before issuance and handed to every
 * component; nothing reads configuration from anywhere else.
 *
 * @param clientId identity of this client, also the workload seed and the startup stagger in ms
 * @param protocol protocol spoken with the server
 * @param durationSeconds run duration; the deadline is a hard cutoff
 * @param requestCount total operations to generate
 * @param concurrency maximum outstanding batches
 * @param batchSize operations per batch
 * @param keySpace number of distinct keys for the Zipfian distribution
 * @param readRatio probability that an operation (or batch, in separate mode) is a read
 * @param distribution key distribution
 * @param zipfianTheta Zipfian skew, in (0,1)
 * @param conflictPercentage probability in percent of hitting the hot key, in [0,100]
 * @param startRange offset of the unique key range
 * @param separateBatchTypes when set, all operations of a batch share one read/write draw
 * @param linearizabilityCheck when set, every invocation and response is traced
 * @param dumpLatency when set, every recorded latency is written to a file at the end
 * @param bufferSize capacity of the decoded response queue
 */
@Builder(toBuilder = true)
public record RunParameters(
    int clientId,
    Protocol protocol,
    int durationSeconds,
    int requestCount,
    int concurrency,
    int batchSize,
    int keySpace,
    double readRatio,
    Distribution distribution,
    double zipfianTheta,
    int conflictPercentage,
    int startRange,
    boolean separateBatchTypes,
    boolean linearizabilityCheck,
    boolean dumpLatency,
    int bufferSize) {

  public RunParameters {
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(distribution, "distribution");
    if (conflictPercentage < 0 || conflictPercentage > 100) {
      throw new ConfigurationException(
          "Conflicts percentage must be between 0 and 100, got " + conflictPercentage);
    }
    if (durationSeconds <= 0) {
      throw new ConfigurationException("Run duration must be positive, got " + durationSeconds);
    }
    if (requestCount < 0) {
      throw new ConfigurationException("Request count must not be negative, got " + requestCount);
    }
    if (concurrency < 1) {
      throw new ConfigurationException("Concurrency must be at least 1, got " + concurrency);
    }
    if (batchSize < 1) {
      throw new ConfigurationException("Batch size must be at least 1, got " + batchSize);
    }
    if (bufferSize < 1) {
      throw new ConfigurationException("Buffer size must be at least 1, got " + bufferSize);
    }
    if (distribution == Distribution.ZIPFIAN) {
      if (keySpace < 1) {
        throw new ConfigurationException("Key space must be at least 1, got " + keySpace);
      }
      if (!(zipfianTheta > 0.0 && zipfianTheta < 1.0)) {
        throw new ConfigurationException("Zipfian theta must be in (0,1), got " + zipfianTheta);
      }
    }
  }

  public Duration duration() {
    return Duration.ofSeconds(durationSeconds);
  }

  /** Number of pacing slots; one more than the full batches so it is never zero. */
  public int batchCount() {
    return requestCount / batchSize + 1;
  }
}
