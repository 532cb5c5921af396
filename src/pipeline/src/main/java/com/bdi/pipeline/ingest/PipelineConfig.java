package com.bdi.pipeline.ingest;

import java.time.Duration;

/**
 * Tuning of the ingestion pipeline.
 *
 * @param batchSize maximum raw records per fetched batch
 * @param retryLimit total attempts of a failing stage, first attempt included
 * @param staleBound maximum age of a cached aggregate result
 * @param fetchTimeout timeout of one source fetch
 * @param storeTimeout timeout of one store operation
 * @param initialBackoff delay before the second attempt
 * @param maxBackoff upper bound of the exponential backoff
 * @param partitions number of single-writer store partitions
 * @param maxInFlightBatches batches fetched but not yet persisted, at most
 * @param workerThreads normalization worker pool size
 */
public record PipelineConfig(
    int batchSize,
    int retryLimit,
    Duration staleBound,
    Duration fetchTimeout,
    Duration storeTimeout,
    Duration initialBackoff,
    Duration maxBackoff,
    int partitions,
    int maxInFlightBatches,
    int workerThreads) {

  public PipelineConfig {
    requirePositive("batchSize", batchSize);
    requirePositive("retryLimit", retryLimit);
    requirePositive("partitions", partitions);
    requirePositive("maxInFlightBatches", maxInFlightBatches);
    requirePositive("workerThreads", workerThreads);
    staleBound = staleBound == null ? Duration.ZERO : staleBound;
    fetchTimeout = fetchTimeout == null ? Duration.ofSeconds(30) : fetchTimeout;
    storeTimeout = storeTimeout == null ? Duration.ofSeconds(10) : storeTimeout;
    initialBackoff = initialBackoff == null ? Duration.ofMillis(200) : initialBackoff;
    maxBackoff = maxBackoff == null ? Duration.ofSeconds(5) : maxBackoff;
    if (staleBound.isNegative() || initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("durations must not be negative");
    }
    if (fetchTimeout.isZero() || fetchTimeout.isNegative() || storeTimeout.isZero() || storeTimeout.isNegative()) {
      throw new IllegalArgumentException("timeouts must be positive");
    }
  }

  public static PipelineConfig defaults() {
    return new PipelineConfig(
        1000,
        3,
        Duration.ofSeconds(5),
        Duration.ofSeconds(30),
        Duration.ofSeconds(10),
        Duration.ofMillis(200),
        Duration.ofSeconds(5),
        4,
        4,
        2);
  }

  public RetryPolicy retryPolicy() {
    return new RetryPolicy(retryLimit, initialBackoff, maxBackoff);
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }
}
