package com.bdi.pipeline.checkpoint;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable watermark of one source.
 *
 * <p>Everything before {@code cursor} has been persisted and acknowledged. The version grows by
 * one on every commit and guards against concurrent writers.
 *
 * @param sourceId source the watermark belongs to
 * @param cursor cursor to resume fetching from
 * @param version commit counter, 1 for the first commit
 * @param lastBatchId last acknowledged batch
 * @param updatedAt commit time
 */
public record Checkpoint(
    String sourceId,
    String cursor,
    long version,
    String lastBatchId,
    Instant updatedAt) {

  public Checkpoint {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(cursor, "cursor");
  }

  public static Checkpoint first(String sourceId, String cursor, String batchId, Instant now) {
    return new Checkpoint(sourceId, cursor, 1L, batchId, now);
  }

  public Checkpoint advance(String nextCursor, String batchId, Instant now) {
    return new Checkpoint(sourceId, nextCursor, version + 1, batchId, now);
  }
}
