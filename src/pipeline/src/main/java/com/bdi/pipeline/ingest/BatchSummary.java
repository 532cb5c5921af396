package com.bdi.pipeline.ingest;

import com.bdi.pipeline.normalize.Rejection;
import java.time.Instant;
import java.util.List;

/**
 * Immutable view of an ingestion batch.
 *
 * @param batchId source-assigned batch id, or {@code null} while fetching
 * @param cursor cursor the batch was fetched from
 * @param nextCursor cursor following the batch, {@code null} until fetched
 * @param sequence source order of the batch
 * @param state lifecycle state
 * @param fetched raw records fetched
 * @param accepted records that passed normalization
 * @param rejected records rejected by normalization
 * @param persisted records stored for the first time
 * @param duplicates records that were already stored
 * @param failedStage stage that failed, {@code null} unless the batch failed
 * @param failure failure message, {@code null} unless the batch failed
 * @param rejections reason-coded rejections
 * @param startedAt time the fetch started
 * @param updatedAt time of the last state change
 */
public record BatchSummary(
    String batchId,
    String cursor,
    String nextCursor,
    long sequence,
    BatchState state,
    int fetched,
    int accepted,
    int rejected,
    int persisted,
    int duplicates,
    String failedStage,
    String failure,
    List<Rejection> rejections,
    Instant startedAt,
    Instant updatedAt) {

  public BatchSummary {
    rejections = rejections == null ? List.of() : List.copyOf(rejections);
  }
}
