package com.bdi.pipeline.ingest;

import java.util.List;

/**
 * Outcome of one {@link IngestionCoordinator#ingest(int)} run.
 *
 * @param sourceId source that was read
 * @param startCursor checkpoint cursor the run started from
 * @param checkpointCursor checkpoint cursor after the run
 * @param endOfStream whether the source reported end-of-stream
 * @param batches batches handled by the run, in cursor order
 */
public record IngestionReport(
    String sourceId,
    String startCursor,
    String checkpointCursor,
    boolean endOfStream,
    List<BatchSummary> batches) {

  public IngestionReport {
    batches = List.copyOf(batches);
  }

  public long count(BatchState state) {
    return batches.stream().filter(batch -> batch.state() == state).count();
  }

  public long recordsFetched() {
    return batches.stream().mapToLong(BatchSummary::fetched).sum();
  }

  public long recordsPersisted() {
    return batches.stream().mapToLong(BatchSummary::persisted).sum();
  }

  public long rejections() {
    return batches.stream().mapToLong(BatchSummary::rejected).sum();
  }

  public boolean isSuccessful() {
    return batches.stream().allMatch(batch -> batch.state() == BatchState.ACKNOWLEDGED);
  }
}
