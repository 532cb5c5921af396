package com.bdi.api.model;

import com.bdi.pipeline.ingest.BatchState;
import com.bdi.pipeline.ingest.BatchSummary;
import com.bdi.pipeline.ingest.IngestionReport;
import java.util.List;

/**
 * Response contract for a triggered ingestion run.
 *
 * @param sourceId source that was read
 * @param startCursor checkpoint cursor the run started from
 * @param checkpointCursor checkpoint cursor after the run
 * @param endOfStream whether the source ran out of files
 * @param acknowledged batches acknowledged by the run
 * @param failed batches that failed
 * @param cancelled batches that were cancelled
 * @param recordsFetched raw records fetched
 * @param recordsPersisted records stored for the first time
 * @param rejections records rejected by normalization
 * @param batches per-batch outcome in cursor order
 */
public record IngestionRunResponse(
    String sourceId,
    String startCursor,
    String checkpointCursor,
    boolean endOfStream,
    long acknowledged,
    long failed,
    long cancelled,
    long recordsFetched,
    long recordsPersisted,
    long rejections,
    List<BatchSummary> batches) {

  public static IngestionRunResponse from(IngestionReport report) {
    return new IngestionRunResponse(
        report.sourceId(),
        report.startCursor(),
        report.checkpointCursor(),
        report.endOfStream(),
        report.count(BatchState.ACKNOWLEDGED),
        report.count(BatchState.FAILED),
        report.count(BatchState.CANCELLED),
        report.recordsFetched(),
        report.recordsPersisted(),
        report.rejections(),
        report.batches());
  }
}
