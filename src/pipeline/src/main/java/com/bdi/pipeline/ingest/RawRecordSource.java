package com.bdi.pipeline.ingest;

/**
 * External bulk source of raw records, read batch by batch.
 *
 * <p>Cursors are opaque strings owned by the source. A batch fetched from a given cursor must
 * always carry the same batch id and sequence, and sequences must increase with the cursor.
 */
public interface RawRecordSource {

  /** Identifies the source in checkpoints and logs. */
  String sourceId();

  /** Cursor to start from when no checkpoint exists. */
  String initialCursor();

  /**
   * Fetches the batch starting at {@code cursor}.
   *
   * @return a batch with the cursor that follows it, or end-of-stream
   * @throws com.bdi.pipeline.error.TransientInfraException on a retryable source error
   */
  FetchResult fetchBatch(String cursor);
}
