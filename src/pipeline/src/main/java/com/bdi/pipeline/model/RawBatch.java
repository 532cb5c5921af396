package com.bdi.pipeline.model;

import java.time.Instant;
import java.util.List;

/**
 * Raw records returned by one source fetch.
 *
 * <p>The batch id must be stable for a given cursor so that re-fetching after a restart
 * produces the same write-once keys.
 *
 * @param batchId stable provenance tag
 * @param cursor cursor the batch was fetched from
 * @param sequence source order of the batch, increasing with the cursor
 * @param fetchedAt fetch time
 * @param records raw records in source order
 */
public record RawBatch(
    String batchId,
    String cursor,
    long sequence,
    Instant fetchedAt,
    List<RawRecord> records) {

  public RawBatch {
    records = records == null ? List.of() : List.copyOf(records);
  }

  public int size() {
    return records.size();
  }
}
