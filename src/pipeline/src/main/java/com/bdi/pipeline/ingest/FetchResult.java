package com.bdi.pipeline.ingest;

import com.bdi.pipeline.model.RawBatch;

/**
 * Outcome of one source fetch.
 *
 * @param batch fetched batch, {@code null} at end of stream
 * @param nextCursor cursor following the batch, {@code null} at end of stream
 */
public record FetchResult(RawBatch batch, String nextCursor) {

  private static final FetchResult END_OF_STREAM = new FetchResult(null, null);

  public static FetchResult of(RawBatch batch, String nextCursor) {
    if (batch == null || nextCursor == null) {
      throw new IllegalArgumentException("batch and next cursor are required");
    }
    return new FetchResult(batch, nextCursor);
  }

  public static FetchResult endOfStream() {
    return END_OF_STREAM;
  }

  public boolean isEndOfStream() {
    return batch == null;
  }
}
