package com.bdi.pipeline.store;

import java.util.List;

/**
 * Outcome of one {@link RecordStore#putBatch} call.
 *
 * @param written records stored for the first time
 * @param duplicates records whose write-once key was already stored
 * @param failures records that were not applied
 */
public record PutBatchResult(int written, int duplicates, List<RecordFailure> failures) {

  public PutBatchResult {
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public int applied() {
    return written + duplicates;
  }

  public List<RecordFailure> conflicts() {
    return failures.stream().filter(failure -> !failure.isTransient()).toList();
  }
}
