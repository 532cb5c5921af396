package com.bdi.pipeline.store;

import com.bdi.pipeline.model.RecordKey;

/**
 * A record a batch write did not apply.
 *
 * @param key write-once key of the record
 * @param kind whether retrying the record may succeed
 * @param reason human-readable cause
 */
public record RecordFailure(RecordKey key, Kind kind, String reason) {

  public enum Kind {
    /** Store timeout or unavailability; the record may be retried as-is. */
    TRANSIENT,
    /** The record cannot be merged into the stored state of its entity. */
    CONFLICT
  }

  public boolean isTransient() {
    return kind == Kind.TRANSIENT;
  }
}
