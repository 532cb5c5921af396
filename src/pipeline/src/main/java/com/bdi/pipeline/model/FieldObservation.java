package com.bdi.pipeline.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * A field value together with the observation that produced it.
 *
 * @param value field value
 * @param observedAt timestamp of the producing record
 * @param batchSequence source order of the producing batch
 * @param batchId producing batch
 */
public record FieldObservation(FieldValue value, Instant observedAt, long batchSequence, String batchId) {

  /** Priority order: later observation first, then later-arriving batch. */
  public static final Comparator<FieldObservation> PRIORITY =
      Comparator.comparing(FieldObservation::observedAt)
          .thenComparingLong(FieldObservation::batchSequence);

  public static FieldObservation of(CanonicalRecord record, FieldValue value) {
    return new FieldObservation(value, record.observedAt(), record.batchSequence(), record.batchId());
  }

  public boolean supersedes(FieldObservation other) {
    return PRIORITY.compare(this, other) > 0;
  }
}
