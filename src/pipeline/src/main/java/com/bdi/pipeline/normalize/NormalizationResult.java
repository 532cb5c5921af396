package com.bdi.pipeline.normalize;

import com.bdi.pipeline.model.CanonicalRecord;
import java.util.Objects;

/** Outcome of normalizing one raw record: either a canonical record or a rejection. */
public final class NormalizationResult {
  private final CanonicalRecord record;
  private final Rejection rejection;

  private NormalizationResult(CanonicalRecord record, Rejection rejection) {
    this.record = record;
    this.rejection = rejection;
  }

  public static NormalizationResult accepted(CanonicalRecord record) {
    return new NormalizationResult(Objects.requireNonNull(record), null);
  }

  public static NormalizationResult rejected(Rejection rejection) {
    return new NormalizationResult(null, Objects.requireNonNull(rejection));
  }

  public boolean isAccepted() {
    return record != null;
  }

  public CanonicalRecord record() {
    if (record == null) {
      throw new IllegalStateException("result is a rejection: " + rejection.reasonCode());
    }
    return record;
  }

  public Rejection rejection() {
    if (rejection == null) {
      throw new IllegalStateException("result is an accepted record");
    }
    return rejection;
  }
}
