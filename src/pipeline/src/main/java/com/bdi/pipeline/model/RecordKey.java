package com.bdi.pipeline.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Write-once identity of a stored canonical record.
 *
 * <p>The natural order groups keys by entity, then observation time, then batch id, which is the
 * layout of the per-entity index. {@link #TIME_ORDER} is the layout of the time index.
 *
 * @param entityId entity identifier
 * @param observedAt observation timestamp
 * @param batchId source batch provenance tag
 */
public record RecordKey(String entityId, Instant observedAt, String batchId)
    implements Comparable<RecordKey> {

  public static final Comparator<RecordKey> ENTITY_ORDER =
      Comparator.comparing(RecordKey::entityId)
          .thenComparing(RecordKey::observedAt)
          .thenComparing(RecordKey::batchId);

  public static final Comparator<RecordKey> TIME_ORDER =
      Comparator.comparing(RecordKey::observedAt)
          .thenComparing(RecordKey::entityId)
          .thenComparing(RecordKey::batchId);

  public RecordKey {
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(observedAt, "observedAt");
    Objects.requireNonNull(batchId, "batchId");
  }

  @Override
  public int compareTo(RecordKey other) {
    return ENTITY_ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return entityId + "@" + observedAt + "#" + batchId;
  }
}
