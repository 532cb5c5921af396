package com.bdi.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Normalized observation of one entity at one instant.
 *
 * @param entityId entity identifier, never null
 * @param observedAt observation timestamp, never null
 * @param fields typed field values by canonical name
 * @param batchId provenance tag of the source batch
 * @param batchSequence source order of the batch, used to break equal-timestamp ties
 */
public record CanonicalRecord(
    String entityId,
    Instant observedAt,
    Map<String, FieldValue> fields,
    String batchId,
    long batchSequence) {

  public CanonicalRecord {
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(observedAt, "observedAt");
    Objects.requireNonNull(batchId, "batchId");
    fields = fields == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new TreeMap<>(fields));
  }

  public RecordKey key() {
    return new RecordKey(entityId, observedAt, batchId);
  }

  public FieldValue field(String name) {
    return fields.get(name);
  }

  /**
   * Returns a numeric field.
   *
   * @param name canonical field name
   * @return numeric value, or {@code null} when absent or not numeric
   */
  public Double doubleField(String name) {
    FieldValue value = fields.get(name);
    return value == null ? null : value.asDouble();
  }

  public String textField(String name) {
    FieldValue value = fields.get(name);
    return value == null ? null : value.asText();
  }
}
