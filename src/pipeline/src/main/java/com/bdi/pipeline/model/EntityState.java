package com.bdi.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Current best-known state of one entity, merged field by field from its observations.
 *
 * @param entityId entity identifier
 * @param fields winning observation per field
 * @param firstObservedAt earliest merged observation timestamp
 * @param lastObservedAt latest merged observation timestamp
 */
public record EntityState(
    String entityId,
    Map<String, FieldObservation> fields,
    Instant firstObservedAt,
    Instant lastObservedAt) {

  public EntityState {
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(firstObservedAt, "firstObservedAt");
    Objects.requireNonNull(lastObservedAt, "lastObservedAt");
    fields = fields == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new TreeMap<>(fields));
  }

  public FieldValue value(String name) {
    FieldObservation observation = fields.get(name);
    return observation == null ? null : observation.value();
  }

  public Double doubleValue(String name) {
    FieldValue value = value(name);
    return value == null ? null : value.asDouble();
  }

  public String textValue(String name) {
    FieldValue value = value(name);
    return value == null ? null : value.asText();
  }
}
