package com.bdi.pipeline.store;

import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.model.FieldObservation;
import com.bdi.pipeline.model.FieldValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** JSON form of an entity state in Redis; times are epoch milliseconds. */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredState(
    String entityId,
    Map<String, Observation> fields,
    long firstObservedAt,
    long lastObservedAt) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Observation(FieldValue value, long observedAt, long batchSequence, String batchId) {}

  static StoredState from(EntityState state) {
    Map<String, Observation> fields = new HashMap<>();
    state.fields().forEach((name, observation) -> fields.put(
        name,
        new Observation(
            observation.value(),
            observation.observedAt().toEpochMilli(),
            observation.batchSequence(),
            observation.batchId())));
    return new StoredState(
        state.entityId(),
        fields,
        state.firstObservedAt().toEpochMilli(),
        state.lastObservedAt().toEpochMilli());
  }

  EntityState toState() {
    Map<String, FieldObservation> observations = new HashMap<>();
    if (fields != null) {
      fields.forEach((name, observation) -> observations.put(
          name,
          new FieldObservation(
              observation.value(),
              Instant.ofEpochMilli(observation.observedAt()),
              observation.batchSequence(),
              observation.batchId())));
    }
    return new EntityState(
        entityId,
        observations,
        Instant.ofEpochMilli(firstObservedAt),
        Instant.ofEpochMilli(lastObservedAt));
  }
}
