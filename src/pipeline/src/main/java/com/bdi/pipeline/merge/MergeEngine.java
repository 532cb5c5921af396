package com.bdi.pipeline.merge;

import com.bdi.pipeline.error.ConflictException;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.model.FieldObservation;
import com.bdi.pipeline.model.FieldValue;
import com.bdi.pipeline.model.RecordKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field-level last-writer-wins merge of canonical records into entity states.
 *
 * <p>Every field keeps the observation with the highest {@link FieldObservation#PRIORITY}: the
 * latest observation timestamp, then the highest batch sequence. Observations with equal
 * priority leave the stored field untouched, which makes re-applying a record a no-op and the
 * final state independent of arrival order.
 *
 * <p>The engine is stateless and thread-safe.
 */
public class MergeEngine {

  /**
   * Merges an incoming record into the current state of its entity.
   *
   * @param existing current state, or {@code null} for an unknown entity
   * @param incoming record to apply
   * @return merged state; {@code existing} itself when nothing changed
   * @throws ConflictException when the record belongs to another entity or a field changes type
   */
  public EntityState merge(EntityState existing, CanonicalRecord incoming) {
    Objects.requireNonNull(incoming, "incoming");
    if (existing == null) {
      Map<String, FieldObservation> fields = new HashMap<>();
      incoming.fields().forEach((name, value) -> fields.put(name, FieldObservation.of(incoming, value)));
      return new EntityState(incoming.entityId(), fields, incoming.observedAt(), incoming.observedAt());
    }

    checkCompatible(existing, incoming);

    Map<String, FieldObservation> fields = new HashMap<>(existing.fields());
    boolean changed = false;
    for (Map.Entry<String, FieldValue> entry : incoming.fields().entrySet()) {
      FieldObservation candidate = FieldObservation.of(incoming, entry.getValue());
      FieldObservation current = fields.get(entry.getKey());
      if (current == null || candidate.supersedes(current)) {
        fields.put(entry.getKey(), candidate);
        changed = true;
      }
    }

    Instant first = min(existing.firstObservedAt(), incoming.observedAt());
    Instant last = max(existing.lastObservedAt(), incoming.observedAt());
    if (!changed && first.equals(existing.firstObservedAt()) && last.equals(existing.lastObservedAt())) {
      return existing;
    }
    return new EntityState(existing.entityId(), fields, first, last);
  }

  /**
   * Folds records into a state, starting from {@code existing}.
   *
   * @param existing starting state, may be {@code null}
   * @param records records of one entity, in any order
   * @return merged state, or {@code existing} when {@code records} is empty
   */
  public EntityState mergeAll(EntityState existing, Iterable<CanonicalRecord> records) {
    EntityState state = existing;
    for (CanonicalRecord record : records) {
      state = merge(state, record);
    }
    return state;
  }

  /**
   * Checks that a record can be merged into a state without a type conflict.
   *
   * @throws ConflictException on entity mismatch or when a field value type differs from the
   *     stored one
   */
  public void checkCompatible(EntityState state, CanonicalRecord record) {
    if (state == null) {
      return;
    }
    if (!state.entityId().equals(record.entityId())) {
      throw new ConflictException(
          record.entityId(),
          null,
          "record for " + record.entityId() + " cannot be merged into state of " + state.entityId());
    }
    for (Map.Entry<String, FieldValue> entry : record.fields().entrySet()) {
      FieldObservation current = state.fields().get(entry.getKey());
      if (current != null && current.value().type() != entry.getValue().type()) {
        throw new ConflictException(
            record.entityId(),
            entry.getKey(),
            "field " + entry.getKey() + " of " + record.entityId() + " is "
                + current.value().type() + " but record " + record.key() + " carries "
                + entry.getValue().type());
      }
    }
  }

  /**
   * Collapses repeated observations inside one batch.
   *
   * <p>Records of the same entity at the same timestamp from the same batch share a write-once
   * key; they are folded into one record where later positions win per field. The relative order
   * of first occurrences is kept.
   *
   * @param records records of one batch in source order
   * @return one record per write-once key
   * @throws ConflictException when two collapsed records disagree on a field type
   */
  public List<CanonicalRecord> collapse(List<CanonicalRecord> records) {
    Map<RecordKey, CanonicalRecord> byKey = new LinkedHashMap<>();
    for (CanonicalRecord record : records) {
      byKey.merge(record.key(), record, MergeEngine::overlay);
    }
    return new ArrayList<>(byKey.values());
  }

  private static CanonicalRecord overlay(CanonicalRecord earlier, CanonicalRecord later) {
    Map<String, FieldValue> fields = new HashMap<>(earlier.fields());
    for (Map.Entry<String, FieldValue> entry : later.fields().entrySet()) {
      FieldValue previous = fields.get(entry.getKey());
      if (previous != null && previous.type() != entry.getValue().type()) {
        throw new ConflictException(
            later.entityId(),
            entry.getKey(),
            "field " + entry.getKey() + " changes type inside batch " + later.batchId());
      }
      fields.put(entry.getKey(), entry.getValue());
    }
    return new CanonicalRecord(
        earlier.entityId(),
        earlier.observedAt(),
        fields,
        earlier.batchId(),
        Math.max(earlier.batchSequence(), later.batchSequence()));
  }

  private static Instant min(Instant a, Instant b) {
    return a.isBefore(b) ? a : b;
  }

  private static Instant max(Instant a, Instant b) {
    return a.isAfter(b) ? a : b;
  }
}
