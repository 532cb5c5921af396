package com.bdi.pipeline.store;

import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.FieldValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Map;

/** JSON form of a canonical record in Redis; times are epoch milliseconds. */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredRecord(
    String entityId,
    long observedAt,
    Map<String, FieldValue> fields,
    String batchId,
    long batchSequence) {

  static StoredRecord from(CanonicalRecord record) {
    return new StoredRecord(
        record.entityId(),
        record.observedAt().toEpochMilli(),
        record.fields(),
        record.batchId(),
        record.batchSequence());
  }

  CanonicalRecord toRecord() {
    return new CanonicalRecord(entityId, Instant.ofEpochMilli(observedAt), fields, batchId, batchSequence);
  }
}
