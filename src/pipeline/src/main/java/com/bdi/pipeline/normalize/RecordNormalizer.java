package com.bdi.pipeline.normalize;

import com.bdi.pipeline.error.ValidationException;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.FieldValue;
import com.bdi.pipeline.model.RawRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts raw source records into canonical typed records.
 *
 * <p>Malformed records are never fatal: each one becomes a reason-coded {@link Rejection}, is
 * logged at debug level and counted under {@code pipeline.normalize.rejections}.
 */
public class RecordNormalizer {
  private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

  private final RecordSchema schema;
  private final Counter acceptedCounter;
  private final Map<ReasonCode, Counter> rejectionCounters;

  public RecordNormalizer(RecordSchema schema, MeterRegistry meterRegistry) {
    this.schema = schema;
    this.acceptedCounter = meterRegistry.counter("pipeline.normalize.accepted");
    this.rejectionCounters = new EnumMap<>(ReasonCode.class);
    for (ReasonCode code : ReasonCode.values()) {
      rejectionCounters.put(
          code,
          meterRegistry.counter("pipeline.normalize.rejections", "reason", code.name().toLowerCase(Locale.ROOT)));
    }
  }

  public NormalizationResult normalize(RawRecord raw) {
    try {
      CanonicalRecord record = toCanonical(raw);
      acceptedCounter.increment();
      return NormalizationResult.accepted(record);
    } catch (ValidationException ex) {
      Rejection rejection = new Rejection(raw.batchId(), raw.position(), ex.getReasonCode(), ex.getMessage());
      rejectionCounters.get(ex.getReasonCode()).increment();
      log.debug(
          "Rejected record {}#{}: {} ({})",
          raw.batchId(),
          raw.position(),
          ex.getReasonCode(),
          ex.getMessage());
      return NormalizationResult.rejected(rejection);
    }
  }

  /**
   * Normalizes every record of a batch, keeping source order.
   *
   * @param records raw records of one batch
   * @return accepted records and rejections
   */
  public NormalizedBatch normalizeAll(List<RawRecord> records) {
    List<CanonicalRecord> accepted = new ArrayList<>(records.size());
    List<Rejection> rejections = new ArrayList<>();
    for (RawRecord raw : records) {
      NormalizationResult result = normalize(raw);
      if (result.isAccepted()) {
        accepted.add(result.record());
      } else {
        rejections.add(result.rejection());
      }
    }
    return new NormalizedBatch(accepted, rejections);
  }

  private CanonicalRecord toCanonical(RawRecord raw) {
    JsonNode payload = raw.payload();
    if (payload == null || !payload.isObject()) {
      throw new ValidationException(ReasonCode.MALFORMED_PAYLOAD, "payload is not a JSON object");
    }

    String entityId = parseEntityId(payload.get(schema.entityField()));
    Instant observedAt = parseTimestamp(payload.get(schema.timestampField()));

    Map<String, FieldValue> fields = new HashMap<>();
    for (FieldSpec spec : schema.fields()) {
      JsonNode node = payload.get(spec.sourceName());
      if (node == null || node.isNull()) {
        continue;
      }
      Map.Entry<String, FieldValue> literal = spec.literal(node);
      if (literal != null) {
        fields.put(literal.getKey(), literal.getValue());
        continue;
      }
      FieldValue value = spec.parse(node);
      if (value != null) {
        fields.put(spec.canonicalName(), value);
      }
    }

    return new CanonicalRecord(entityId, observedAt, fields, raw.batchId(), raw.batchSequence());
  }

  private String parseEntityId(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      throw new ValidationException(ReasonCode.MISSING_ENTITY_ID, schema.entityField() + " is missing");
    }
    if (!node.isValueNode()) {
      throw new ValidationException(
          ReasonCode.INVALID_ENTITY_ID, schema.entityField() + " is not a scalar: " + node.getNodeType());
    }
    if (node.asText().isBlank()) {
      throw new ValidationException(ReasonCode.MISSING_ENTITY_ID, schema.entityField() + " is blank");
    }
    String entityId = node.asText().trim().toLowerCase(Locale.ROOT);
    if (!schema.entityPattern().matcher(entityId).matches()) {
      throw new ValidationException(
          ReasonCode.INVALID_ENTITY_ID,
          schema.entityField() + "=" + entityId + " does not match " + schema.entityPattern());
    }
    return entityId;
  }

  private Instant parseTimestamp(JsonNode node) {
    if (node == null || node.isNull()) {
      throw new ValidationException(ReasonCode.MISSING_TIMESTAMP, schema.timestampField() + " is missing");
    }
    double epochSeconds;
    if (node.isNumber()) {
      epochSeconds = node.asDouble();
    } else if (node.isTextual()) {
      try {
        epochSeconds = Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        throw unparseable(node);
      }
    } else {
      throw unparseable(node);
    }
    if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds) || epochSeconds < 0) {
      throw unparseable(node);
    }
    return Instant.ofEpochMilli(Math.round(epochSeconds * 1000.0));
  }

  private ValidationException unparseable(JsonNode node) {
    return new ValidationException(
        ReasonCode.UNPARSEABLE_TIMESTAMP,
        schema.timestampField() + "=" + node + " is not an epoch-seconds value");
  }
}
