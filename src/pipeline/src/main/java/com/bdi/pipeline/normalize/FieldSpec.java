package com.bdi.pipeline.normalize;

import com.bdi.pipeline.error.ValidationException;
import com.bdi.pipeline.model.FieldType;
import com.bdi.pipeline.model.FieldValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Declared mapping of one source attribute to a canonical typed field.
 *
 * @param sourceName attribute name in the raw payload
 * @param canonicalName field name in canonical records
 * @param type declared value type
 * @param min inclusive lower bound for numeric values, {@code null} for none
 * @param max inclusive upper bound for numeric values, {@code null} for none
 * @param literals text literals that replace the value with a fixed value of another field
 */
public record FieldSpec(
    String sourceName,
    String canonicalName,
    FieldType type,
    Double min,
    Double max,
    Map<String, Map.Entry<String, FieldValue>> literals) {

  public FieldSpec {
    literals = literals == null ? Map.of() : Map.copyOf(literals);
  }

  public static FieldSpec number(String sourceName, String canonicalName, Double min, Double max) {
    return new FieldSpec(sourceName, canonicalName, FieldType.DOUBLE, min, max, Map.of());
  }

  public static FieldSpec integer(String sourceName, String canonicalName) {
    return new FieldSpec(sourceName, canonicalName, FieldType.LONG, null, null, Map.of());
  }

  public static FieldSpec text(String sourceName, String canonicalName) {
    return new FieldSpec(sourceName, canonicalName, FieldType.TEXT, null, null, Map.of());
  }

  public static FieldSpec flag(String sourceName, String canonicalName) {
    return new FieldSpec(sourceName, canonicalName, FieldType.BOOLEAN, null, null, Map.of());
  }

  public FieldSpec withLiteral(String literal, String targetField, FieldValue value) {
    Map<String, Map.Entry<String, FieldValue>> merged = new HashMap<>(literals);
    merged.put(literal.toLowerCase(Locale.ROOT), Map.entry(targetField, value));
    return new FieldSpec(sourceName, canonicalName, type, min, max, merged);
  }

  /**
   * Resolves a literal replacement for a textual node.
   *
   * @param node raw attribute value
   * @return target field and value, or {@code null} when the node is not a declared literal
   */
  Map.Entry<String, FieldValue> literal(JsonNode node) {
    if (literals.isEmpty() || !node.isTextual()) {
      return null;
    }
    return literals.get(node.asText().trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Parses a raw attribute value into the declared type.
   *
   * @param node raw attribute value, non-null and not JSON null
   * @return typed value, or {@code null} when the value is blank text
   * @throws ValidationException on type mismatch or range violation
   */
  FieldValue parse(JsonNode node) {
    return switch (type) {
      case DOUBLE -> checkRange(FieldValue.ofDouble(parseDouble(node)));
      case LONG -> checkRange(FieldValue.ofLong(parseLong(node)));
      case TEXT -> parseText(node);
      case BOOLEAN -> FieldValue.ofBoolean(parseBoolean(node));
    };
  }

  private double parseDouble(JsonNode node) {
    double value;
    if (node.isNumber()) {
      value = node.asDouble();
    } else if (node.isTextual()) {
      try {
        value = Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        throw mismatch(node);
      }
    } else {
      throw mismatch(node);
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw mismatch(node);
    }
    return value;
  }

  private long parseLong(JsonNode node) {
    if (node.isIntegralNumber()) {
      return node.asLong();
    }
    if (node.isTextual()) {
      try {
        return Long.parseLong(node.asText().trim());
      } catch (NumberFormatException ex) {
        throw mismatch(node);
      }
    }
    throw mismatch(node);
  }

  private FieldValue parseText(JsonNode node) {
    if (!node.isValueNode()) {
      throw mismatch(node);
    }
    String text = node.asText().trim();
    return text.isEmpty() ? null : FieldValue.ofText(text);
  }

  private boolean parseBoolean(JsonNode node) {
    if (node.isBoolean()) {
      return node.asBoolean();
    }
    if (node.isTextual()) {
      String text = node.asText().trim().toLowerCase(Locale.ROOT);
      if ("true".equals(text) || "false".equals(text)) {
        return Boolean.parseBoolean(text);
      }
    }
    throw mismatch(node);
  }

  private FieldValue checkRange(FieldValue value) {
    double numeric = value.asDouble();
    if ((min != null && numeric < min) || (max != null && numeric > max)) {
      throw new ValidationException(
          ReasonCode.FIELD_OUT_OF_RANGE,
          sourceName + "=" + numeric + " outside [" + min + ", " + max + "]");
    }
    return value;
  }

  private ValidationException mismatch(JsonNode node) {
    return new ValidationException(
        ReasonCode.FIELD_TYPE_MISMATCH,
        sourceName + "=" + node + " is not a valid " + type.name().toLowerCase(Locale.ROOT));
  }
}
