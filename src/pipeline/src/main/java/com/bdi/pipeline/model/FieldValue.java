package com.bdi.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * Typed field value carried by canonical records and entity states.
 *
 * <p>The value is always stored in the Java type matching its tag: {@link Double}, {@link Long},
 * {@link String} or {@link Boolean}. Numbers decoded from JSON are coerced back to the tagged type.
 *
 * @param type value tag
 * @param value non-null value of the tagged type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldValue(FieldType type, Object value) {

  public FieldValue {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    value = coerce(type, value);
  }

  public static FieldValue ofDouble(double value) {
    return new FieldValue(FieldType.DOUBLE, value);
  }

  public static FieldValue ofLong(long value) {
    return new FieldValue(FieldType.LONG, value);
  }

  public static FieldValue ofText(String value) {
    return new FieldValue(FieldType.TEXT, value);
  }

  public static FieldValue ofBoolean(boolean value) {
    return new FieldValue(FieldType.BOOLEAN, value);
  }

  /**
   * Returns the numeric view of this value.
   *
   * @return the value as a double for numeric tags, {@code null} otherwise
   */
  public Double asDouble() {
    return switch (type) {
      case DOUBLE -> (Double) value;
      case LONG -> ((Long) value).doubleValue();
      default -> null;
    };
  }

  public String asText() {
    return value.toString();
  }

  public Boolean asBoolean() {
    return type == FieldType.BOOLEAN ? (Boolean) value : null;
  }

  private static Object coerce(FieldType type, Object value) {
    switch (type) {
      case DOUBLE:
        if (value instanceof Number number) {
          return number.doubleValue();
        }
        break;
      case LONG:
        if (value instanceof Number number) {
          return number.longValue();
        }
        break;
      case TEXT:
        if (value instanceof String) {
          return value;
        }
        break;
      case BOOLEAN:
        if (value instanceof Boolean) {
          return value;
        }
        break;
      default:
        break;
    }
    throw new IllegalArgumentException(
        "value " + value + " (" + value.getClass().getSimpleName() + ") does not match type " + type);
  }
}
