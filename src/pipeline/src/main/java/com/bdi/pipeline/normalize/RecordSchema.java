package com.bdi.pipeline.normalize;

import com.bdi.pipeline.model.FieldValue;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Declared shape of one raw source format.
 *
 * @param name schema name, used in logs
 * @param entityField raw attribute holding the entity identifier
 * @param entityPattern pattern the lower-cased, trimmed identifier must match
 * @param timestampField raw attribute holding the observation time in epoch seconds
 * @param fields declared typed fields; undeclared attributes are dropped
 */
public record RecordSchema(
    String name,
    String entityField,
    Pattern entityPattern,
    String timestampField,
    List<FieldSpec> fields) {

  public RecordSchema {
    fields = List.copyOf(fields);
  }

  /**
   * Schema of aircraft entries in ADS-B Exchange {@code readsb-hist} snapshots.
   *
   * <p>Every entry is expected to carry the snapshot {@code now} time copied from its file.
   * Non-ICAO addresses are prefixed with {@code ~} by readsb and are accepted as-is.
   */
  public static RecordSchema readsb() {
    return new RecordSchema(
        "readsb-hist",
        "hex",
        Pattern.compile("^~?[0-9a-f]{6}$"),
        "now",
        List.of(
            FieldSpec.number("lat", "lat", -90.0, 90.0),
            FieldSpec.number("lon", "lon", -180.0, 180.0),
            FieldSpec.number("alt_baro", "alt_baro", -2000.0, 100000.0)
                .withLiteral("ground", "on_ground", FieldValue.ofBoolean(true)),
            FieldSpec.number("alt_geom", "alt_geom", -2000.0, 100000.0),
            FieldSpec.number("gs", "gs", 0.0, 2000.0),
            FieldSpec.number("track", "track", 0.0, 360.0),
            FieldSpec.number("baro_rate", "baro_rate", -20000.0, 20000.0),
            FieldSpec.text("flight", "callsign"),
            FieldSpec.text("r", "registration"),
            FieldSpec.text("t", "type"),
            FieldSpec.text("emergency", "emergency"),
            FieldSpec.text("squawk", "squawk"),
            FieldSpec.text("category", "category")));
  }
}
