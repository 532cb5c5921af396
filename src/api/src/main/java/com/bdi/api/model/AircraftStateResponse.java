package com.bdi.api.model;

import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.model.FieldObservation;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest merged state of one aircraft.
 *
 * @param icao ICAO 24-bit address
 * @param firstSeen earliest merged observation, ISO-8601
 * @param lastSeen latest merged observation, ISO-8601
 * @param fields current value of each known field
 */
public record AircraftStateResponse(
    String icao,
    String firstSeen,
    String lastSeen,
    Map<String, Object> fields) {

  public static AircraftStateResponse from(EntityState state) {
    Map<String, Object> fields = new LinkedHashMap<>();
    for (Map.Entry<String, FieldObservation> field : state.fields().entrySet()) {
      fields.put(field.getKey(), field.getValue().value().value());
    }
    return new AircraftStateResponse(
        state.entityId(),
        state.firstObservedAt().toString(),
        state.lastObservedAt().toString(),
        fields);
  }
}
