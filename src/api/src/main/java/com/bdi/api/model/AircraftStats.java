package com.bdi.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics over every stored observation of one aircraft.
 *
 * @param maxAltitudeBaro highest barometric altitude in feet, {@code null} when never reported
 * @param maxGroundSpeed highest ground speed in knots, {@code null} when never reported
 * @param hadEmergency whether any observation carried an emergency status
 */
public record AircraftStats(
    @JsonProperty("max_altitude_baro") Double maxAltitudeBaro,
    @JsonProperty("max_ground_speed") Double maxGroundSpeed,
    @JsonProperty("had_emergency") boolean hadEmergency) {

  public static AircraftStats unknown() {
    return new AircraftStats(null, null, false);
  }
}
