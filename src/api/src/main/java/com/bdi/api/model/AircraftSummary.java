package com.bdi.api.model;

/**
 * Aircraft entry used in the aircraft listing.
 *
 * @param icao ICAO 24-bit address, lower case
 * @param registration registration when known
 * @param type ICAO aircraft type designator when known
 */
public record AircraftSummary(String icao, String registration, String type) {}
