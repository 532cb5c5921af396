package com.bdi.api.model;

/**
 * Number of stored observations of one aircraft inside a window.
 *
 * @param icao ICAO 24-bit address
 * @param count observation count
 */
public record AircraftCount(String icao, long count) {}
