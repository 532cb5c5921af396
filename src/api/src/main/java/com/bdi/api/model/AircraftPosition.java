package com.bdi.api.model;

/**
 * One known position of an aircraft.
 *
 * @param timestamp observation time in epoch seconds
 * @param lat latitude
 * @param lon longitude
 */
public record AircraftPosition(double timestamp, double lat, double lon) {}
