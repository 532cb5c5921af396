package com.bdi.api.model;

import java.util.List;

/**
 * Response contract for the latest-state snapshot endpoint.
 *
 * @param from window start (inclusive), ISO-8601
 * @param to window end (exclusive), ISO-8601
 * @param computedAt time the result was computed
 * @param count number of aircraft seen in the window
 * @param aircraft state of each aircraft merged from its observations inside the window
 */
public record SnapshotResponse(
    String from,
    String to,
    String computedAt,
    int count,
    List<AircraftStateResponse> aircraft) {}
