package com.bdi.api.model;

import java.util.List;

/**
 * Response contract for the count and top-K aggregate endpoints.
 *
 * @param kind aggregation kind
 * @param from window start (inclusive), ISO-8601
 * @param to window end (exclusive), ISO-8601
 * @param computedAt time the result was computed; cached results keep their original time
 * @param totalRecords observations inside the window
 * @param counts per-aircraft counts
 */
public record CountsResponse(
    String kind,
    String from,
    String to,
    String computedAt,
    long totalRecords,
    List<AircraftCount> counts) {}
