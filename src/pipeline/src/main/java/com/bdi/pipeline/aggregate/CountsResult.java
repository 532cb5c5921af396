package com.bdi.pipeline.aggregate;

import java.time.Instant;
import java.util.List;

/**
 * Result of {@link AggregateKind#COUNT_PER_ENTITY} and {@link AggregateKind#TOP_K_BY_COUNT}.
 *
 * @param counts per-entity counts in the order of the query kind
 * @param totalRecords records counted in the window, over all entities
 */
public record CountsResult(
    AggregateKind kind,
    TimeWindow window,
    Instant computedAt,
    List<EntityCount> counts,
    long totalRecords) implements AggregateResult {

  public CountsResult {
    counts = List.copyOf(counts);
  }
}
