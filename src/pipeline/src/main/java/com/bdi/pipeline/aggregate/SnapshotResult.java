package com.bdi.pipeline.aggregate;

import com.bdi.pipeline.model.EntityState;
import java.time.Instant;
import java.util.List;

/**
 * Result of {@link AggregateKind#LATEST_STATE_SNAPSHOT}: one state per entity seen in the window,
 * ordered by entity id.
 */
public record SnapshotResult(
    AggregateKind kind,
    TimeWindow window,
    Instant computedAt,
    List<EntityState> states) implements AggregateResult {

  public SnapshotResult {
    states = List.copyOf(states);
  }
}
