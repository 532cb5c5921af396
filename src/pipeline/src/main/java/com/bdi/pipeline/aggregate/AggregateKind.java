package com.bdi.pipeline.aggregate;

public enum AggregateKind {
  /** Exact number of records per entity, ordered by entity id. */
  COUNT_PER_ENTITY,
  /** The {@code k} entities with the most records; ties broken by entity id ascending. */
  TOP_K_BY_COUNT,
  /** State of every entity folded from the records of the window only. */
  LATEST_STATE_SNAPSHOT
}
