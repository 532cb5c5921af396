package com.bdi.pipeline.aggregate;

import java.time.Instant;

/** Read-only result of an aggregate query. Never persisted. */
public interface AggregateResult {

  AggregateKind kind();

  TimeWindow window();

  /** Time the result was computed; cached results keep their original time. */
  Instant computedAt();
}
