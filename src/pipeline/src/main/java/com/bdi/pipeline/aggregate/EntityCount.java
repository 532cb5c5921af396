package com.bdi.pipeline.aggregate;

import java.util.Comparator;

public record EntityCount(String entityId, long count) {

  /** Count descending, then entity id ascending. */
  public static final Comparator<EntityCount> BY_COUNT_DESC =
      Comparator.comparingLong(EntityCount::count).reversed()
          .thenComparing(EntityCount::entityId);
}
