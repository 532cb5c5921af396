package com.bdi.pipeline.aggregate;

import com.bdi.pipeline.store.RecordFilter;
import java.util.Set;

/**
 * Parameters of an aggregate query. Part of the result cache key.
 *
 * @param k number of entities for {@link AggregateKind#TOP_K_BY_COUNT}, ignored otherwise
 * @param entityIds entities to restrict the query to, empty for all
 */
public record AggregateParams(int k, Set<String> entityIds) {

  private static final AggregateParams NONE = new AggregateParams(0, Set.of());

  public AggregateParams {
    entityIds = entityIds == null ? Set.of() : Set.copyOf(entityIds);
  }

  public static AggregateParams none() {
    return NONE;
  }

  public static AggregateParams topK(int k) {
    return new AggregateParams(k, Set.of());
  }

  public AggregateParams forEntities(Set<String> ids) {
    return new AggregateParams(k, ids);
  }

  RecordFilter filter() {
    return entityIds.isEmpty() ? RecordFilter.all() : RecordFilter.entities(entityIds);
  }
}
