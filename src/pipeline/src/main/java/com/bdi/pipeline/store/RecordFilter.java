package com.bdi.pipeline.store;

import com.bdi.pipeline.model.CanonicalRecord;
import java.util.Collection;
import java.util.Set;

/**
 * Restricts range reads to some entities and to records carrying some fields.
 *
 * @param entityIds entities to keep, empty for all
 * @param requiredFields fields a record must carry to be kept, empty for none
 */
public record RecordFilter(Set<String> entityIds, Set<String> requiredFields) {

  private static final RecordFilter ALL = new RecordFilter(Set.of(), Set.of());

  public RecordFilter {
    entityIds = entityIds == null ? Set.of() : Set.copyOf(entityIds);
    requiredFields = requiredFields == null ? Set.of() : Set.copyOf(requiredFields);
  }

  public static RecordFilter all() {
    return ALL;
  }

  public static RecordFilter entities(Collection<String> entityIds) {
    return new RecordFilter(Set.copyOf(entityIds), Set.of());
  }

  public boolean matches(CanonicalRecord record) {
    if (!entityIds.isEmpty() && !entityIds.contains(record.entityId())) {
      return false;
    }
    return record.fields().keySet().containsAll(requiredFields);
  }
}
