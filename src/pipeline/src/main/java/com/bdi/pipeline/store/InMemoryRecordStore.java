package com.bdi.pipeline.store;

import com.bdi.pipeline.error.ConflictException;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.model.RecordKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed store with two skip-list indexes over the same records.
 *
 * <p>The entity index orders keys by entity, time and batch; the time index by time, entity and
 * batch. Both give O(log n) positioning and weakly consistent iteration that never blocks
 * writers. States are updated with an atomic {@code compute} of the pure merge function.
 */
public class InMemoryRecordStore implements RecordStore {
  private final MergeEngine mergeEngine;
  private final ConcurrentSkipListMap<RecordKey, CanonicalRecord> byEntity =
      new ConcurrentSkipListMap<>(RecordKey.ENTITY_ORDER);
  private final ConcurrentSkipListMap<RecordKey, CanonicalRecord> byTime =
      new ConcurrentSkipListMap<>(RecordKey.TIME_ORDER);
  private final ConcurrentSkipListMap<String, EntityState> states = new ConcurrentSkipListMap<>();

  public InMemoryRecordStore(MergeEngine mergeEngine) {
    this.mergeEngine = mergeEngine;
  }

  @Override
  public PutBatchResult putBatch(List<CanonicalRecord> records) {
    int written = 0;
    int duplicates = 0;
    List<RecordFailure> failures = new ArrayList<>();
    for (CanonicalRecord record : records) {
      try {
        states.compute(record.entityId(), (id, current) -> mergeEngine.merge(current, record));
      } catch (ConflictException ex) {
        failures.add(new RecordFailure(record.key(), RecordFailure.Kind.CONFLICT, ex.getMessage()));
        continue;
      }
      if (byEntity.putIfAbsent(record.key(), record) == null) {
        byTime.put(record.key(), record);
        written++;
      } else {
        duplicates++;
      }
    }
    return new PutBatchResult(written, duplicates, failures);
  }

  @Override
  public Optional<EntityState> getLatest(String entityId) {
    return Optional.ofNullable(states.get(entityId));
  }

  @Override
  public Iterable<CanonicalRecord> queryRange(Instant start, Instant end, RecordFilter filter) {
    RangeChecks.requireRange(start, end);
    RecordFilter effective = filter == null ? RecordFilter.all() : filter;
    return () -> byTime.subMap(lowerBound("", start), true, lowerBound("", end), false)
        .values()
        .stream()
        .filter(effective::matches)
        .iterator();
  }

  @Override
  public Iterable<CanonicalRecord> queryEntity(String entityId, Instant start, Instant end) {
    RangeChecks.requireRange(start, end);
    return () -> byEntity.subMap(lowerBound(entityId, start), true, lowerBound(entityId, end), false)
        .values()
        .iterator();
  }

  @Override
  public List<EntityState> listStates(int offset, int limit) {
    RangeChecks.requirePage(offset, limit);
    return states.values().stream().skip(offset).limit(limit).toList();
  }

  @Override
  public long entityCount() {
    return states.size();
  }

  @Override
  public long recordCount() {
    return byEntity.size();
  }

  @Override
  public long purgeBefore(Instant cutoff) {
    AtomicLong purged = new AtomicLong();
    byTime.headMap(lowerBound("", cutoff), false).keySet().forEach(key -> {
      if (byTime.remove(key) != null) {
        byEntity.remove(key);
        purged.incrementAndGet();
      }
    });
    states.forEach((entityId, state) -> {
      if (state.lastObservedAt().isBefore(cutoff)) {
        states.remove(entityId, state);
      }
    });
    return purged.get();
  }

  // Smallest possible key at the given position; batch ids and entity ids are never empty.
  private static RecordKey lowerBound(String entityId, Instant observedAt) {
    return new RecordKey(entityId, observedAt, "");
  }
}
