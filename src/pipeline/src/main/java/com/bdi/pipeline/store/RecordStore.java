package com.bdi.pipeline.store;

import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.EntityState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Time- and entity-indexed persistence of canonical records and merged entity states.
 *
 * <p>Writes are idempotent on the write-once key {@code (entityId, observedAt, batchId)}. Every
 * applied record is also merged into the state of its entity. Implementations expect at most one
 * concurrent writer per entity; reads never block writers.
 */
public interface RecordStore {

  /**
   * Applies a batch of records.
   *
   * <p>A record whose key is already stored is counted as a duplicate and re-merged, which leaves
   * the state unchanged. Records that cannot be applied are reported individually; the other
   * records of the batch are still applied.
   *
   * @param records records to apply, at most one per key
   * @return per-batch outcome with per-record failures
   */
  PutBatchResult putBatch(List<CanonicalRecord> records);

  Optional<EntityState> getLatest(String entityId);

  /**
   * Reads the records observed in {@code [start, end)} in observation time order.
   *
   * <p>The returned iterable is lazy and finite. Each call to {@code iterator()} starts a fresh
   * scan and may observe writes made after the previous one.
   *
   * @throws com.bdi.pipeline.error.InvalidQueryException when {@code start} is after {@code end}
   */
  Iterable<CanonicalRecord> queryRange(Instant start, Instant end, RecordFilter filter);

  /**
   * Reads the records of one entity observed in {@code [start, end)}, oldest first.
   */
  Iterable<CanonicalRecord> queryEntity(String entityId, Instant start, Instant end);

  /**
   * Lists entity states ordered by entity id.
   *
   * @param offset number of states to skip
   * @param limit maximum number of states to return
   */
  List<EntityState> listStates(int offset, int limit);

  long entityCount();

  long recordCount();

  /**
   * Deletes records observed before {@code cutoff} and states last observed before it.
   *
   * @return number of deleted records
   */
  long purgeBefore(Instant cutoff);
}
