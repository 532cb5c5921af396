package com.bdi.pipeline.store;

import com.bdi.pipeline.error.ConflictException;
import com.bdi.pipeline.error.TransientInfraException;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.model.RecordKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed store using hashes for records and states and sorted sets as indexes.
 *
 * <p>Layout under the configured prefix:
 * <ul>
 *   <li>{@code <prefix>:records} hash: {@code entity|millis|batchId} to record JSON, written with
 *   HSETNX so a key is never overwritten</li>
 *   <li>{@code <prefix>:idx:time} sorted set: record ids scored by observation millis</li>
 *   <li>{@code <prefix>:idx:entity:<entityId>} sorted set: record ids of one entity scored by
 *   observation millis</li>
 *   <li>{@code <prefix>:state} hash: entity id to state JSON</li>
 *   <li>{@code <prefix>:entities} sorted set: entity ids, all scored 0 so they sort by id</li>
 * </ul>
 *
 * <p>State updates are read-merge-write. They are safe because the coordinator routes all records
 * of an entity through one partition writer. Observation times are kept to the millisecond.
 */
public class RedisRecordStore implements RecordStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(RedisRecordStore.class);
  private static final int PAGE_SIZE = 500;

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final MergeEngine mergeEngine;
  private final String recordsKey;
  private final String timeIndexKey;
  private final String entityIndexPrefix;
  private final String stateKey;
  private final String entitiesKey;

  public RedisRecordStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      MergeEngine mergeEngine,
      String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.mergeEngine = mergeEngine;
    this.recordsKey = keyPrefix + ":records";
    this.timeIndexKey = keyPrefix + ":idx:time";
    this.entityIndexPrefix = keyPrefix + ":idx:entity:";
    this.stateKey = keyPrefix + ":state";
    this.entitiesKey = keyPrefix + ":entities";
  }

  @Override
  public PutBatchResult putBatch(List<CanonicalRecord> records) {
    int written = 0;
    int duplicates = 0;
    List<RecordFailure> failures = new ArrayList<>();
    for (CanonicalRecord record : records) {
      RecordKey key = record.key();
      try {
        EntityState current = readState(record.entityId());
        EntityState merged = mergeEngine.merge(current, record);

        String id = recordId(key);
        long score = record.observedAt().toEpochMilli();
        Boolean inserted = redisTemplate.opsForHash().putIfAbsent(recordsKey, id, write(StoredRecord.from(record)));
        redisTemplate.opsForZSet().add(timeIndexKey, id, score);
        redisTemplate.opsForZSet().add(entityIndexPrefix + record.entityId(), id, score);
        if (merged != current) {
          redisTemplate.opsForHash().put(stateKey, record.entityId(), write(StoredState.from(merged)));
        }
        redisTemplate.opsForZSet().add(entitiesKey, record.entityId(), 0);

        if (Boolean.TRUE.equals(inserted)) {
          written++;
        } else {
          duplicates++;
        }
      } catch (ConflictException ex) {
        failures.add(new RecordFailure(key, RecordFailure.Kind.CONFLICT, ex.getMessage()));
      } catch (DataAccessException | TransientInfraException ex) {
        LOGGER.debug("Redis write failed for {}", key, ex);
        failures.add(new RecordFailure(key, RecordFailure.Kind.TRANSIENT, ex.getMessage()));
      }
    }
    return new PutBatchResult(written, duplicates, failures);
  }

  @Override
  public Optional<EntityState> getLatest(String entityId) {
    return Optional.ofNullable(readState(entityId));
  }

  @Override
  public Iterable<CanonicalRecord> queryRange(Instant start, Instant end, RecordFilter filter) {
    RangeChecks.requireRange(start, end);
    RecordFilter effective = filter == null ? RecordFilter.all() : filter;
    return () -> new PagedRecordIterator(timeIndexKey, start, end, effective::matches);
  }

  @Override
  public Iterable<CanonicalRecord> queryEntity(String entityId, Instant start, Instant end) {
    RangeChecks.requireRange(start, end);
    return () -> new PagedRecordIterator(entityIndexPrefix + entityId, start, end, record -> true);
  }

  @Override
  public List<EntityState> listStates(int offset, int limit) {
    RangeChecks.requirePage(offset, limit);
    if (limit == 0) {
      return List.of();
    }
    Set<String> entityIds = redisTemplate.opsForZSet().range(entitiesKey, offset, (long) offset + limit - 1);
    if (entityIds == null || entityIds.isEmpty()) {
      return List.of();
    }
    List<Object> payloads = redisTemplate.opsForHash().multiGet(stateKey, new ArrayList<>(entityIds));
    List<EntityState> states = new ArrayList<>(payloads.size());
    for (Object payload : payloads) {
      if (payload != null) {
        states.add(read((String) payload, StoredState.class).toState());
      }
    }
    return states;
  }

  @Override
  public long entityCount() {
    Long size = redisTemplate.opsForZSet().zCard(entitiesKey);
    return size == null ? 0L : size;
  }

  @Override
  public long recordCount() {
    Long size = redisTemplate.opsForHash().size(recordsKey);
    return size == null ? 0L : size;
  }

  @Override
  public long purgeBefore(Instant cutoff) {
    long purged = 0;
    double max = cutoff.toEpochMilli() - 1;
    while (true) {
      Set<String> ids = redisTemplate.opsForZSet().rangeByScore(timeIndexKey, Double.NEGATIVE_INFINITY, max, 0, PAGE_SIZE);
      if (ids == null || ids.isEmpty()) {
        break;
      }
      Object[] members = ids.toArray();
      redisTemplate.opsForHash().delete(recordsKey, members);
      redisTemplate.opsForZSet().remove(timeIndexKey, members);
      for (String id : ids) {
        redisTemplate.opsForZSet().remove(entityIndexPrefix + entityOf(id), id);
      }
      purged += ids.size();
    }

    long offset = 0;
    while (true) {
      Set<String> entityIds = redisTemplate.opsForZSet().range(entitiesKey, offset, offset + PAGE_SIZE - 1);
      if (entityIds == null || entityIds.isEmpty()) {
        break;
      }
      List<Object> payloads = redisTemplate.opsForHash().multiGet(stateKey, new ArrayList<>(entityIds));
      int index = 0;
      int removed = 0;
      for (String entityId : entityIds) {
        Object payload = payloads.get(index++);
        if (payload == null
            || read((String) payload, StoredState.class).lastObservedAt() < cutoff.toEpochMilli()) {
          redisTemplate.opsForHash().delete(stateKey, entityId);
          redisTemplate.opsForZSet().remove(entitiesKey, entityId);
          removed++;
        }
      }
      offset += entityIds.size() - removed;
    }
    return purged;
  }

  private EntityState readState(String entityId) {
    Object payload = redisTemplate.opsForHash().get(stateKey, entityId);
    return payload == null ? null : read((String) payload, StoredState.class).toState();
  }

  static String recordId(RecordKey key) {
    return key.entityId() + "|" + key.observedAt().toEpochMilli() + "|" + key.batchId();
  }

  // Entity ids are validated identifiers and never contain the separator.
  static String entityOf(String recordId) {
    return recordId.substring(0, recordId.indexOf('|'));
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), ex);
    }
  }

  private <T> T read(String payload, Class<T> type) {
    try {
      return objectMapper.readValue(payload, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Corrupt " + type.getSimpleName() + " payload in Redis", ex);
    }
  }

  /**
   * Walks one score index in pages, resolving record ids through the records hash.
   * Offset paging is weakly consistent under concurrent writes.
   */
  private final class PagedRecordIterator implements Iterator<CanonicalRecord> {
    private final String indexKey;
    private final double min;
    private final double max;
    private final Predicate<CanonicalRecord> filter;
    private long offset;
    private boolean exhausted;
    private Iterator<CanonicalRecord> page = Collections.emptyIterator();
    private CanonicalRecord next;

    PagedRecordIterator(String indexKey, Instant start, Instant end, Predicate<CanonicalRecord> filter) {
      this.indexKey = indexKey;
      this.min = start.toEpochMilli();
      this.max = end.toEpochMilli() - 1;
      this.filter = filter;
      this.exhausted = !start.isBefore(end);
    }

    @Override
    public boolean hasNext() {
      while (next == null) {
        if (page.hasNext()) {
          CanonicalRecord candidate = page.next();
          if (filter.test(candidate)) {
            next = candidate;
          }
        } else if (exhausted) {
          return false;
        } else {
          page = loadPage();
        }
      }
      return true;
    }

    @Override
    public CanonicalRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      CanonicalRecord result = next;
      next = null;
      return result;
    }

    private Iterator<CanonicalRecord> loadPage() {
      Set<String> ids = redisTemplate.opsForZSet().rangeByScore(indexKey, min, max, offset, PAGE_SIZE);
      if (ids == null || ids.size() < PAGE_SIZE) {
        exhausted = true;
      }
      if (ids == null || ids.isEmpty()) {
        return Collections.emptyIterator();
      }
      offset += ids.size();
      List<Object> payloads = redisTemplate.opsForHash().multiGet(recordsKey, new ArrayList<>(ids));
      List<CanonicalRecord> records = new ArrayList<>(payloads.size());
      for (Object payload : payloads) {
        if (payload != null) {
          records.add(read((String) payload, StoredRecord.class).toRecord());
        }
      }
      return records.iterator();
    }
  }
}
