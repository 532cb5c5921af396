package com.bdi.pipeline.aggregate;

import com.bdi.pipeline.error.InvalidQueryException;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.store.RecordStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Windowed statistics computed from store range reads.
 *
 * <p>The engine only reads the store, so queries run concurrently with ingestion and never block
 * writers. Results are cached per {@code (kind, window, params)} in a size-bounded Caffeine cache
 * and expire {@code staleBound} after they were computed, measured on the engine's clock; a zero
 * bound disables the cache.
 */
public class AggregationEngine implements QuerySink {
  private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

  private final RecordStore store;
  private final MergeEngine mergeEngine;
  private final Duration staleBound;
  private final Clock clock;
  private final Cache<CacheKey, AggregateResult> cache;
  private final Counter cacheHits;
  private final Counter cacheMisses;
  private final Map<AggregateKind, Timer> timers = new EnumMap<>(AggregateKind.class);

  /**
   * Creates an engine.
   *
   * @param store record store to read from
   * @param mergeEngine merge function used for snapshots
   * @param staleBound maximum age of a cached result
   * @param cacheSize maximum number of cached results (values &lt; 0 are clamped to 0)
   * @param clock time source for cache ageing
   * @param meterRegistry registry for cache and latency metrics
   */
  public AggregationEngine(
      RecordStore store,
      MergeEngine mergeEngine,
      Duration staleBound,
      int cacheSize,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.mergeEngine = mergeEngine;
    this.staleBound = staleBound == null ? Duration.ZERO : staleBound;
    this.clock = clock;

    int maxEntries = Math.max(0, cacheSize);
    this.cache = Caffeine.newBuilder()
        .maximumSize(maxEntries)
        .expireAfterWrite(this.staleBound)
        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
        .build();
    log.info("Aggregate cache initialized: maxSize={}, staleBound={}", maxEntries, this.staleBound);

    this.cacheHits = meterRegistry.counter("pipeline.aggregate.cache", "result", "hit");
    this.cacheMisses = meterRegistry.counter("pipeline.aggregate.cache", "result", "miss");
    for (AggregateKind kind : AggregateKind.values()) {
      timers.put(kind, Timer.builder("pipeline.aggregate.duration")
          .tag("kind", kind.name().toLowerCase())
          .register(meterRegistry));
    }
  }

  /**
   * Computes or serves from cache an aggregate over a half-open window.
   *
   * @throws InvalidQueryException when a parameter is missing or {@code k} is not positive for
   *     top-K queries
   */
  @Override
  public AggregateResult aggregate(AggregateKind kind, TimeWindow window, AggregateParams params) {
    if (kind == null) {
      throw new InvalidQueryException("aggregation kind is required");
    }
    if (window == null) {
      throw new InvalidQueryException("window is required");
    }
    AggregateParams effective = params == null ? AggregateParams.none() : params;
    if (kind == AggregateKind.TOP_K_BY_COUNT && effective.k() <= 0) {
      throw new InvalidQueryException("k must be positive, got " + effective.k());
    }
    if (kind != AggregateKind.TOP_K_BY_COUNT && effective.k() != 0) {
      effective = new AggregateParams(0, effective.entityIds());
    }

    CacheKey key = new CacheKey(kind, window, effective);
    Instant now = clock.instant();
    AggregateResult cached = cache.getIfPresent(key);
    if (cached != null) {
      cacheHits.increment();
      return cached;
    }
    cacheMisses.increment();

    AggregateParams query = effective;
    AggregateResult result = timers.get(kind).record(() -> compute(kind, window, query, now));
    if (!staleBound.isZero()) {
      cache.put(key, result);
    }
    return result;
  }

  @Override
  public Optional<EntityState> getLatest(String entityId) {
    return store.getLatest(Objects.requireNonNull(entityId, "entityId"));
  }

  /** Drops every cached result. */
  public void invalidate() {
    cache.invalidateAll();
  }

  private AggregateResult compute(AggregateKind kind, TimeWindow window, AggregateParams params, Instant now) {
    Iterable<CanonicalRecord> records = store.queryRange(window.start(), window.end(), params.filter());
    AggregateResult result = switch (kind) {
      case COUNT_PER_ENTITY -> counts(kind, window, records, now, Integer.MAX_VALUE);
      case TOP_K_BY_COUNT -> counts(kind, window, records, now, params.k());
      case LATEST_STATE_SNAPSHOT -> snapshot(window, records, now);
    };
    log.debug("Computed {} over {}", kind, window);
    return result;
  }

  private CountsResult counts(
      AggregateKind kind,
      TimeWindow window,
      Iterable<CanonicalRecord> records,
      Instant now,
      int limit) {
    Map<String, Long> perEntity = new HashMap<>();
    long total = 0;
    for (CanonicalRecord record : records) {
      perEntity.merge(record.entityId(), 1L, Long::sum);
      total++;
    }

    List<EntityCount> counts = new ArrayList<>(perEntity.size());
    perEntity.forEach((entityId, count) -> counts.add(new EntityCount(entityId, count)));
    if (kind == AggregateKind.TOP_K_BY_COUNT) {
      counts.sort(EntityCount.BY_COUNT_DESC);
    } else {
      counts.sort((a, b) -> a.entityId().compareTo(b.entityId()));
    }
    List<EntityCount> limited = counts.size() > limit ? counts.subList(0, limit) : counts;
    return new CountsResult(kind, window, now, limited, total);
  }

  private SnapshotResult snapshot(TimeWindow window, Iterable<CanonicalRecord> records, Instant now) {
    Map<String, EntityState> states = new TreeMap<>();
    for (CanonicalRecord record : records) {
      states.compute(record.entityId(), (id, current) -> mergeEngine.merge(current, record));
    }
    return new SnapshotResult(AggregateKind.LATEST_STATE_SNAPSHOT, window, now, new ArrayList<>(states.values()));
  }

  private record CacheKey(AggregateKind kind, TimeWindow window, AggregateParams params) {}
}
