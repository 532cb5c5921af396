package com.bdi.pipeline.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.bdi.pipeline.checkpoint.Checkpoint;
import com.bdi.pipeline.checkpoint.InMemoryCheckpointStore;
import com.bdi.pipeline.error.TransientInfraException;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.model.FieldValue;
import com.bdi.pipeline.model.RawBatch;
import com.bdi.pipeline.model.RawRecord;
import com.bdi.pipeline.normalize.ReasonCode;
import com.bdi.pipeline.normalize.RecordNormalizer;
import com.bdi.pipeline.normalize.RecordSchema;
import com.bdi.pipeline.store.InMemoryRecordStore;
import com.bdi.pipeline.store.PutBatchResult;
import com.bdi.pipeline.store.RecordFailure;
import com.bdi.pipeline.store.RecordFilter;
import com.bdi.pipeline.store.RecordStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class IngestionCoordinatorTest {
  private static final long NOW = 1_685_577_600L;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final MergeEngine mergeEngine = new MergeEngine();
  private final InMemoryRecordStore memoryStore = new InMemoryRecordStore(mergeEngine);
  private final InMemoryCheckpointStore checkpointStore = new InMemoryCheckpointStore();
  private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
  private final List<IngestionCoordinator> coordinators = new ArrayList<>();

  @AfterEach
  void closeCoordinators() {
    coordinators.forEach(IngestionCoordinator::close);
  }

  @Test
  void malformedRecordsAreRejectedWithoutFailingTheBatch() {
    List<JsonNode> records = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      records.add(i % 20 == 7 ? objectMapper.createObjectNode().put("now", NOW) : aircraft(i, NOW + i));
    }
    ScriptedSource source = new ScriptedSource(List.of(records));

    IngestionReport report = coordinator(source, memoryStore, config(1)).ingest(1);

    BatchSummary batch = report.batches().get(0);
    assertThat(batch.state()).isEqualTo(BatchState.ACKNOWLEDGED);
    assertThat(batch.fetched()).isEqualTo(100);
    assertThat(batch.persisted()).isEqualTo(95);
    assertThat(batch.rejected()).isEqualTo(5);
    assertThat(batch.rejections()).allSatisfy(rejection ->
        assertThat(rejection.reasonCode()).isEqualTo(ReasonCode.MISSING_ENTITY_ID));
    assertThat(memoryStore.recordCount()).isEqualTo(95);
    assertThat(checkpointStore.load("scripted").map(Checkpoint::cursor)).contains("1");
    assertThat(meterRegistry.counter("pipeline.records.persisted").count()).isEqualTo(95.0);
  }

  @Test
  void fetchGivesUpAfterExactlyRetryLimitAttempts() {
    ScriptedSource source = new ScriptedSource(List.of(List.of(aircraft(1, NOW))));
    source.alwaysFail.set(true);

    IngestionCoordinator coordinator = coordinator(source, memoryStore, config(2));
    IngestionReport report = coordinator.ingest(5);

    assertThat(source.fetches.get()).isEqualTo(3);
    assertThat(sleeps).containsExactly(Duration.ofMillis(200), Duration.ofMillis(400));
    assertThat(report.batches()).singleElement().satisfies(batch -> {
      assertThat(batch.state()).isEqualTo(BatchState.FAILED);
      assertThat(batch.failedStage()).isEqualTo("FETCHING");
      assertThat(batch.failure()).contains("after 3 attempts");
    });
    assertThat(coordinator.failedBatches()).hasSize(1);
    assertThat(checkpointStore.load("scripted")).isEmpty();
    assertThat(meterRegistry.counter("pipeline.retries", "stage", "fetching").count()).isEqualTo(2.0);
  }

  @Test
  void transientFetchFailuresAreRetried() {
    ScriptedSource source = new ScriptedSource(List.of(List.of(aircraft(1, NOW))));
    source.failures.add(new TransientInfraException("503 from source"));
    source.failures.add(new TransientInfraException("503 from source"));

    IngestionReport report = coordinator(source, memoryStore, config(2)).ingest(1);

    assertThat(report.batches()).singleElement()
        .extracting(BatchSummary::state).isEqualTo(BatchState.ACKNOWLEDGED);
    assertThat(source.fetches.get()).isEqualTo(3);
  }

  @Test
  void fetchTimeoutIsATransientFailure() {
    ScriptedSource source = new ScriptedSource(List.of(List.of(aircraft(1, NOW))));
    source.hangFirstFetch.set(true);
    PipelineConfig config = new PipelineConfig(
        100, 3, Duration.ZERO, Duration.ofMillis(100), Duration.ofSeconds(5),
        Duration.ofMillis(200), Duration.ofSeconds(5), 2, 2, 2);

    IngestionReport report = coordinator(source, memoryStore, config).ingest(1);

    assertThat(report.batches()).singleElement()
        .extracting(BatchSummary::state).isEqualTo(BatchState.ACKNOWLEDGED);
    assertThat(source.fetches.get()).isEqualTo(2);
  }

  @Test
  void onlyFailedRecordsAreRetriedOnPartialStoreFailure() {
    FlakyStore store = new FlakyStore(memoryStore);
    store.failFirstRecordsOnce.set(3);
    List<JsonNode> records = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      records.add(aircraft(i, NOW));
    }

    IngestionReport report = coordinator(new ScriptedSource(List.of(records)), store, config(1)).ingest(1);

    assertThat(report.batches().get(0).state()).isEqualTo(BatchState.ACKNOWLEDGED);
    assertThat(report.batches().get(0).persisted()).isEqualTo(10);
    assertThat(store.putSizes).containsExactly(10, 3);
    assertThat(memoryStore.recordCount()).isEqualTo(10);
  }

  @Test
  void persistenceGivesUpAfterRetryLimit() {
    FlakyStore store = new FlakyStore(memoryStore);
    store.alwaysFail.set(true);

    IngestionReport report =
        coordinator(new ScriptedSource(List.of(List.of(aircraft(1, NOW)))), store, config(1)).ingest(1);

    assertThat(store.putSizes).hasSize(3);
    assertThat(report.batches().get(0).state()).isEqualTo(BatchState.FAILED);
    assertThat(report.batches().get(0).failedStage()).isEqualTo("PERSISTING");
    assertThat(checkpointStore.load("scripted")).isEmpty();
  }

  @Test
  void conflictFailsTheBatchBeforeAnyWrite() {
    memoryStore.putBatch(List.of(new CanonicalRecord(
        "a00001", Instant.ofEpochSecond(NOW - 60), Map.of("squawk", FieldValue.ofLong(7000)), "seed", 0L)));
    ObjectNode conflicting = aircraft(1, NOW).put("squawk", "7700");

    IngestionReport report = coordinator(
        new ScriptedSource(List.of(List.of(aircraft(2, NOW), conflicting))), memoryStore, config(2)).ingest(1);

    assertThat(report.batches().get(0).state()).isEqualTo(BatchState.FAILED);
    assertThat(report.batches().get(0).failedStage()).isEqualTo("MERGING");
    assertThat(memoryStore.recordCount()).isEqualTo(1);
    assertThat(checkpointStore.load("scripted")).isEmpty();
    assertThat(meterRegistry.counter("pipeline.batches", "outcome", "failed").count()).isEqualTo(1.0);
  }

  @Test
  void failedBatchHoldsTheCheckpointForLaterBatches() {
    memoryStore.putBatch(List.of(new CanonicalRecord(
        "a00001", Instant.ofEpochSecond(NOW - 60), Map.of("squawk", FieldValue.ofLong(7000)), "seed", 0L)));
    ScriptedSource source = new ScriptedSource(List.of(
        List.of(aircraft(1, NOW).put("squawk", "7700")),
        List.of(aircraft(2, NOW + 5)),
        List.of(aircraft(3, NOW + 10))));

    IngestionReport report = coordinator(source, memoryStore, config(2)).ingest(3);

    assertThat(report.batches().get(0).state()).isEqualTo(BatchState.FAILED);
    assertThat(report.batches()).noneMatch(batch -> batch.state() == BatchState.ACKNOWLEDGED);
    assertThat(report.checkpointCursor()).isEqualTo("0");
    assertThat(checkpointStore.load("scripted")).isEmpty();
  }

  @Test
  void batchesInFlightAreAcknowledgedWhenALaterFetchGivesUp() {
    FlakyStore store = new FlakyStore(memoryStore);
    store.putDelayMillis = 300;
    ScriptedSource source = new ScriptedSource(List.of(
        List.of(aircraft(1, NOW)),
        List.of(aircraft(2, NOW + 5))));
    source.failFromCursor.set(1);

    IngestionReport report = coordinator(source, store, config(2)).ingest(5);

    assertThat(report.batches()).extracting(BatchSummary::state)
        .containsExactly(BatchState.ACKNOWLEDGED, BatchState.FAILED);
    assertThat(report.batches().get(1).failedStage()).isEqualTo("FETCHING");
    assertThat(report.checkpointCursor()).isEqualTo("1");
    assertThat(checkpointStore.load("scripted").map(Checkpoint::lastBatchId)).contains("batch-0");
    assertThat(memoryStore.recordCount()).isEqualTo(1);
  }

  @Test
  void batchesInFlightAreAcknowledgedWhenALaterBatchIsCancelledWhileFetching() throws Exception {
    FlakyStore store = new FlakyStore(memoryStore);
    store.putDelayMillis = 300;
    ScriptedSource source = new ScriptedSource(List.of(
        List.of(aircraft(1, NOW)),
        List.of(aircraft(2, NOW + 5))));
    source.blockFromCursor.set(1);
    source.blockFetch = new CountDownLatch(1);
    IngestionCoordinator coordinator = coordinator(source, store, config(2));

    CompletableFuture<IngestionReport> run = CompletableFuture.supplyAsync(() -> coordinator.ingest(5));
    assertThat(source.blockedFetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(coordinator.cancel("1")).isTrue();
    source.blockFetch.countDown();
    IngestionReport report = run.get(5, TimeUnit.SECONDS);

    assertThat(report.batches()).extracting(BatchSummary::state)
        .containsExactly(BatchState.ACKNOWLEDGED, BatchState.CANCELLED);
    assertThat(report.checkpointCursor()).isEqualTo("1");
    assertThat(memoryStore.recordCount()).isEqualTo(1);
  }

  @Test
  void restartResumesAfterTheLastAcknowledgedBatch() {
    ScriptedSource source = new ScriptedSource(List.of(
        List.of(aircraft(1, NOW)),
        List.of(aircraft(1, NOW + 5)),
        List.of(aircraft(1, NOW + 10))));

    IngestionReport first = coordinator(source, memoryStore, config(2)).ingest(2);
    IngestionReport second = coordinator(source, memoryStore, config(2)).ingest(10);

    assertThat(first.checkpointCursor()).isEqualTo("2");
    assertThat(first.endOfStream()).isFalse();
    assertThat(second.startCursor()).isEqualTo("2");
    assertThat(second.batches()).extracting(BatchSummary::batchId).containsExactly("batch-2");
    assertThat(second.endOfStream()).isTrue();
    assertThat(checkpointStore.load("scripted").orElseThrow().version()).isEqualTo(3L);
    assertThat(memoryStore.getLatest("a00001").map(EntityState::lastObservedAt))
        .contains(Instant.ofEpochSecond(NOW + 10));
  }

  @Test
  void reprocessingAPersistedBatchIsIdempotent() {
    List<JsonNode> records = List.of(aircraft(1, NOW), aircraft(2, NOW));
    coordinator(new ScriptedSource(List.of(records)), memoryStore, config(2)).ingest(1);
    EntityState before = memoryStore.getLatest("a00001").orElseThrow();

    InMemoryCheckpointStore freshCheckpoints = new InMemoryCheckpointStore();
    IngestionCoordinator replay = new IngestionCoordinator(
        new ScriptedSource(List.of(records)),
        new RecordNormalizer(RecordSchema.readsb(), meterRegistry),
        mergeEngine,
        memoryStore,
        freshCheckpoints,
        config(2),
        meterRegistry,
        Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC),
        sleeps::add);
    coordinators.add(replay);
    IngestionReport report = replay.ingest(1);

    assertThat(report.batches().get(0).duplicates()).isEqualTo(2);
    assertThat(report.batches().get(0).persisted()).isZero();
    assertThat(memoryStore.recordCount()).isEqualTo(2);
    assertThat(memoryStore.getLatest("a00001")).contains(before);
  }

  @Test
  void batchCancelledWhileFetchingHasNoSideEffects() throws Exception {
    ScriptedSource source = new ScriptedSource(List.of(List.of(aircraft(1, NOW))));
    source.blockFetch = new CountDownLatch(1);
    IngestionCoordinator coordinator = coordinator(source, memoryStore, config(2));

    CompletableFuture<IngestionReport> run = CompletableFuture.supplyAsync(() -> coordinator.ingest(1));
    assertThat(source.fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(coordinator.find("0").map(BatchSummary::state)).contains(BatchState.FETCHING);
    assertThat(coordinator.cancel("0")).isTrue();
    source.blockFetch.countDown();
    IngestionReport report = run.get(5, TimeUnit.SECONDS);

    assertThat(report.batches()).singleElement()
        .extracting(BatchSummary::state).isEqualTo(BatchState.CANCELLED);
    assertThat(memoryStore.recordCount()).isZero();
    assertThat(checkpointStore.load("scripted")).isEmpty();
    assertThat(coordinator.cancel("batch-0")).isFalse();
  }

  @Test
  void acknowledgedBatchCannotBeCancelled() {
    IngestionCoordinator coordinator =
        coordinator(new ScriptedSource(List.of(List.of(aircraft(1, NOW)))), memoryStore, config(2));
    coordinator.ingest(1);

    assertThat(coordinator.cancel("batch-0")).isFalse();
    assertThat(coordinator.cancel("unknown")).isFalse();
    assertThat(coordinator.recentBatches()).extracting(BatchSummary::state).containsExactly(BatchState.ACKNOWLEDGED);
    assertThat(coordinator.lastReport()).isPresent();
  }

  @Test
  void manyBatchesAreAcknowledgedInCursorOrder() {
    List<List<JsonNode>> batches = new ArrayList<>();
    for (int b = 0; b < 12; b++) {
      List<JsonNode> records = new ArrayList<>();
      for (int i = 0; i < 50; i++) {
        records.add(aircraft(i, NOW + b * 5L));
      }
      batches.add(records);
    }
    PipelineConfig config = new PipelineConfig(
        50, 3, Duration.ZERO, Duration.ofSeconds(5), Duration.ofSeconds(5),
        Duration.ofMillis(200), Duration.ofSeconds(5), 4, 3, 3);

    IngestionReport report = coordinator(new ScriptedSource(batches), memoryStore, config).ingest(20);

    assertThat(report.isSuccessful()).isTrue();
    assertThat(report.endOfStream()).isTrue();
    assertThat(report.batches()).hasSize(12);
    assertThat(report.checkpointCursor()).isEqualTo("12");
    assertThat(memoryStore.recordCount()).isEqualTo(600);
    assertThat(memoryStore.entityCount()).isEqualTo(50);
    assertThat(checkpointStore.load("scripted").orElseThrow().version()).isEqualTo(12L);
  }

  private IngestionCoordinator coordinator(RawRecordSource source, RecordStore store, PipelineConfig config) {
    IngestionCoordinator coordinator = new IngestionCoordinator(
        source,
        new RecordNormalizer(RecordSchema.readsb(), meterRegistry),
        mergeEngine,
        store,
        checkpointStore,
        config,
        meterRegistry,
        Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC),
        sleeps::add);
    coordinators.add(coordinator);
    return coordinator;
  }

  private static PipelineConfig config(int partitions) {
    return new PipelineConfig(
        100, 3, Duration.ZERO, Duration.ofSeconds(5), Duration.ofSeconds(5),
        Duration.ofMillis(200), Duration.ofSeconds(5), partitions, 2, 2);
  }

  private ObjectNode aircraft(int index, long now) {
    return objectMapper.createObjectNode()
        .put("hex", String.format("a%05x", index))
        .put("now", now)
        .put("lat", 48.0 + index * 0.01)
        .put("lon", 2.0);
  }

  /** Serves fixed batches; the cursor is the batch index. */
  private static final class ScriptedSource implements RawRecordSource {
    private final List<List<JsonNode>> batches;
    private final ConcurrentLinkedDeque<RuntimeException> failures = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean alwaysFail = new AtomicBoolean();
    private final AtomicBoolean hangFirstFetch = new AtomicBoolean();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger failFromCursor = new AtomicInteger(Integer.MAX_VALUE);
    private final AtomicInteger blockFromCursor = new AtomicInteger(0);
    private final CountDownLatch fetchStarted = new CountDownLatch(1);
    private final CountDownLatch blockedFetchStarted = new CountDownLatch(1);
    private volatile CountDownLatch blockFetch;

    private ScriptedSource(List<List<JsonNode>> batches) {
      this.batches = batches;
    }

    @Override
    public String sourceId() {
      return "scripted";
    }

    @Override
    public String initialCursor() {
      return "0";
    }

    @Override
    public FetchResult fetchBatch(String cursor) {
      fetches.incrementAndGet();
      fetchStarted.countDown();
      int index = Integer.parseInt(cursor);
      try {
        if (blockFetch != null && index >= blockFromCursor.get()) {
          blockedFetchStarted.countDown();
          blockFetch.await(5, TimeUnit.SECONDS);
        }
        if (hangFirstFetch.getAndSet(false)) {
          Thread.sleep(10_000);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new TransientInfraException("fetch interrupted", ex);
      }
      if (alwaysFail.get() || index >= failFromCursor.get()) {
        throw new TransientInfraException("source unavailable");
      }
      RuntimeException failure = failures.poll();
      if (failure != null) {
        throw failure;
      }
      if (index >= batches.size()) {
        return FetchResult.endOfStream();
      }
      String batchId = "batch-" + index;
      List<RawRecord> records = new ArrayList<>();
      List<JsonNode> payloads = batches.get(index);
      for (int i = 0; i < payloads.size(); i++) {
        records.add(new RawRecord(batchId, index + 1L, i, Instant.EPOCH, payloads.get(i)));
      }
      return FetchResult.of(new RawBatch(batchId, cursor, index + 1L, Instant.EPOCH, records), String.valueOf(index + 1));
    }
  }

  /** Delegating store that reports transient per-record failures on demand. */
  private static final class FlakyStore implements RecordStore {
    private final RecordStore delegate;
    private final AtomicInteger failFirstRecordsOnce = new AtomicInteger();
    private final AtomicBoolean alwaysFail = new AtomicBoolean();
    private final List<Integer> putSizes = Collections.synchronizedList(new ArrayList<>());
    private volatile long putDelayMillis;

    private FlakyStore(RecordStore delegate) {
      this.delegate = delegate;
    }

    @Override
    public PutBatchResult putBatch(List<CanonicalRecord> records) {
      putSizes.add(records.size());
      if (putDelayMillis > 0) {
        try {
          Thread.sleep(putDelayMillis);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw new TransientInfraException("write interrupted", ex);
        }
      }
      int failing = alwaysFail.get() ? records.size() : Math.min(failFirstRecordsOnce.getAndSet(0), records.size());
      List<RecordFailure> failures = new ArrayList<>();
      for (CanonicalRecord record : records.subList(0, failing)) {
        failures.add(new RecordFailure(record.key(), RecordFailure.Kind.TRANSIENT, "connection reset"));
      }
      PutBatchResult applied = delegate.putBatch(records.subList(failing, records.size()));
      return new PutBatchResult(applied.written(), applied.duplicates(), failures);
    }

    @Override
    public Optional<EntityState> getLatest(String entityId) {
      return delegate.getLatest(entityId);
    }

    @Override
    public Iterable<CanonicalRecord> queryRange(Instant start, Instant end, RecordFilter filter) {
      return delegate.queryRange(start, end, filter);
    }

    @Override
    public Iterable<CanonicalRecord> queryEntity(String entityId, Instant start, Instant end) {
      return delegate.queryEntity(entityId, start, end);
    }

    @Override
    public List<EntityState> listStates(int offset, int limit) {
      return delegate.listStates(offset, limit);
    }

    @Override
    public long entityCount() {
      return delegate.entityCount();
    }

    @Override
    public long recordCount() {
      return delegate.recordCount();
    }

    @Override
    public long purgeBefore(Instant cutoff) {
      return delegate.purgeBefore(cutoff);
    }
  }
}
