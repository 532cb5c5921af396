package com.bdi.pipeline.ingest;

import com.bdi.pipeline.checkpoint.Checkpoint;
import com.bdi.pipeline.checkpoint.CheckpointStore;
import com.bdi.pipeline.error.ConflictException;
import com.bdi.pipeline.error.ExhaustedRetriesException;
import com.bdi.pipeline.error.PipelineException;
import com.bdi.pipeline.error.TransientInfraException;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.RecordKey;
import com.bdi.pipeline.normalize.NormalizedBatch;
import com.bdi.pipeline.normalize.RecordNormalizer;
import com.bdi.pipeline.store.PutBatchResult;
import com.bdi.pipeline.store.RecordFailure;
import com.bdi.pipeline.store.RecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives batches from the source through normalization, merge and persistence, then commits the
 * source checkpoint.
 *
 * <p>Threading model:
 * <ul>
 *   <li>the calling thread fetches batches in cursor order and acknowledges them in the same
 *   order, so the checkpoint only ever moves forward over contiguous persisted batches</li>
 *   <li>a worker pool normalizes and merges up to {@code maxInFlightBatches} batches at once</li>
 *   <li>store calls for an entity always run on the single-threaded executor of its partition,
 *   which makes that executor the only writer of the entity</li>
 * </ul>
 *
 * <p>A failed or cancelled batch blocks acknowledgement of every batch after it. Those batches
 * stay {@link BatchState#PERSISTED} and are fetched again by the next run from the last
 * checkpoint; the idempotent store absorbs the replay.
 */
public class IngestionCoordinator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);
  private static final int HISTORY_SIZE = 200;

  private final RawRecordSource source;
  private final RecordNormalizer normalizer;
  private final MergeEngine mergeEngine;
  private final RecordStore store;
  private final CheckpointStore checkpointStore;
  private final PipelineConfig config;
  private final RetryPolicy retryPolicy;
  private final EntityPartitioner partitioner;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Sleeper sleeper;

  private final ExecutorService fetchExecutor;
  private final ExecutorService workerPool;
  private final ExecutorService[] partitionExecutors;
  private final ReentrantLock runLock = new ReentrantLock();
  private final Deque<IngestionBatch> history = new ArrayDeque<>();
  private final AtomicInteger inFlight = new AtomicInteger();

  private final Counter acknowledgedCounter;
  private final Counter failedCounter;
  private final Counter cancelledCounter;
  private final Counter persistedCounter;
  private final Counter rejectedCounter;

  private volatile IngestionReport lastReport;

  public IngestionCoordinator(
      RawRecordSource source,
      RecordNormalizer normalizer,
      MergeEngine mergeEngine,
      RecordStore store,
      CheckpointStore checkpointStore,
      PipelineConfig config,
      MeterRegistry meterRegistry) {
    this(source, normalizer, mergeEngine, store, checkpointStore, config, meterRegistry,
        Clock.systemUTC(), Sleeper.SYSTEM);
  }

  public IngestionCoordinator(
      RawRecordSource source,
      RecordNormalizer normalizer,
      MergeEngine mergeEngine,
      RecordStore store,
      CheckpointStore checkpointStore,
      PipelineConfig config,
      MeterRegistry meterRegistry,
      Clock clock,
      Sleeper sleeper) {
    this.source = source;
    this.normalizer = normalizer;
    this.mergeEngine = mergeEngine;
    this.store = store;
    this.checkpointStore = checkpointStore;
    this.config = config;
    this.retryPolicy = config.retryPolicy();
    this.partitioner = new EntityPartitioner(config.partitions());
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.sleeper = sleeper;

    this.fetchExecutor = Executors.newCachedThreadPool(named("ingest-fetch"));
    this.workerPool = Executors.newFixedThreadPool(config.workerThreads(), named("ingest-worker"));
    this.partitionExecutors = new ExecutorService[config.partitions()];
    for (int i = 0; i < partitionExecutors.length; i++) {
      partitionExecutors[i] = Executors.newSingleThreadExecutor(named("ingest-partition-" + i));
    }

    this.acknowledgedCounter = meterRegistry.counter("pipeline.batches", "outcome", "acknowledged");
    this.failedCounter = meterRegistry.counter("pipeline.batches", "outcome", "failed");
    this.cancelledCounter = meterRegistry.counter("pipeline.batches", "outcome", "cancelled");
    this.persistedCounter = meterRegistry.counter("pipeline.records.persisted");
    this.rejectedCounter = meterRegistry.counter("pipeline.records.rejected");
    meterRegistry.gauge("pipeline.batches.inflight", inFlight);
  }

  /**
   * Runs one ingestion pass starting from the stored checkpoint.
   *
   * <p>Fetching stops after {@code maxBatches} batches, at end-of-stream, after a fetch gives up,
   * or once a failed or cancelled batch blocks the checkpoint. Batches already in flight are
   * always driven to a terminal or persisted state before the method returns, and those ahead of
   * a batch whose fetch failed or was cancelled are still acknowledged. Concurrent calls are
   * serialized.
   *
   * @param maxBatches maximum number of batches to fetch
   * @return per-batch outcome of the run
   */
  public IngestionReport ingest(int maxBatches) {
    if (maxBatches <= 0) {
      throw new IllegalArgumentException("maxBatches must be positive, got " + maxBatches);
    }
    runLock.lock();
    try {
      IngestionReport report = runIngest(maxBatches);
      lastReport = report;
      return report;
    } finally {
      runLock.unlock();
    }
  }

  /**
   * Cancels a batch that has not started merging.
   *
   * @param batchIdOrCursor batch id, or the cursor of a batch still being fetched
   * @return {@code true} if the batch moved to {@link BatchState#CANCELLED}
   */
  public boolean cancel(String batchIdOrCursor) {
    IngestionBatch batch = lookup(batchIdOrCursor);
    if (batch == null) {
      return false;
    }
    BatchState before = batch.state();
    if (!batch.cancel()) {
      log.info("Batch {} not cancelled: state is {}", label(batch), batch.state());
      return false;
    }
    cancelledCounter.increment();
    log.info("Batch {} cancelled while {}", label(batch), before);
    return true;
  }

  public Optional<BatchSummary> find(String batchIdOrCursor) {
    return Optional.ofNullable(lookup(batchIdOrCursor)).map(IngestionBatch::summary);
  }

  /** Most recent batches, newest first. */
  public List<BatchSummary> recentBatches() {
    List<BatchSummary> summaries = new ArrayList<>();
    synchronized (history) {
      Iterator<IngestionBatch> newestFirst = history.descendingIterator();
      while (newestFirst.hasNext()) {
        summaries.add(newestFirst.next().summary());
      }
    }
    return summaries;
  }

  /** Recent batches that ended in {@link BatchState#FAILED}, newest first. */
  public List<BatchSummary> failedBatches() {
    return recentBatches().stream().filter(batch -> batch.state() == BatchState.FAILED).toList();
  }

  public Optional<IngestionReport> lastReport() {
    return Optional.ofNullable(lastReport);
  }

  public Optional<Checkpoint> checkpoint() {
    return checkpointStore.load(source.sourceId());
  }

  public String sourceId() {
    return source.sourceId();
  }

  @Override
  public void close() {
    fetchExecutor.shutdownNow();
    workerPool.shutdownNow();
    for (ExecutorService executor : partitionExecutors) {
      executor.shutdownNow();
    }
    try {
      workerPool.awaitTermination(5, TimeUnit.SECONDS);
      for (ExecutorService executor : partitionExecutors) {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private IngestionReport runIngest(int maxBatches) {
    Checkpoint checkpoint = checkpointStore.load(source.sourceId()).orElse(null);
    String startCursor = checkpoint == null ? source.initialCursor() : checkpoint.cursor();
    Run run = new Run(checkpoint);
    log.info("Ingestion run started for source {} at cursor {}", source.sourceId(), startCursor);

    Semaphore slots = new Semaphore(config.maxInFlightBatches());
    Deque<InFlight> pending = new ArrayDeque<>();
    List<IngestionBatch> batches = new ArrayList<>();
    String cursor = startCursor;
    boolean endOfStream = false;

    while (batches.size() < maxBatches && !run.blocked) {
      try {
        slots.acquire();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Ingestion run interrupted while waiting for an in-flight slot");
        break;
      }

      IngestionBatch batch = new IngestionBatch(cursor, clock);
      remember(batch);
      FetchResult result;
      try {
        result = fetch(batch);
      } catch (RuntimeException ex) {
        slots.release();
        batches.add(batch);
        fail(batch, BatchState.FETCHING.name(), ex);
        break;
      }

      if (result.isEndOfStream()) {
        slots.release();
        forget(batch);
        endOfStream = true;
        log.info("Source {} reached end of stream at cursor {}", source.sourceId(), cursor);
        break;
      }

      batch.fetched(result.batch(), result.nextCursor());
      batches.add(batch);
      // Cancelled while fetching; batches already in flight are still acknowledged.
      if (!batch.transition(BatchState.FETCHING, BatchState.FETCHED)) {
        slots.release();
        break;
      }

      inFlight.incrementAndGet();
      CompletableFuture<Void> done = CompletableFuture
          .runAsync(() -> process(batch), workerPool)
          .whenComplete((ignored, ex) -> {
            inFlight.decrementAndGet();
            slots.release();
          });
      pending.addLast(new InFlight(batch, done));
      cursor = result.nextCursor();
      acknowledgeCompleted(pending, run, false);
    }
    acknowledgeCompleted(pending, run, true);

    String checkpointCursor = run.checkpoint == null ? startCursor : run.checkpoint.cursor();
    IngestionReport report = new IngestionReport(
        source.sourceId(),
        startCursor,
        checkpointCursor,
        endOfStream,
        batches.stream().map(IngestionBatch::summary).toList());
    log.info(
        "Ingestion run finished for source {}: batches={} acknowledged={} failed={} cancelled={} "
            + "fetched={} persisted={} rejected={} checkpoint={}",
        source.sourceId(),
        report.batches().size(),
        report.count(BatchState.ACKNOWLEDGED),
        report.count(BatchState.FAILED),
        report.count(BatchState.CANCELLED),
        report.recordsFetched(),
        report.recordsPersisted(),
        report.rejections(),
        checkpointCursor);
    return report;
  }

  private FetchResult fetch(IngestionBatch batch) {
    String cursor = batch.cursor();
    return retrying(batch, BatchState.FETCHING.name(), () -> {
      Future<FetchResult> future = fetchExecutor.submit(() -> source.fetchBatch(cursor));
      return await(future, config.fetchTimeout(), "fetch of cursor " + cursor);
    });
  }

  private void process(IngestionBatch batch) {
    String stage = BatchState.NORMALIZING.name();
    try {
      if (!batch.transition(BatchState.FETCHED, BatchState.NORMALIZING)) {
        return;
      }
      NormalizedBatch normalized = normalizer.normalizeAll(batch.raw().records());
      batch.normalized(normalized);
      rejectedCounter.increment(normalized.rejections().size());
      if (!batch.transition(BatchState.NORMALIZING, BatchState.MERGING)) {
        return;
      }

      stage = BatchState.MERGING.name();
      List<CanonicalRecord> collapsed = mergeEngine.collapse(normalized.records());
      checkAgainstStore(batch, collapsed);
      if (!batch.transition(BatchState.MERGING, BatchState.PERSISTING)) {
        return;
      }

      stage = BatchState.PERSISTING.name();
      persist(batch, collapsed);
      batch.transition(BatchState.PERSISTING, BatchState.PERSISTED);
      log.debug("Batch {} persisted", label(batch));
    } catch (RuntimeException ex) {
      fail(batch, stage, ex);
    }
  }

  private void checkAgainstStore(IngestionBatch batch, List<CanonicalRecord> records) {
    Map<Integer, List<CanonicalRecord>> parts = partitioner.split(records);
    retrying(batch, BatchState.MERGING.name(), () -> {
      List<Future<Void>> checks = new ArrayList<>();
      parts.forEach((partition, part) -> checks.add(partitionExecutors[partition].submit(() -> {
        for (CanonicalRecord record : part) {
          mergeEngine.checkCompatible(store.getLatest(record.entityId()).orElse(null), record);
        }
        return null;
      })));
      for (Future<Void> check : checks) {
        await(check, config.storeTimeout(), "state check of batch " + label(batch));
      }
      return null;
    });
  }

  private void persist(IngestionBatch batch, List<CanonicalRecord> records) {
    List<CanonicalRecord> pending = records;
    for (int attempt = 1; ; attempt++) {
      Map<Integer, List<CanonicalRecord>> parts = partitioner.split(pending);
      Map<Integer, Future<PutBatchResult>> writes = new TreeMap<>();
      parts.forEach((partition, part) ->
          writes.put(partition, partitionExecutors[partition].submit(() -> store.putBatch(part))));

      List<CanonicalRecord> retry = new ArrayList<>();
      TransientInfraException lastFailure = null;
      RecordFailure conflict = null;
      for (Map.Entry<Integer, Future<PutBatchResult>> write : writes.entrySet()) {
        List<CanonicalRecord> part = parts.get(write.getKey());
        try {
          PutBatchResult result = await(write.getValue(), config.storeTimeout(), "write of batch " + label(batch));
          batch.addPersisted(result.written(), result.duplicates());
          persistedCounter.increment(result.written());
          if (conflict == null && !result.conflicts().isEmpty()) {
            conflict = result.conflicts().get(0);
          }
          List<RecordFailure> transientFailures =
              result.failures().stream().filter(RecordFailure::isTransient).toList();
          if (!transientFailures.isEmpty()) {
            Set<RecordKey> failedKeys = transientFailures.stream()
                .map(RecordFailure::key)
                .collect(Collectors.toSet());
            part.stream().filter(record -> failedKeys.contains(record.key())).forEach(retry::add);
            lastFailure = new TransientInfraException(
                transientFailures.size() + " records not written: " + transientFailures.get(0).reason());
          }
        } catch (TransientInfraException ex) {
          retry.addAll(part);
          lastFailure = ex;
        }
      }

      if (conflict != null) {
        throw new ConflictException(conflict.key().entityId(), null, conflict.reason());
      }
      if (retry.isEmpty()) {
        return;
      }
      if (!retryPolicy.canRetry(attempt)) {
        throw new ExhaustedRetriesException(
            label(batch), BatchState.PERSISTING.name(), attempt, batch.applied(), lastFailure);
      }
      backoff(batch, BatchState.PERSISTING.name(), attempt, lastFailure);
      pending = retry;
    }
  }

  private void acknowledgeCompleted(Deque<InFlight> pending, Run run, boolean wait) {
    while (!pending.isEmpty()) {
      InFlight head = pending.peekFirst();
      if (wait) {
        head.done().join();
      } else if (!head.done().isDone()) {
        return;
      }
      pending.pollFirst();
      IngestionBatch batch = head.batch();
      if (run.blocked) {
        continue;
      }
      if (batch.state() != BatchState.PERSISTED) {
        log.warn("Checkpoint held at batch {} ({}); later batches stay unacknowledged", label(batch), batch.state());
        run.blocked = true;
        continue;
      }
      try {
        acknowledge(batch, run);
      } catch (RuntimeException ex) {
        fail(batch, "ACKNOWLEDGING", ex);
        run.blocked = true;
      }
    }
  }

  private void acknowledge(IngestionBatch batch, Run run) {
    Checkpoint current = run.checkpoint;
    long expectedVersion = current == null ? 0L : current.version();
    Checkpoint next = current == null
        ? Checkpoint.first(source.sourceId(), batch.nextCursor(), batch.id(), clock.instant())
        : current.advance(batch.nextCursor(), batch.id(), clock.instant());
    run.checkpoint = retrying(batch, "ACKNOWLEDGING", () -> checkpointStore.commit(next, expectedVersion));
    batch.transition(BatchState.PERSISTED, BatchState.ACKNOWLEDGED);
    acknowledgedCounter.increment();
    BatchSummary summary = batch.summary();
    log.info(
        "Batch {} acknowledged: fetched={} accepted={} rejected={} persisted={} duplicates={} checkpoint={}",
        summary.batchId(),
        summary.fetched(),
        summary.accepted(),
        summary.rejected(),
        summary.persisted(),
        summary.duplicates(),
        next.cursor());
  }

  private <T> T retrying(IngestionBatch batch, String stage, Supplier<T> action) {
    for (int attempt = 1; ; attempt++) {
      TransientInfraException failure;
      try {
        return action.get();
      } catch (TransientInfraException ex) {
        failure = ex;
      }
      if (!retryPolicy.canRetry(attempt)) {
        throw new ExhaustedRetriesException(label(batch), stage, attempt, batch.applied(), failure);
      }
      backoff(batch, stage, attempt, failure);
    }
  }

  private void backoff(IngestionBatch batch, String stage, int failedAttempt, Exception failure) {
    Duration delay = retryPolicy.backoff(failedAttempt);
    meterRegistry.counter("pipeline.retries", "stage", stage.toLowerCase()).increment();
    log.warn(
        "Batch {} attempt {}/{} at {} failed, retrying in {} ms: {}",
        label(batch),
        failedAttempt,
        retryPolicy.maxAttempts(),
        stage,
        delay.toMillis(),
        failure == null ? "unknown" : failure.getMessage());
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PipelineException("interrupted while retrying batch " + label(batch), ex);
    }
  }

  /**
   * Waits for a task, turning timeouts and unexpected infrastructure errors into
   * {@link TransientInfraException}.
   */
  private static <T> T await(Future<T> future, Duration timeout, String what) {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new TransientInfraException(what + " timed out after " + timeout.toMillis() + " ms", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof PipelineException pipelineException) {
        throw pipelineException;
      }
      throw new TransientInfraException(what + " failed: " + cause.getMessage(), cause);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new PipelineException("interrupted during " + what, ex);
    }
  }

  private void fail(IngestionBatch batch, String stage, Throwable cause) {
    if (batch.fail(stage, cause)) {
      failedCounter.increment();
      log.error("Batch {} failed at {}", label(batch), stage, cause);
    }
  }

  private void remember(IngestionBatch batch) {
    synchronized (history) {
      history.addLast(batch);
      while (history.size() > HISTORY_SIZE) {
        history.removeFirst();
      }
    }
  }

  private void forget(IngestionBatch batch) {
    synchronized (history) {
      history.remove(batch);
    }
  }

  private IngestionBatch lookup(String batchIdOrCursor) {
    if (batchIdOrCursor == null) {
      return null;
    }
    synchronized (history) {
      Iterator<IngestionBatch> newestFirst = history.descendingIterator();
      while (newestFirst.hasNext()) {
        IngestionBatch batch = newestFirst.next();
        if (batch.matches(batchIdOrCursor)) {
          return batch;
        }
      }
    }
    return null;
  }

  private static String label(IngestionBatch batch) {
    String id = batch.id();
    return id != null ? id : "@" + batch.cursor();
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private record InFlight(IngestionBatch batch, CompletableFuture<Void> done) {}

  private static final class Run {
    private Checkpoint checkpoint;
    private boolean blocked;

    private Run(Checkpoint checkpoint) {
      this.checkpoint = checkpoint;
    }
  }
}
