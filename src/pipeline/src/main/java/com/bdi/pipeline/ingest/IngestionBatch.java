package com.bdi.pipeline.ingest;

import com.bdi.pipeline.model.RawBatch;
import com.bdi.pipeline.normalize.NormalizedBatch;
import com.bdi.pipeline.normalize.Rejection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable tracking record of one batch, owned by the {@link IngestionCoordinator}.
 *
 * <p>State changes go through {@link #transition}, a compare-and-set, so a concurrent
 * {@code cancel} and a pipeline step can never both win.
 */
final class IngestionBatch {
  private final String cursor;
  private final Clock clock;
  private final Instant startedAt;
  private final AtomicReference<BatchState> state = new AtomicReference<>(BatchState.FETCHING);

  private volatile RawBatch raw;
  private volatile String nextCursor;
  private volatile List<Rejection> rejections = List.of();
  private volatile int accepted;
  private volatile int persisted;
  private volatile int duplicates;
  private volatile String failedStage;
  private volatile Throwable failure;
  private volatile Instant updatedAt;

  IngestionBatch(String cursor, Clock clock) {
    this.cursor = cursor;
    this.clock = clock;
    this.startedAt = clock.instant();
    this.updatedAt = startedAt;
  }

  String id() {
    RawBatch fetched = raw;
    return fetched == null ? null : fetched.batchId();
  }

  boolean matches(String batchIdOrCursor) {
    return batchIdOrCursor.equals(id()) || batchIdOrCursor.equals(cursor);
  }

  String cursor() {
    return cursor;
  }

  String nextCursor() {
    return nextCursor;
  }

  RawBatch raw() {
    return raw;
  }

  BatchState state() {
    return state.get();
  }

  boolean transition(BatchState from, BatchState to) {
    if (state.compareAndSet(from, to)) {
      updatedAt = clock.instant();
      return true;
    }
    return false;
  }

  /** Cancels the batch if it has not reached the merge stage yet. */
  boolean cancel() {
    while (true) {
      BatchState current = state.get();
      if (!current.isCancellable()) {
        return false;
      }
      if (transition(current, BatchState.CANCELLED)) {
        return true;
      }
    }
  }

  /** Fails the batch from any non-terminal state. */
  boolean fail(String stage, Throwable cause) {
    while (true) {
      BatchState current = state.get();
      if (current.isTerminal()) {
        return false;
      }
      failedStage = stage;
      failure = cause;
      if (transition(current, BatchState.FAILED)) {
        return true;
      }
    }
  }

  void fetched(RawBatch batch, String next) {
    this.raw = batch;
    this.nextCursor = next;
  }

  void normalized(NormalizedBatch normalized) {
    this.accepted = normalized.records().size();
    this.rejections = normalized.rejections();
  }

  synchronized void addPersisted(int written, int duplicated) {
    persisted += written;
    duplicates += duplicated;
  }

  int applied() {
    return persisted + duplicates;
  }

  BatchSummary summary() {
    RawBatch fetched = raw;
    Throwable cause = failure;
    return new BatchSummary(
        id(),
        cursor,
        nextCursor,
        fetched == null ? -1L : fetched.sequence(),
        state.get(),
        fetched == null ? 0 : fetched.size(),
        accepted,
        rejections.size(),
        persisted,
        duplicates,
        failedStage,
        cause == null ? null : cause.getMessage(),
        rejections,
        startedAt,
        updatedAt);
  }
}
