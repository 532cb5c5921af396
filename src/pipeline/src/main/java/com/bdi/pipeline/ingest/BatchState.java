package com.bdi.pipeline.ingest;

/** Lifecycle of an ingestion batch. */
public enum BatchState {
  FETCHING,
  FETCHED,
  NORMALIZING,
  MERGING,
  PERSISTING,
  PERSISTED,
  ACKNOWLEDGED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == ACKNOWLEDGED || this == FAILED || this == CANCELLED;
  }

  /** Cancellation is only allowed before any write reaches the store. */
  public boolean isCancellable() {
    return this == FETCHING || this == FETCHED || this == NORMALIZING;
  }
}
