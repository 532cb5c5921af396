package com.bdi.pipeline.error;

/** Raised when a checkpoint commit expects a version that is no longer current. */
public class StaleCheckpointException extends PipelineException {
  public StaleCheckpointException(String sourceId, long expectedVersion) {
    super("checkpoint for source " + sourceId + " is no longer at version " + expectedVersion);
  }
}
