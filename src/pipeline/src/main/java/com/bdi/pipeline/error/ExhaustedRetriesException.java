package com.bdi.pipeline.error;

/**
 * Raised when a batch stage keeps failing transiently after the configured number of attempts.
 */
public class ExhaustedRetriesException extends PipelineException {
  private final String batchId;
  private final String stage;
  private final int attempts;
  private final int completedRecords;

  public ExhaustedRetriesException(
      String batchId, String stage, int attempts, int completedRecords, Throwable lastFailure) {
    super(
        "batch " + batchId + " failed at " + stage + " after " + attempts + " attempts ("
            + completedRecords + " records completed)",
        lastFailure);
    this.batchId = batchId;
    this.stage = stage;
    this.attempts = attempts;
    this.completedRecords = completedRecords;
  }

  public String getBatchId() {
    return batchId;
  }

  public String getStage() {
    return stage;
  }

  public int getAttempts() {
    return attempts;
  }

  /** Records of the batch already applied when the stage gave up. */
  public int getCompletedRecords() {
    return completedRecords;
  }
}
