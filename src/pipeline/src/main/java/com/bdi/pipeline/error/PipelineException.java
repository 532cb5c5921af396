package com.bdi.pipeline.error;

/** Base type of every error raised by the ingestion and query pipeline. */
public class PipelineException extends RuntimeException {
  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
