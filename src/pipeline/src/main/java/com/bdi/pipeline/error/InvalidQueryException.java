package com.bdi.pipeline.error;

/** Raised for aggregate or range queries with invalid windows or parameters. */
public class InvalidQueryException extends PipelineException {
  public InvalidQueryException(String message) {
    super(message);
  }
}
