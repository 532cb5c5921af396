package com.bdi.pipeline.error;

/** Source or store timeout/unavailability. Retried by the coordinator. */
public class TransientInfraException extends PipelineException {
  public TransientInfraException(String message) {
    super(message);
  }

  public TransientInfraException(String message, Throwable cause) {
    super(message, cause);
  }
}
