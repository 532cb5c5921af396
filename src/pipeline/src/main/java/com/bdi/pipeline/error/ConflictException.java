package com.bdi.pipeline.error;

/**
 * Raised when an incoming observation cannot be merged into the stored state of its entity,
 * for example when a field changes value type.
 */
public class ConflictException extends PipelineException {
  private final String entityId;
  private final String field;

  public ConflictException(String entityId, String field, String message) {
    super(message);
    this.entityId = entityId;
    this.field = field;
  }

  public String getEntityId() {
    return entityId;
  }

  public String getField() {
    return field;
  }
}
