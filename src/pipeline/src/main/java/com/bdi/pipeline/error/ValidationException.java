package com.bdi.pipeline.error;

import com.bdi.pipeline.normalize.ReasonCode;

/**
 * Raised while normalizing a single raw record.
 *
 * <p>Never escapes the normalizer: it is converted into a reason-coded rejection.
 */
public class ValidationException extends PipelineException {
  private final ReasonCode reasonCode;

  public ValidationException(ReasonCode reasonCode, String message) {
    super(message);
    this.reasonCode = reasonCode;
  }

  public ReasonCode getReasonCode() {
    return reasonCode;
  }
}
