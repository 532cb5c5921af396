package com.bdi.api.api;

/**
 * Raised when a requested aircraft or batch does not exist.
 *
 * <p>Mapped to HTTP 404 by {@link ApiExceptionHandler}.
 */
public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
