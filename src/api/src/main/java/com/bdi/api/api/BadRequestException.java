package com.bdi.api.api;

/**
 * Raised when a request parameter cannot be parsed or is out of bounds.
 *
 * <p>Mapped to HTTP 400 by {@link ApiExceptionHandler}.
 */
public class BadRequestException extends RuntimeException {
  public BadRequestException(String message) {
    super(message);
  }
}
