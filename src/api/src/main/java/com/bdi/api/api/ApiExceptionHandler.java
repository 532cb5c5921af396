package com.bdi.api.api;

import com.bdi.pipeline.error.InvalidQueryException;
import com.bdi.pipeline.error.TransientInfraException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping.
 *
 * <p>Known request, pipeline and backend exceptions are converted into stable JSON error
 * payloads of the form {@code {error, message, timestamp}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Maps request validation errors, including rejected aggregate queries, to HTTP 400.
   *
   * @param ex validation exception thrown by parsing or the aggregation engine
   * @return standardized error payload
   */
  @ExceptionHandler({BadRequestException.class, InvalidQueryException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
    return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
  }

  /**
   * Maps unmatched routes to HTTP 404 instead of generic 500.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return standardized not-found payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found", "resource not found"));
  }

  /**
   * Maps store and source outages to HTTP 502.
   *
   * @param ex backend failure
   * @return standardized error payload
   */
  @ExceptionHandler({TransientInfraException.class, DataAccessException.class})
  public ResponseEntity<Map<String, Object>> handleBackend(RuntimeException ex) {
    log.warn("Backend unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(error("backend_unavailable", "storage backend unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    return Map.of(
        "error", code,
        "message", message == null ? "" : message,
        "timestamp", Instant.now().toString());
  }
}
