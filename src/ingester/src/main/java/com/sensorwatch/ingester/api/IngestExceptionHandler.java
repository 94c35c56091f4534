package com.sensorwatch.ingester.api;

import java.time.format.DateTimeParseException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ingestion failures to {@code {"error": "..."}} payloads.
 *
 * <p>A single bad event must never take the ingester down; every exception ends here.
 */
@RestControllerAdvice
public class IngestExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(IngestExceptionHandler.class);

  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
    return ResponseEntity.badRequest().body(error(ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    log.debug("Rejected unreadable event payload", ex);
    return ResponseEntity.badRequest().body(error("malformed event payload"));
  }

  @ExceptionHandler(DateTimeParseException.class)
  public ResponseEntity<Map<String, Object>> handleTimestamp(DateTimeParseException ex) {
    return ResponseEntity.badRequest()
        .body(error("invalid timestamp: " + ex.getParsedString()));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
    log.error("Event store write failed", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error("event store unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Event ingestion failed", ex);
    String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(message));
  }

  private Map<String, Object> error(String message) {
    return Map.of("error", message);
  }
}
