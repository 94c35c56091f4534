package com.sensorwatch.ingester.api;

/**
 * Raised when an ingested event is structurally unusable.
 *
 * <p>Mapped to HTTP 400 by {@link IngestExceptionHandler}.
 */
public class BadRequestException extends RuntimeException {
  public BadRequestException(String message) {
    super(message);
  }
}
