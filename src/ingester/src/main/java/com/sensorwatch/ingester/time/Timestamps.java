package com.sensorwatch.ingester.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Conversion of wire timestamps (ISO-8601, UTC) to the epoch-millisecond values kept in Redis.
 *
 * <p>Timestamps without an offset are read as UTC. Precision below the millisecond is dropped on
 * the way into Redis.
 */
public final class Timestamps {
  private Timestamps() {}

  /**
   * Parses an ISO-8601 timestamp.
   *
   * @param raw timestamp such as {@code 2025-06-01T14:44:45.584001Z}
   * @return parsed instant
   * @throws DateTimeParseException when the value is empty or not ISO-8601
   */
  public static Instant parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new DateTimeParseException("timestamp is empty", String.valueOf(raw), 0);
    }
    String value = raw.trim();
    if (value.length() > 10 && value.charAt(10) == ' ') {
      // RFC 3339 date-time with a space in place of the 'T'.
      value = value.substring(0, 10) + 'T' + value.substring(11);
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ex) {
      return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
    }
  }

  public static long toEpochMillis(String raw) {
    return parse(raw).toEpochMilli();
  }
}
