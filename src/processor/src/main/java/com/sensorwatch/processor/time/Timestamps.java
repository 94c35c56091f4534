package com.sensorwatch.processor.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** ISO-8601 helpers for anomaly timestamps and summary window bounds. */
public final class Timestamps {
  private static final DateTimeFormatter ISO_MICROS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

  private Timestamps() {}

  /**
   * Parses an ISO-8601 timestamp, reading offset-less values as UTC.
   *
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

  public static String format(Instant instant) {
    return ISO_MICROS.format(instant);
  }
}
