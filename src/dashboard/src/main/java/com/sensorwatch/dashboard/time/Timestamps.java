package com.sensorwatch.dashboard.time;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Renders stored epoch milliseconds as ISO-8601 UTC with microsecond precision. */
public final class Timestamps {
  private static final DateTimeFormatter ISO_MICROS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

  private Timestamps() {}

  public static String fromEpochMillis(long epochMillis) {
    return ISO_MICROS.format(Instant.ofEpochMilli(epochMillis));
  }
}
