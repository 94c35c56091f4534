package com.sensorwatch.ingester.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.Test;

class TimestampsTest {

  @Test
  void convertsZuluTimestampToEpochMillis() {
    assertEquals(1_748_789_085_584L, Timestamps.toEpochMillis("2025-06-01T14:44:45.584001Z"));
  }

  @Test
  void readsNaiveTimestampAsUtc() {
    assertEquals(
        Timestamps.toEpochMillis("2025-06-01T14:44:45Z"),
        Timestamps.toEpochMillis("2025-06-01T14:44:45"));
  }

  @Test
  void honoursExplicitOffset() {
    assertEquals(
        Timestamps.toEpochMillis("2025-06-01T12:44:45Z"),
        Timestamps.toEpochMillis("2025-06-01T14:44:45+02:00"));
  }

  @Test
  void acceptsSpaceBetweenDateAndTime() {
    assertEquals(
        Timestamps.toEpochMillis("2025-06-01T14:44:45Z"),
        Timestamps.toEpochMillis("2025-06-01 14:44:45"));
    assertEquals(
        Timestamps.toEpochMillis("2025-06-01T12:44:45.5Z"),
        Timestamps.toEpochMillis("2025-06-01 14:44:45.5+02:00"));
  }

  @Test
  void rejectsGarbageAndEmptyValues() {
    assertThrows(DateTimeParseException.class, () -> Timestamps.parse("yesterday"));
    assertThrows(DateTimeParseException.class, () -> Timestamps.parse(" "));
    assertThrows(DateTimeParseException.class, () -> Timestamps.parse(null));
  }
}
