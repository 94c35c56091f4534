package com.sensorwatch.processor.model;

import java.time.Instant;
import java.util.Objects;

/** One summary ready to be persisted, covering {@code count} anomaly records. */
public record SummaryWindow(Instant windowStart, Instant windowEnd, int count, String summary) {
  public SummaryWindow {
    Objects.requireNonNull(windowStart, "windowStart");
    Objects.requireNonNull(windowEnd, "windowEnd");
    Objects.requireNonNull(summary, "summary");
    if (windowEnd.isBefore(windowStart)) {
      throw new IllegalArgumentException("window end is before window start");
    }
  }
}
