package com.sensorwatch.ingester.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Closed set of anomaly classes raised by {@link AnomalyDetector}. */
public enum AnomalyType {
  SPIKE,
  DRIFT,
  DROPOUT;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AnomalyType fromWireName(String value) {
    return AnomalyType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
