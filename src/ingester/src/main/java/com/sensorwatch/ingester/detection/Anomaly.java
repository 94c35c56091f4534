package com.sensorwatch.ingester.detection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

/**
 * Immutable anomaly attached to the event that triggered it.
 *
 * @param type anomaly class
 * @param timestamp triggering event timestamp, as received
 * @param sensorId sensor identifier
 * @param parameter measured parameter ({@code pressure|flow|temperature}), absent for dropout
 * @param value offending measurement, absent for dropout
 * @param durationSeconds floored duration, drift and dropout only
 * @param message diagnostic text for operators
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Anomaly(
    @JsonProperty("type") AnomalyType type,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("parameter") String parameter,
    @JsonProperty("value") Double value,
    @JsonProperty("duration_seconds") Long durationSeconds,
    @JsonProperty("message") String message) {

  static Anomaly dropout(String timestamp, String sensorId, double gapSeconds) {
    return new Anomaly(
        AnomalyType.DROPOUT,
        timestamp,
        sensorId,
        null,
        null,
        (long) gapSeconds,
        String.format(Locale.ROOT, "No data for %.1fs (threshold 10s) on %s", gapSeconds, sensorId));
  }

  static Anomaly pressureSpike(String timestamp, String sensorId, double pressure) {
    return new Anomaly(
        AnomalyType.SPIKE,
        timestamp,
        sensorId,
        "pressure",
        pressure,
        null,
        String.format(Locale.ROOT, "Pressure spike: %.2f bar (threshold 4.0 bar)", pressure));
  }

  static Anomaly flowSpike(String timestamp, String sensorId, double flow) {
    return new Anomaly(
        AnomalyType.SPIKE,
        timestamp,
        sensorId,
        "flow",
        flow,
        null,
        String.format(Locale.ROOT, "Flow spike: %.1f L/min (threshold 120 L/min)", flow));
  }

  static Anomaly drift(String timestamp, String sensorId, double temperature, double durationSeconds) {
    long seconds = (long) durationSeconds;
    return new Anomaly(
        AnomalyType.DRIFT,
        timestamp,
        sensorId,
        "temperature",
        temperature,
        seconds,
        String.format(
            Locale.ROOT, "Temperature drift: %.1f °C for %ds (threshold 15s)", temperature, seconds));
  }
}
