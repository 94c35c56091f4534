package com.sensorwatch.ingester.detection;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of running one event through {@link AnomalyDetector}.
 *
 * @param anomalies anomalies raised by the event, in detection order
 * @param isAnomaly {@code true} when at least one anomaly was raised
 */
public record DetectionResult(
    @JsonProperty("anomalies") List<Anomaly> anomalies,
    @JsonProperty("is_anomaly") boolean isAnomaly) {

  public DetectionResult {
    anomalies = List.copyOf(anomalies);
  }

  public static DetectionResult none() {
    return new DetectionResult(List.of(), false);
  }

  public static DetectionResult of(List<Anomaly> anomalies) {
    return new DetectionResult(anomalies, !anomalies.isEmpty());
  }
}
