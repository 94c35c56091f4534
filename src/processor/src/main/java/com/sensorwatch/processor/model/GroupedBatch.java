package com.sensorwatch.processor.model;

import com.sensorwatch.processor.time.Timestamps;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anomalies of one batch grouped by sensor, with the earliest and latest anomaly timestamps.
 *
 * <p>Bounds are null when no anomaly in the batch carries a parseable timestamp.
 */
public record GroupedBatch(
    Map<String, List<Anomaly>> anomaliesBySensor, Instant firstAnomalyAt, Instant lastAnomalyAt) {

  public GroupedBatch {
    anomaliesBySensor = Collections.unmodifiableMap(new LinkedHashMap<>(anomaliesBySensor));
  }

  public static GroupedBatch empty() {
    return new GroupedBatch(Map.of(), null, null);
  }

  public boolean isEmpty() {
    return anomaliesBySensor.isEmpty();
  }

  public boolean hasBounds() {
    return firstAnomalyAt != null && lastAnomalyAt != null;
  }

  public int anomalyCount() {
    return anomaliesBySensor.values().stream().mapToInt(List::size).sum();
  }

  /**
   * Shape sent to the language model: window bounds under {@code timestamp} and
   * {@code stop_timestamp}, then one entry per sensor in first-seen order.
   */
  public Map<String, Object> toPromptPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (hasBounds()) {
      payload.put("timestamp", Timestamps.format(firstAnomalyAt));
      payload.put("stop_timestamp", Timestamps.format(lastAnomalyAt));
    }
    payload.putAll(anomaliesBySensor);
    return payload;
  }
}
