package com.sensorwatch.dashboard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.sensorwatch.dashboard.time.Timestamps;
import java.util.List;

/**
 * Anomaly-bearing event as returned by {@code GET /api/anomalies}.
 *
 * <p>Same fields as the stored document, with {@code timestamp} rendered as ISO-8601 UTC.
 */
public record AnomalyEventItem(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("temperature") Double temperature,
    @JsonProperty("pressure") Double pressure,
    @JsonProperty("flow") Double flow,
    @JsonProperty("is_anomaly") boolean isAnomaly,
    @JsonProperty("anomalies") List<JsonNode> anomalies,
    @JsonProperty("processed") boolean processed) {

  public static AnomalyEventItem from(StoredAnomalyEvent stored) {
    return new AnomalyEventItem(
        stored.id(),
        Timestamps.fromEpochMillis(stored.timestamp()),
        stored.sensorId(),
        stored.temperature(),
        stored.pressure(),
        stored.flow(),
        stored.isAnomaly(),
        stored.anomalies() == null ? List.of() : stored.anomalies(),
        stored.processed());
  }
}
