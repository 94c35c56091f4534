package com.sensorwatch.processor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Event document read back from the Redis events hash. Timestamp is epoch milliseconds. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredEvent(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("temperature") Double temperature,
    @JsonProperty("pressure") Double pressure,
    @JsonProperty("flow") Double flow,
    @JsonProperty("is_anomaly") boolean isAnomaly,
    @JsonProperty("anomalies") List<Anomaly> anomalies,
    @JsonProperty("processed") boolean processed) {

  public StoredEvent {
    anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
  }

  public StoredEvent markedProcessed() {
    return new StoredEvent(id, timestamp, sensorId, temperature, pressure, flow, isAnomaly, anomalies, true);
  }
}
