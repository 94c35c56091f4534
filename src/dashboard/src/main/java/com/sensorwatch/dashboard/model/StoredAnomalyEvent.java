package com.sensorwatch.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Event document as persisted in Redis (timestamp in epoch milliseconds). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredAnomalyEvent(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("temperature") Double temperature,
    @JsonProperty("pressure") Double pressure,
    @JsonProperty("flow") Double flow,
    @JsonProperty("is_anomaly") boolean isAnomaly,
    @JsonProperty("anomalies") List<JsonNode> anomalies,
    @JsonProperty("processed") boolean processed) {}
