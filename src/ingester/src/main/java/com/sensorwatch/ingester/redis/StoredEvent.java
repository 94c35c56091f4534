package com.sensorwatch.ingester.redis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorwatch.ingester.detection.Anomaly;
import java.util.List;

/**
 * Event document as persisted in Redis, enriched with its detection outcome.
 *
 * <p>{@code timestamp} is epoch milliseconds; the processor and dashboard read this contract.
 */
public record StoredEvent(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("pressure") double pressure,
    @JsonProperty("flow") double flow,
    @JsonProperty("is_anomaly") boolean isAnomaly,
    @JsonProperty("anomalies") List<Anomaly> anomalies,
    @JsonProperty("processed") boolean processed) {}
