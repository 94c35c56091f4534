package com.sensorwatch.processor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Anomaly entry as written by the ingester inside a stored event document.
 *
 * <p>The type is kept as its wire string; the processor only forwards anomalies to the summary
 * prompt and never branches on the type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Anomaly(
    @JsonProperty("type") String type,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("parameter") String parameter,
    @JsonProperty("value") Double value,
    @JsonProperty("duration_seconds") Long durationSeconds,
    @JsonProperty("message") String message) {}
