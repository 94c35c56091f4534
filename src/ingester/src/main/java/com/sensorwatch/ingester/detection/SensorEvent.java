package com.sensorwatch.ingester.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One telemetry sample as posted by a sensor gateway.
 *
 * <p>Measurements are optional on the wire; absent values are read as {@code 0.0} by the
 * detector and the store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SensorEvent(
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("temperature") Double temperature,
    @JsonProperty("pressure") Double pressure,
    @JsonProperty("flow") Double flow) {

  public double temperatureOrZero() {
    return temperature == null ? 0.0 : temperature;
  }

  public double pressureOrZero() {
    return pressure == null ? 0.0 : pressure;
  }

  public double flowOrZero() {
    return flow == null ? 0.0 : flow;
  }
}
