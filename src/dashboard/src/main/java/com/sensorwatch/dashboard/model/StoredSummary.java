package com.sensorwatch.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredSummary(
    @JsonProperty("id") String id,
    @JsonProperty("window_start_ms") long windowStartMs,
    @JsonProperty("window_end_ms") long windowEndMs,
    @JsonProperty("count") int count,
    @JsonProperty("summary") String summary) {}
