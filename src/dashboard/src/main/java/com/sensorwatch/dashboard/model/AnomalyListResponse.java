package com.sensorwatch.dashboard.model;

import java.util.List;

/**
 * Response contract for {@code GET /api/anomalies}.
 *
 * @param items anomaly-bearing events, newest first
 * @param count number of returned items
 * @param durationSeconds applied trailing window, null when unbounded
 * @param timestamp response generation timestamp
 */
public record AnomalyListResponse(
    List<AnomalyEventItem> items,
    int count,
    Long durationSeconds,
    String timestamp) {}
