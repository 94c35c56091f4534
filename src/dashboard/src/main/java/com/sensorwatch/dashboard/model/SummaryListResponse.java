package com.sensorwatch.dashboard.model;

import java.util.List;

/**
 * Response contract for {@code GET /api/summaries}.
 *
 * @param items summaries, newest window first
 * @param count number of returned items
 * @param limit applied limit
 * @param timestamp response generation timestamp
 */
public record SummaryListResponse(
    List<SummaryItem> items,
    int count,
    int limit,
    String timestamp) {}
