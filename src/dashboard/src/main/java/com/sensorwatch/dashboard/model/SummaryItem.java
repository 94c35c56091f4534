package com.sensorwatch.dashboard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorwatch.dashboard.time.Timestamps;

/**
 * Incident summary as returned by {@code GET /api/summaries}.
 *
 * @param windowStart ISO-8601 time of the oldest summarized record
 * @param windowEnd ISO-8601 time of the newest summarized record
 * @param count number of anomaly records folded into the summary
 */
public record SummaryItem(
    @JsonProperty("id") String id,
    @JsonProperty("window_start") String windowStart,
    @JsonProperty("window_end") String windowEnd,
    @JsonProperty("count") int count,
    @JsonProperty("summary") String summary) {

  public static SummaryItem from(StoredSummary stored) {
    return new SummaryItem(
        stored.id(),
        Timestamps.fromEpochMillis(stored.windowStartMs()),
        Timestamps.fromEpochMillis(stored.windowEndMs()),
        stored.count(),
        stored.summary());
  }
}
