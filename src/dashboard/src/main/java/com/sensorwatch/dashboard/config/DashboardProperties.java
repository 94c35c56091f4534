package com.sensorwatch.dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the dashboard API service.
 *
 * <p>Values are bound from {@code dashboard.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "dashboard")
public class DashboardProperties {
  private final Redis redis = new Redis();
  private final Api api = new Api();

  public Redis getRedis() {
    return redis;
  }

  public Api getApi() {
    return api;
  }

  /** Redis keys written by the ingester and processor. */
  public static class Redis {
    private String eventsKey = "sensorwatch:events";
    private String anomalyIndexKey = "sensorwatch:events:anomalies";
    private String summariesKey = "sensorwatch:summaries";
    private String summaryIndexKey = "sensorwatch:summaries:by_start";

    public String getEventsKey() {
      return eventsKey;
    }

    public void setEventsKey(String eventsKey) {
      this.eventsKey = eventsKey;
    }

    public String getAnomalyIndexKey() {
      return anomalyIndexKey;
    }

    public void setAnomalyIndexKey(String anomalyIndexKey) {
      this.anomalyIndexKey = anomalyIndexKey;
    }

    public String getSummariesKey() {
      return summariesKey;
    }

    public void setSummariesKey(String summariesKey) {
      this.summariesKey = summariesKey;
    }

    public String getSummaryIndexKey() {
      return summaryIndexKey;
    }

    public void setSummaryIndexKey(String summaryIndexKey) {
      this.summaryIndexKey = summaryIndexKey;
    }
  }

  /** Query limits and store paging. */
  public static class Api {
    private int pageSize = 250;
    private int defaultSummaryLimit = 10;
    private int maxSummaryLimit = 1000;

    public int getPageSize() {
      return pageSize;
    }

    public void setPageSize(int pageSize) {
      this.pageSize = pageSize;
    }

    public int getDefaultSummaryLimit() {
      return defaultSummaryLimit;
    }

    public void setDefaultSummaryLimit(int defaultSummaryLimit) {
      this.defaultSummaryLimit = defaultSummaryLimit;
    }

    public int getMaxSummaryLimit() {
      return maxSummaryLimit;
    }

    public void setMaxSummaryLimit(int maxSummaryLimit) {
      this.maxSummaryLimit = maxSummaryLimit;
    }
  }
}
