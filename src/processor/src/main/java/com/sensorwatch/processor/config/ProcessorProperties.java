package com.sensorwatch.processor.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the processor service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code processor.*} prefix.
 */
@ConfigurationProperties(prefix = "processor")
public class ProcessorProperties {
  private final Redis redis = new Redis();
  private final Batch batch = new Batch();
  private final Ollama ollama = new Ollama();

  public Redis getRedis() {
    return redis;
  }

  public Batch getBatch() {
    return batch;
  }

  public Ollama getOllama() {
    return ollama;
  }

  /** Redis key names shared with the ingester and dashboard. */
  public static class Redis {
    private String eventsKey = "sensorwatch:events";
    private String unprocessedIndexKey = "sensorwatch:events:unprocessed";
    private String summariesKey = "sensorwatch:summaries";
    private String summaryIndexKey = "sensorwatch:summaries:by_start";

    public String getEventsKey() {
      return eventsKey;
    }

    public void setEventsKey(String eventsKey) {
      this.eventsKey = eventsKey;
    }

    public String getUnprocessedIndexKey() {
      return unprocessedIndexKey;
    }

    public void setUnprocessedIndexKey(String unprocessedIndexKey) {
      this.unprocessedIndexKey = unprocessedIndexKey;
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

  /** Batch tick cadence and store paging. */
  public static class Batch {
    private long intervalMs = 30_000;
    private int pageSize = 250;

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getPageSize() {
      return pageSize;
    }

    public void setPageSize(int pageSize) {
      this.pageSize = pageSize;
    }
  }

  /** Ollama endpoint used for summary generation and health probing. */
  public static class Ollama {
    private String baseUrl = "http://localhost:11434";
    private String model = "llama3.2";
    private double temperature = 0.1;
    private Duration timeout = Duration.ofSeconds(120);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration healthTimeout = Duration.ofSeconds(2);
    private String promptResource = "prompts/anomaly-summary.txt";

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getHealthTimeout() {
      return healthTimeout;
    }

    public void setHealthTimeout(Duration healthTimeout) {
      this.healthTimeout = healthTimeout;
    }

    public String getPromptResource() {
      return promptResource;
    }

    public void setPromptResource(String promptResource) {
      this.promptResource = promptResource;
    }
  }
}
