package com.sensorwatch.ingester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingester")
public record IngesterProperties(Redis redis) {
  public record Redis(String eventsKey, String anomalyIndexKey, String unprocessedIndexKey) {}
}
