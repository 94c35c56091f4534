package com.sensorwatch.processor.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.processor.config.ProcessorProperties;
import com.sensorwatch.processor.model.SummaryWindow;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Persists generated summaries, indexed by window start for the dashboard. */
@Component
public class RedisSummaryStore {
  private static final Logger log = LoggerFactory.getLogger(RedisSummaryStore.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ProcessorProperties properties;

  public RedisSummaryStore(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ProcessorProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Stores one summary document.
   *
   * @return generated summary id
   */
  public String add(SummaryWindow window) {
    String id = UUID.randomUUID().toString();
    long startMs = window.windowStart().toEpochMilli();
    SummaryDocument document = new SummaryDocument(
        id, startMs, window.windowEnd().toEpochMilli(), window.count(), window.summary());

    String json;
    try {
      json = objectMapper.writeValueAsString(document);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize summary " + id, ex);
    }

    redisTemplate.opsForHash().put(properties.getRedis().getSummariesKey(), id, json);
    redisTemplate.opsForZSet().add(properties.getRedis().getSummaryIndexKey(), id, startMs);
    log.debug("Stored summary {} covering {} records", id, window.count());
    return id;
  }

  record SummaryDocument(
      @JsonProperty("id") String id,
      @JsonProperty("window_start_ms") long windowStart,
      @JsonProperty("window_end_ms") long windowEnd,
      @JsonProperty("count") int count,
      @JsonProperty("summary") String summary) {}
}
