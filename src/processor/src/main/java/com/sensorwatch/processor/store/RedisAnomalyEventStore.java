package com.sensorwatch.processor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.processor.config.ProcessorProperties;
import com.sensorwatch.processor.model.StoredEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Reads unprocessed anomaly events and flips them to processed.
 *
 * <p>The unprocessed index is a sorted set scored by event time, so ascending range reads return
 * the backlog oldest first. Reads are paged and accumulated until a short page comes back.
 */
@Component
public class RedisAnomalyEventStore {
  private static final Logger log = LoggerFactory.getLogger(RedisAnomalyEventStore.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ProcessorProperties properties;

  public RedisAnomalyEventStore(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ProcessorProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Returns every anomaly event not yet covered by a summary, ascending by timestamp.
   *
   * <p>Store failures are logged and reported as an empty backlog.
   */
  public List<StoredEvent> findUnprocessedAnomalies() {
    String indexKey = properties.getRedis().getUnprocessedIndexKey();
    int pageSize = Math.max(1, properties.getBatch().getPageSize());
    // Keyed by id: concurrent inserts shift offsets, so a page may repeat ids already read.
    Map<String, StoredEvent> results = new LinkedHashMap<>();
    try {
      long offset = 0;
      while (true) {
        Set<String> ids = redisTemplate.opsForZSet()
            .rangeByScore(indexKey, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, offset, pageSize);
        if (ids == null || ids.isEmpty()) {
          break;
        }
        for (StoredEvent event : load(ids)) {
          results.putIfAbsent(event.id(), event);
        }
        if (ids.size() < pageSize) {
          break;
        }
        offset += pageSize;
      }
    } catch (DataAccessException ex) {
      log.warn("Failed to read unprocessed anomalies from {}: {}", indexKey, ex.getMessage());
      return List.of();
    }
    return new ArrayList<>(results.values());
  }

  /**
   * Rewrites each event with {@code processed=true} and drops it from the unprocessed index.
   * Marking an already processed event is a no-op in effect.
   */
  public void markProcessed(List<StoredEvent> events) {
    String eventsKey = properties.getRedis().getEventsKey();
    String indexKey = properties.getRedis().getUnprocessedIndexKey();
    for (StoredEvent event : events) {
      redisTemplate.opsForHash().put(eventsKey, event.id(), toJson(event.markedProcessed()));
      redisTemplate.opsForZSet().remove(indexKey, event.id());
    }
    log.debug("Marked {} anomaly events as processed", events.size());
  }

  private List<StoredEvent> load(Set<String> ids) {
    List<Object> keys = new ArrayList<>(ids);
    List<Object> documents = redisTemplate.opsForHash().multiGet(properties.getRedis().getEventsKey(), keys);
    List<StoredEvent> events = new ArrayList<>(ids.size());
    for (int i = 0; i < keys.size(); i++) {
      Object raw = documents == null || i >= documents.size() ? null : documents.get(i);
      if (raw == null) {
        log.warn("Unprocessed index references missing event {}", keys.get(i));
        continue;
      }
      StoredEvent event = fromJson(raw.toString());
      if (event != null && !event.processed()) {
        events.add(event);
      }
    }
    return events;
  }

  private StoredEvent fromJson(String json) {
    try {
      return objectMapper.readValue(json, StoredEvent.class);
    } catch (JsonProcessingException ex) {
      log.warn("Skipping unreadable event document: {}", ex.getOriginalMessage());
      return null;
    }
  }

  private String toJson(StoredEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize event " + event.id(), ex);
    }
  }
}
