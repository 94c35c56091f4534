package com.sensorwatch.dashboard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.dashboard.config.DashboardProperties;
import com.sensorwatch.dashboard.model.AnomalyEventItem;
import com.sensorwatch.dashboard.model.AnomalyListResponse;
import com.sensorwatch.dashboard.model.StoredAnomalyEvent;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Reads anomaly-bearing events from the time-scored anomaly index, newest first.
 */
@Service
public class AnomalyQueryService {
  private static final Logger log = LoggerFactory.getLogger(AnomalyQueryService.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final DashboardProperties properties;
  private final Timer readTimer;

  public AnomalyQueryService(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, DashboardProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.readTimer = Metrics.timer("dashboard.anomalies.read.duration");
  }

  /**
   * Builds the {@code GET /api/anomalies} payload.
   *
   * @param rawDuration trailing window in seconds, absent for no cutoff
   */
  public AnomalyListResponse listRecent(String rawDuration) {
    Duration duration = QueryParser.parseDurationSeconds(rawDuration);
    List<AnomalyEventItem> items = readTimer.record(() -> findRecentAnomalies(duration)).stream()
        .map(AnomalyEventItem::from)
        .toList();
    return new AnomalyListResponse(
        items,
        items.size(),
        duration == null ? null : duration.getSeconds(),
        Instant.now().toString());
  }

  /**
   * Returns anomaly events with {@code timestamp >= now - duration}, newest first. Pages through
   * the index until a short page. Redis failures are logged and yield an empty list.
   */
  public List<StoredAnomalyEvent> findRecentAnomalies(Duration duration) {
    String indexKey = properties.getRedis().getAnomalyIndexKey();
    int pageSize = Math.max(1, properties.getApi().getPageSize());
    double minScore = duration == null
        ? Double.NEGATIVE_INFINITY
        : Instant.now().minus(duration).toEpochMilli();

    List<StoredAnomalyEvent> results = new ArrayList<>();
    try {
      long offset = 0;
      while (true) {
        Set<String> ids = redisTemplate.opsForZSet()
            .reverseRangeByScore(indexKey, minScore, Double.POSITIVE_INFINITY, offset, pageSize);
        if (ids == null || ids.isEmpty()) {
          break;
        }
        results.addAll(load(ids));
        if (ids.size() < pageSize) {
          break;
        }
        offset += pageSize;
      }
    } catch (DataAccessException ex) {
      log.warn("Failed to read anomalies from {}: {}", indexKey, ex.getMessage());
      return List.of();
    }
    return results;
  }

  private List<StoredAnomalyEvent> load(Set<String> ids) {
    List<Object> keys = new ArrayList<>(ids);
    List<Object> documents = redisTemplate.opsForHash().multiGet(properties.getRedis().getEventsKey(), keys);
    List<StoredAnomalyEvent> events = new ArrayList<>(keys.size());
    for (Object raw : documents) {
      if (raw == null) {
        continue;
      }
      try {
        events.add(objectMapper.readValue(raw.toString(), StoredAnomalyEvent.class));
      } catch (JsonProcessingException ex) {
        log.warn("Skipping unreadable event document: {}", ex.getOriginalMessage());
      }
    }
    return events;
  }
}
