package com.sensorwatch.dashboard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.dashboard.config.DashboardProperties;
import com.sensorwatch.dashboard.model.StoredSummary;
import com.sensorwatch.dashboard.model.SummaryItem;
import com.sensorwatch.dashboard.model.SummaryListResponse;
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
 * Reads the most recent incident summaries ordered by window start, newest first.
 */
@Service
public class SummaryQueryService {
  private static final Logger log = LoggerFactory.getLogger(SummaryQueryService.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final DashboardProperties properties;

  public SummaryQueryService(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, DashboardProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public SummaryListResponse listRecent(String rawLimit) {
    DashboardProperties.Api api = properties.getApi();
    int limit = QueryParser.parseLimit(rawLimit, api.getDefaultSummaryLimit(), api.getMaxSummaryLimit());
    List<SummaryItem> items = recent(limit).stream().map(SummaryItem::from).toList();
    return new SummaryListResponse(items, items.size(), limit, Instant.now().toString());
  }

  /**
   * Returns up to {@code limit} summaries. Pages hold {@code min(limit, pageSize)} entries and
   * reading stops once the limit is reached or a short page comes back.
   */
  public List<StoredSummary> recent(int limit) {
    String indexKey = properties.getRedis().getSummaryIndexKey();
    int perPage = Math.max(1, Math.min(limit, properties.getApi().getPageSize()));

    List<StoredSummary> results = new ArrayList<>();
    try {
      long offset = 0;
      while (results.size() < limit) {
        Set<String> ids = redisTemplate.opsForZSet()
            .reverseRangeByScore(indexKey, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, offset, perPage);
        if (ids == null || ids.isEmpty()) {
          break;
        }
        results.addAll(load(ids));
        if (ids.size() < perPage) {
          break;
        }
        offset += perPage;
      }
    } catch (DataAccessException ex) {
      log.warn("Failed to read summaries from {}: {}", indexKey, ex.getMessage());
      return List.of();
    }
    return results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
  }

  private List<StoredSummary> load(Set<String> ids) {
    List<Object> documents =
        redisTemplate.opsForHash().multiGet(properties.getRedis().getSummariesKey(), new ArrayList<>(ids));
    List<StoredSummary> summaries = new ArrayList<>(ids.size());
    for (Object raw : documents) {
      if (raw == null) {
        continue;
      }
      try {
        summaries.add(objectMapper.readValue(raw.toString(), StoredSummary.class));
      } catch (JsonProcessingException ex) {
        log.warn("Skipping unreadable summary document: {}", ex.getOriginalMessage());
      }
    }
    return summaries;
  }
}
