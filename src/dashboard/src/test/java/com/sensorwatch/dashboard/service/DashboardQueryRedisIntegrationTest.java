package com.sensorwatch.dashboard.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.dashboard.config.DashboardProperties;
import com.sensorwatch.dashboard.model.AnomalyListResponse;
import com.sensorwatch.dashboard.model.StoredSummary;
import com.sensorwatch.dashboard.model.SummaryListResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class DashboardQueryRedisIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final DashboardProperties properties = new DashboardProperties();
  private StringRedisTemplate redisTemplate;
  private AnomalyQueryService anomalyQueryService;
  private SummaryQueryService summaryQueryService;

  @BeforeAll
  static void setupRedis() {
    RedisStandaloneConfiguration config =
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379));
    connectionFactory = new LettuceConnectionFactory(config);
    connectionFactory.afterPropertiesSet();
  }

  @AfterAll
  static void shutdownRedis() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void clearRedis() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.afterPropertiesSet();
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.serverCommands().flushAll();
    }
    properties.getApi().setPageSize(2);
    anomalyQueryService = new AnomalyQueryService(redisTemplate, objectMapper, properties);
    summaryQueryService = new SummaryQueryService(redisTemplate, objectMapper, properties);
  }

  @Test
  void anomalies_withinWindowNewestFirstAcrossPages() throws Exception {
    long now = Instant.now().toEpochMilli();
    seedEvent("old", now - Duration.ofHours(2).toMillis());
    seedEvent("a", now - 30_000);
    seedEvent("b", now - 20_000);
    seedEvent("c", now - 10_000);
    seedEvent("d", now - 5_000);

    AnomalyListResponse response = anomalyQueryService.listRecent("600");

    assertEquals(List.of("d", "c", "b", "a"),
        response.items().stream().map(item -> item.id()).collect(Collectors.toList()));
    assertEquals(4, response.count());
    assertEquals(600L, response.durationSeconds());
    assertTrue(response.items().get(0).timestamp().endsWith("Z"));
  }

  @Test
  void anomalies_withoutDurationReturnEverything() throws Exception {
    long now = Instant.now().toEpochMilli();
    seedEvent("old", now - Duration.ofDays(3).toMillis());
    seedEvent("new", now - 1_000);

    AnomalyListResponse response = anomalyQueryService.listRecent(null);

    assertEquals(2, response.count());
    assertNull(response.durationSeconds());
  }

  @Test
  void anomalies_renderTimestampAsIsoMicros() throws Exception {
    long ts = Instant.parse("2025-06-01T14:44:45.584Z").toEpochMilli();
    seedEvent("e1", ts);

    AnomalyListResponse response = anomalyQueryService.listRecent(null);

    assertEquals("2025-06-01T14:44:45.584000Z", response.items().get(0).timestamp());
  }

  @Test
  void summaries_limitHonoredAcrossPages() throws Exception {
    long base = Instant.parse("2025-06-01T14:00:00Z").toEpochMilli();
    for (int i = 0; i < 5; i++) {
      seedSummary("s" + i, base + i * 30_000L);
    }

    List<StoredSummary> three = summaryQueryService.recent(3);
    List<StoredSummary> all = summaryQueryService.recent(50);

    assertEquals(List.of("s4", "s3", "s2"), three.stream().map(StoredSummary::id).collect(Collectors.toList()));
    assertEquals(5, all.size());
  }

  @Test
  void summaries_defaultLimitIsTen() throws Exception {
    long base = Instant.parse("2025-06-01T14:00:00Z").toEpochMilli();
    for (int i = 0; i < 12; i++) {
      seedSummary("s" + i, base + i * 30_000L);
    }

    SummaryListResponse response = summaryQueryService.listRecent(null);

    assertEquals(10, response.count());
    assertEquals(10, response.limit());
    assertEquals("s11", response.items().get(0).id());
    assertEquals("2025-06-01T14:05:30.000000Z", response.items().get(0).windowStart());
  }

  private void seedEvent(String id, long timestampMs) throws Exception {
    Map<String, Object> anomaly = Map.of(
        "type", "spike",
        "timestamp", Instant.ofEpochMilli(timestampMs).toString(),
        "sensor_id", "wtf-pipe-1",
        "parameter", "flow",
        "value", 130.0,
        "message", "Flow spike: 130.0 L/min (threshold 120 L/min)");
    Map<String, Object> doc = Map.of(
        "id", id,
        "timestamp", timestampMs,
        "sensor_id", "wtf-pipe-1",
        "temperature", 20.0,
        "pressure", 2.0,
        "flow", 130.0,
        "is_anomaly", true,
        "anomalies", List.of(anomaly),
        "processed", false);
    redisTemplate.opsForHash().put(properties.getRedis().getEventsKey(), id, objectMapper.writeValueAsString(doc));
    redisTemplate.opsForZSet().add(properties.getRedis().getAnomalyIndexKey(), id, timestampMs);
  }

  private void seedSummary(String id, long startMs) throws Exception {
    Map<String, Object> doc = Map.of(
        "id", id,
        "window_start_ms", startMs,
        "window_end_ms", startMs + 25_000,
        "count", 2,
        "summary", "Summary " + id);
    redisTemplate.opsForHash().put(properties.getRedis().getSummariesKey(), id, objectMapper.writeValueAsString(doc));
    redisTemplate.opsForZSet().add(properties.getRedis().getSummaryIndexKey(), id, startMs);
  }
}
