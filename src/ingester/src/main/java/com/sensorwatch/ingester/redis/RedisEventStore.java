package com.sensorwatch.ingester.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.ingester.config.IngesterProperties;
import com.sensorwatch.ingester.detection.DetectionResult;
import com.sensorwatch.ingester.detection.SensorEvent;
import com.sensorwatch.ingester.time.Timestamps;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Write path of the event store.
 *
 * <p>Every event lands in the events hash. Anomaly-bearing events are additionally indexed in two
 * sorted sets scored by timestamp: one for all anomalies and one for those not yet summarized.
 */
@Component
public class RedisEventStore {
  private static final Logger log = LoggerFactory.getLogger(RedisEventStore.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final IngesterProperties properties;

  public RedisEventStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      IngesterProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Persists an event together with its detection outcome.
   *
   * @param event raw event
   * @param detection detector output for this event
   * @return stored document, or empty when the event carries no timestamp
   * @throws java.time.format.DateTimeParseException when the timestamp is not ISO-8601
   */
  public Optional<StoredEvent> add(SensorEvent event, DetectionResult detection) {
    if (event.timestamp() == null || event.timestamp().isBlank()) {
      return Optional.empty();
    }

    long epochMillis = Timestamps.toEpochMillis(event.timestamp());
    StoredEvent stored = new StoredEvent(
        UUID.randomUUID().toString(),
        epochMillis,
        event.sensorId(),
        event.temperatureOrZero(),
        event.pressureOrZero(),
        event.flowOrZero(),
        detection.isAnomaly(),
        detection.anomalies(),
        false);

    write(stored, serialize(stored));
    if (stored.isAnomaly()) {
      log.debug("Indexed {} anomalies for sensor {}", stored.anomalies().size(), stored.sensorId());
    }
    return Optional.of(stored);
  }

  // Document and index entries go out in one MULTI/EXEC so readers see all of them or none.
  private void write(StoredEvent stored, String document) {
    IngesterProperties.Redis keys = properties.redis();
    redisTemplate.execute(new SessionCallback<List<Object>>() {
      @Override
      @SuppressWarnings("unchecked")
      public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
        RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
        ops.multi();
        ops.opsForHash().put(keys.eventsKey(), stored.id(), document);
        if (stored.isAnomaly()) {
          ops.opsForZSet().add(keys.anomalyIndexKey(), stored.id(), stored.timestamp());
          ops.opsForZSet().add(keys.unprocessedIndexKey(), stored.id(), stored.timestamp());
        }
        return ops.exec();
      }
    });
  }

  private String serialize(StoredEvent stored) {
    try {
      return objectMapper.writeValueAsString(stored);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize event " + stored.id(), ex);
    }
  }
}
