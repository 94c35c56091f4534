package com.sensorwatch.ingester.api;

import com.sensorwatch.ingester.detection.Anomaly;
import com.sensorwatch.ingester.detection.AnomalyDetector;
import com.sensorwatch.ingester.detection.DetectionResult;
import com.sensorwatch.ingester.detection.SensorEvent;
import com.sensorwatch.ingester.redis.RedisEventStore;
import com.sensorwatch.ingester.redis.StoredEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Runs one event through detection and persists the enriched record. */
@Service
public class SystemEventService {
  private static final Logger log = LoggerFactory.getLogger(SystemEventService.class);

  private final AnomalyDetector detector;
  private final RedisEventStore eventStore;
  private final MeterRegistry meterRegistry;
  private final Counter receivedCounter;
  private final Counter storedCounter;
  private final Counter skippedCounter;
  private final Counter errorCounter;
  private final ConcurrentHashMap<String, Counter> anomalyCounters = new ConcurrentHashMap<>();

  public SystemEventService(
      AnomalyDetector detector,
      RedisEventStore eventStore,
      MeterRegistry meterRegistry) {
    this.detector = detector;
    this.eventStore = eventStore;
    this.meterRegistry = meterRegistry;
    this.receivedCounter = meterRegistry.counter("ingester.events.received");
    this.storedCounter = meterRegistry.counter("ingester.events.stored");
    this.skippedCounter = meterRegistry.counter("ingester.events.skipped");
    this.errorCounter = meterRegistry.counter("ingester.events.errors");
    meterRegistry.gauge("ingester.detector.sensors", detector, AnomalyDetector::trackedSensorCount);
  }

  /**
   * Detects anomalies for the event and stores the result.
   *
   * @param event incoming telemetry sample
   * @return stored document, or empty when the event had no timestamp
   */
  public Optional<StoredEvent> ingest(SensorEvent event) {
    receivedCounter.increment();
    try {
      DetectionResult detection = detector.process(event);
      detection.anomalies().forEach(this::recordAnomaly);

      Optional<StoredEvent> stored = eventStore.add(event, detection);
      if (stored.isPresent()) {
        storedCounter.increment();
      } else {
        skippedCounter.increment();
        log.warn("Event from sensor {} has no timestamp, not stored", event.sensorId());
      }
      return stored;
    } catch (RuntimeException ex) {
      errorCounter.increment();
      throw ex;
    }
  }

  private void recordAnomaly(Anomaly anomaly) {
    String type = anomaly.type().wireName();
    Counter counter = anomalyCounters.computeIfAbsent(
        type,
        t -> meterRegistry.counter("ingester.anomalies.detected", "type", t));
    counter.increment();
  }
}
