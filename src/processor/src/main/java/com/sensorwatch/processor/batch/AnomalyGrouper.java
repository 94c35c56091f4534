package com.sensorwatch.processor.batch;

import com.sensorwatch.processor.model.Anomaly;
import com.sensorwatch.processor.model.GroupedBatch;
import com.sensorwatch.processor.model.StoredEvent;
import com.sensorwatch.processor.time.Timestamps;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folds a batch of anomaly events into per-sensor lists.
 *
 * <p>Sensors keep first-seen order and anomalies keep input order within a sensor. Anomalies with
 * an unreadable timestamp stay in their sensor list but do not move the batch bounds.
 */
@Component
public class AnomalyGrouper {
  private static final Logger log = LoggerFactory.getLogger(AnomalyGrouper.class);

  public GroupedBatch group(List<StoredEvent> events) {
    if (events == null || events.isEmpty()) {
      return GroupedBatch.empty();
    }

    Map<String, List<Anomaly>> bySensor = new LinkedHashMap<>();
    Instant first = null;
    Instant last = null;
    for (StoredEvent event : events) {
      List<Anomaly> sensorAnomalies = bySensor.computeIfAbsent(event.sensorId(), id -> new ArrayList<>());
      for (Anomaly anomaly : event.anomalies()) {
        sensorAnomalies.add(anomaly);
        Instant at = parseOrNull(anomaly.timestamp());
        if (at == null) {
          continue;
        }
        if (first == null || at.isBefore(first)) {
          first = at;
        }
        if (last == null || at.isAfter(last)) {
          last = at;
        }
      }
    }
    return new GroupedBatch(bySensor, first, last);
  }

  private static Instant parseOrNull(String timestamp) {
    try {
      return Timestamps.parse(timestamp);
    } catch (DateTimeParseException ex) {
      log.debug("Ignoring anomaly timestamp {} for batch bounds", timestamp);
      return null;
    }
  }
}
