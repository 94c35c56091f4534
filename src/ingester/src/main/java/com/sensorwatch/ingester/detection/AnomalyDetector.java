package com.sensorwatch.ingester.detection;

import com.sensorwatch.ingester.time.Timestamps;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-sensor streaming detector for dropout, spike and drift anomalies.
 *
 * <p>State is kept per {@code sensor_id} and created on first sight of a sensor. Calls for
 * different sensors never contend; calls for the same sensor are serialized on that sensor's
 * state so the dropout and drift timers see a consistent history.
 *
 * <p>Dropout is raised once per gap. Drift keeps firing on every event while the temperature
 * stays elevated past the sustain threshold.
 */
@Component
public class AnomalyDetector {
  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  static final double DROPOUT_GAP_SECONDS = 10.0;
  static final double PRESSURE_SPIKE_BAR = 4.0;
  static final double FLOW_SPIKE_LITERS_PER_MINUTE = 120.0;
  static final double DRIFT_TEMPERATURE_CELSIUS = 38.0;
  static final double DRIFT_SUSTAIN_SECONDS = 15.0;

  private final ConcurrentHashMap<String, DetectorState> states = new ConcurrentHashMap<>();

  /**
   * Runs one event through the sensor's state machine.
   *
   * @param event telemetry sample; {@code sensor_id} is required
   * @return anomalies raised by this event, empty when the timestamp cannot be parsed
   */
  public DetectionResult process(SensorEvent event) {
    String sensorId = Objects.requireNonNull(event.sensorId(), "sensor_id is required");

    Instant eventTime;
    try {
      eventTime = Timestamps.parse(event.timestamp());
    } catch (DateTimeParseException ex) {
      // Malformed events neither trigger nor reset dropout/drift tracking.
      log.error("Invalid timestamp {}: {}", event.timestamp(), ex.getMessage());
      return DetectionResult.none();
    }

    DetectorState state = states.computeIfAbsent(sensorId, id -> new DetectorState());
    synchronized (state) {
      return evaluate(event, sensorId, eventTime, state);
    }
  }

  /** Number of sensors seen since startup. */
  public int trackedSensorCount() {
    return states.size();
  }

  private DetectionResult evaluate(
      SensorEvent event, String sensorId, Instant eventTime, DetectorState state) {
    List<Anomaly> anomalies = new ArrayList<>();
    String timestamp = event.timestamp();

    if (state.lastEventTime != null) {
      double gapSeconds = secondsBetween(state.lastEventTime, eventTime);
      if (gapSeconds > DROPOUT_GAP_SECONDS) {
        anomalies.add(Anomaly.dropout(timestamp, sensorId, gapSeconds));
      }
    }
    state.lastEventTime = eventTime;

    double pressure = event.pressureOrZero();
    double flow = event.flowOrZero();
    if (pressure > PRESSURE_SPIKE_BAR) {
      anomalies.add(Anomaly.pressureSpike(timestamp, sensorId, pressure));
    }
    if (flow > FLOW_SPIKE_LITERS_PER_MINUTE) {
      anomalies.add(Anomaly.flowSpike(timestamp, sensorId, flow));
    }

    double temperature = event.temperatureOrZero();
    if (temperature > DRIFT_TEMPERATURE_CELSIUS) {
      if (state.driftStartTime == null) {
        state.driftStartTime = eventTime;
      } else {
        double driftSeconds = secondsBetween(state.driftStartTime, eventTime);
        if (driftSeconds > DRIFT_SUSTAIN_SECONDS) {
          anomalies.add(Anomaly.drift(timestamp, sensorId, temperature, driftSeconds));
        }
      }
    } else {
      state.driftStartTime = null;
    }

    return DetectionResult.of(anomalies);
  }

  private static double secondsBetween(Instant from, Instant to) {
    // Gaps may exceed the nanosecond range of a long.
    Duration gap = Duration.between(from, to);
    return gap.getSeconds() + gap.getNano() / 1_000_000_000.0;
  }

  /** Mutable timers for one sensor. Guarded by its own monitor. */
  private static final class DetectorState {
    private Instant lastEventTime;
    private Instant driftStartTime;
  }
}
