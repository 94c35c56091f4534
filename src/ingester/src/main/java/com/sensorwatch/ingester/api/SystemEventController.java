package com.sensorwatch.ingester.api;

import com.sensorwatch.ingester.detection.SensorEvent;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion boundary for sensor telemetry.
 *
 * <p>{@code POST /system_event} answers with the stored document, or with a
 * {@code {"message": "No timestamp provided"}} sentinel when nothing was persisted. Failures are
 * rendered as {@code {"error": "..."}} by {@link IngestExceptionHandler}.
 */
@RestController
public class SystemEventController {
  static final String NO_TIMESTAMP_MESSAGE = "No timestamp provided";

  private final SystemEventService systemEventService;

  public SystemEventController(SystemEventService systemEventService) {
    this.systemEventService = systemEventService;
  }

  @PostMapping(path = "/system_event", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Object> systemEvent(@RequestBody SensorEvent event) {
    if (event.sensorId() == null || event.sensorId().isBlank()) {
      throw new BadRequestException("sensor_id is required");
    }
    return systemEventService.ingest(event)
        .<ResponseEntity<Object>>map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.ok(Map.of("message", NO_TIMESTAMP_MESSAGE)));
  }
}
