package com.sensorwatch.ingester.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sensorwatch.ingester.detection.Anomaly;
import com.sensorwatch.ingester.detection.AnomalyType;
import com.sensorwatch.ingester.detection.SensorEvent;
import com.sensorwatch.ingester.redis.StoredEvent;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = SystemEventController.class)
class SystemEventControllerTest {
  private static final String EVENT = """
      {
        "timestamp": "2025-06-01T14:44:50Z",
        "sensor_id": "wtf-pipe-1",
        "temperature": 22.0,
        "pressure": 2.0,
        "flow": 130.0
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockBean private SystemEventService systemEventService;

  @Test
  void systemEvent_returnsStoredDocument() throws Exception {
    Anomaly spike = new Anomaly(
        AnomalyType.SPIKE,
        "2025-06-01T14:44:50Z",
        "wtf-pipe-1",
        "flow",
        130.0,
        null,
        "Flow spike: 130.0 L/min (threshold 120 L/min)");
    StoredEvent stored = new StoredEvent(
        "evt-1", 1_748_789_090_000L, "wtf-pipe-1", 22.0, 2.0, 130.0, true, List.of(spike), false);
    when(systemEventService.ingest(any(SensorEvent.class))).thenReturn(Optional.of(stored));

    mockMvc.perform(post("/system_event").contentType(MediaType.APPLICATION_JSON).content(EVENT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("evt-1"))
        .andExpect(jsonPath("$.timestamp").value(1_748_789_090_000L))
        .andExpect(jsonPath("$.is_anomaly").value(true))
        .andExpect(jsonPath("$.processed").value(false))
        .andExpect(jsonPath("$.anomalies[0].type").value("spike"))
        .andExpect(jsonPath("$.anomalies[0].parameter").value("flow"))
        .andExpect(jsonPath("$.anomalies[0].value").value(130.0));
  }

  @Test
  void systemEvent_returnsSentinelWhenNothingStored() throws Exception {
    when(systemEventService.ingest(any(SensorEvent.class))).thenReturn(Optional.empty());

    mockMvc.perform(post("/system_event")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"sensor_id\":\"wtf-pipe-1\",\"flow\":50.0}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("No timestamp provided"));
  }

  @Test
  void systemEvent_rejectsMissingSensorId() throws Exception {
    mockMvc.perform(post("/system_event")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"timestamp\":\"2025-06-01T14:44:50Z\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("sensor_id is required"));

    verify(systemEventService, never()).ingest(any(SensorEvent.class));
  }

  @Test
  void systemEvent_rejectsMalformedJson() throws Exception {
    mockMvc.perform(post("/system_event").contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("malformed event payload"));
  }

  @Test
  void systemEvent_reportsUnparsableTimestamp() throws Exception {
    when(systemEventService.ingest(any(SensorEvent.class)))
        .thenThrow(new DateTimeParseException("bad", "yesterday", 0));

    mockMvc.perform(post("/system_event").contentType(MediaType.APPLICATION_JSON).content(EVENT))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid timestamp: yesterday"));
  }

  @Test
  void systemEvent_reportsStoreFailureWithoutCrashing() throws Exception {
    when(systemEventService.ingest(any(SensorEvent.class)))
        .thenThrow(new QueryTimeoutException("redis timeout"));

    mockMvc.perform(post("/system_event").contentType(MediaType.APPLICATION_JSON).content(EVENT))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("event store unavailable"));
  }

  @Test
  void systemEvent_reportsUnexpectedFailure() throws Exception {
    when(systemEventService.ingest(any(SensorEvent.class)))
        .thenThrow(new IllegalStateException("boom"));

    mockMvc.perform(post("/system_event").contentType(MediaType.APPLICATION_JSON).content(EVENT))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("boom"));
  }
}
