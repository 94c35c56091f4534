package com.sensorwatch.processor.summary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.processor.config.ProcessorProperties;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
class OllamaHealthIndicatorTest {
  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private OllamaHealthIndicator indicator;

  @BeforeEach
  void setUp() {
    ProcessorProperties properties = new ProcessorProperties();
    properties.getOllama().setModel("llama3.2:latest");
    indicator = new OllamaHealthIndicator(httpClient, new ObjectMapper(), properties);
  }

  @Test
  @SuppressWarnings("unchecked")
  void upWhenModelIsPulled() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn((HttpResponse<String>) httpResponse);
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("""
        {"models":[{"name":"mistral:latest"},{"name":"llama3.2:latest","model":"llama3.2:latest"}]}
        """);

    Health health = indicator.health();

    assertEquals(Status.UP, health.getStatus());
    assertEquals("llama3.2:latest", health.getDetails().get("model"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void downWhenModelIsMissing() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn((HttpResponse<String>) httpResponse);
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{\"models\":[]}");

    assertEquals(Status.DOWN, indicator.health().getStatus());
  }

  @Test
  @SuppressWarnings("unchecked")
  void downWhenServerUnreachable() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new ConnectException("Connection refused"));

    assertEquals(Status.DOWN, indicator.health().getStatus());
  }
}
