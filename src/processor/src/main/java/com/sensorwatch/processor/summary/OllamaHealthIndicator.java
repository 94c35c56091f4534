package com.sensorwatch.processor.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.processor.config.ProcessorProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether Ollama is reachable and has the configured model pulled.
 * Exposed as the {@code ollama} health component.
 */
@Component("ollama")
public class OllamaHealthIndicator implements HealthIndicator {
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ProcessorProperties.Ollama settings;

  public OllamaHealthIndicator(HttpClient httpClient, ObjectMapper objectMapper, ProcessorProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.settings = properties.getOllama();
  }

  @Override
  public Health health() {
    String model = settings.getModel();
    HttpRequest request = HttpRequest.newBuilder(
            URI.create(OllamaSummaryClient.trimSlash(settings.getBaseUrl()) + "/api/tags"))
        .timeout(settings.getHealthTimeout())
        .GET()
        .build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        return Health.down().withDetail("model", model).withDetail("status", response.statusCode()).build();
      }
      if (!hasModel(response.body(), model)) {
        return Health.down().withDetail("model", model).withDetail("reason", "model not pulled").build();
      }
      return Health.up().withDetail("model", model).build();
    } catch (IOException ex) {
      return Health.down(ex).withDetail("model", model).build();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return Health.down(ex).withDetail("model", model).build();
    }
  }

  private boolean hasModel(String body, String model) throws IOException {
    JsonNode root = objectMapper.readTree(body);
    for (JsonNode entry : root.path("models")) {
      if (model.equals(entry.path("name").asText()) || model.equals(entry.path("model").asText())) {
        return true;
      }
    }
    return false;
  }
}
