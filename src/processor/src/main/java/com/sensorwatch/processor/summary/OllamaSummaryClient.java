package com.sensorwatch.processor.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.processor.config.ProcessorProperties;
import com.sensorwatch.processor.model.GroupedBatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Summary generator backed by a local Ollama server ({@code POST /api/generate}, non-streaming).
 *
 * <p>The prompt template is read once from the classpath; {@code {anomaly_json}} is replaced with
 * the pretty-printed batch payload.
 */
@Component
public class OllamaSummaryClient implements SummaryGenerator {
  private static final Logger log = LoggerFactory.getLogger(OllamaSummaryClient.class);
  static final String PAYLOAD_PLACEHOLDER = "{anomaly_json}";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ProcessorProperties.Ollama settings;
  private final String promptTemplate;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter errorCounter;
  private final Counter timeoutCounter;

  public OllamaSummaryClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      ProcessorProperties properties,
      MeterRegistry meterRegistry) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.settings = properties.getOllama();
    this.promptTemplate = loadTemplate(settings.getPromptResource());
    this.requestTimer = meterRegistry.timer("processor.summary.request.duration");
    this.successCounter = meterRegistry.counter("processor.summary.requests", "outcome", "success");
    this.errorCounter = meterRegistry.counter("processor.summary.requests", "outcome", "error");
    this.timeoutCounter = meterRegistry.counter("processor.summary.requests", "outcome", "timeout");
  }

  @Override
  public String generate(GroupedBatch batch) {
    HttpRequest request = HttpRequest.newBuilder(URI.create(trimSlash(settings.getBaseUrl()) + "/api/generate"))
        .timeout(settings.getTimeout())
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody(batch), StandardCharsets.UTF_8))
        .build();

    long start = System.nanoTime();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        errorCounter.increment();
        throw new SummaryGenerationException("Ollama returned HTTP " + response.statusCode());
      }
      String text = extractText(response.body());
      successCounter.increment();
      log.debug("Ollama summary generated ({} chars)", text.length());
      return text;
    } catch (HttpTimeoutException ex) {
      timeoutCounter.increment();
      throw new SummaryGenerationException("Ollama request timed out after " + settings.getTimeout(), ex);
    } catch (IOException ex) {
      errorCounter.increment();
      throw new SummaryGenerationException("Ollama request failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SummaryGenerationException("Interrupted while waiting for Ollama", ex);
    } finally {
      requestTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
    }
  }

  String buildPrompt(GroupedBatch batch) {
    try {
      String payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(batch.toPromptPayload());
      return promptTemplate.replace(PAYLOAD_PLACEHOLDER, payload);
    } catch (JsonProcessingException ex) {
      throw new SummaryGenerationException("Failed to render anomaly batch", ex);
    }
  }

  private String requestBody(GroupedBatch batch) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", settings.getModel());
    body.put("prompt", buildPrompt(batch));
    body.put("stream", false);
    body.put("options", Map.of("temperature", settings.getTemperature()));
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new SummaryGenerationException("Failed to build Ollama request", ex);
    }
  }

  private String extractText(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      errorCounter.increment();
      throw new SummaryGenerationException("Unreadable Ollama response", ex);
    }
    String text = root == null ? null : root.path("response").asText(null);
    if (text == null || text.isBlank()) {
      errorCounter.increment();
      throw new SummaryGenerationException("Ollama returned an empty summary");
    }
    return text.strip();
  }

  static String trimSlash(String baseUrl) {
    return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  private static String loadTemplate(String resource) {
    try (InputStream in = OllamaSummaryClient.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Prompt template not found on classpath: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read prompt template " + resource, ex);
    }
  }
}
