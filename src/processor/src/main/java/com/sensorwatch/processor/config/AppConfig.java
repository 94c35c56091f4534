package com.sensorwatch.processor.config;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(ProcessorProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.getOllama().getConnectTimeout())
        .build();
  }
}
