package com.sensorwatch.processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot entrypoint for the processor service.
 *
 * <p>The processor periodically collects unprocessed anomalies from Redis, asks the language model
 * for an incident summary, stores it and marks the anomalies as processed.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ProcessorApplication {
  /**
   * Starts the processor application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(ProcessorApplication.class, args);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "processor.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
