package com.sensorwatch.ingester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IngesterApplication {
  // Main entrypoint: boots Spring and exposes the telemetry ingestion endpoint.
  public static void main(String[] args) {
    SpringApplication.run(IngesterApplication.class, args);
  }
}
