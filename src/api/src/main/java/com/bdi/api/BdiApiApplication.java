package com.bdi.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot entrypoint for the aircraft telemetry service.
 *
 * <p>The service runs the ingestion pipeline on a schedule and exposes read endpoints over the
 * persisted records, plus control endpoints to trigger or cancel ingestion.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BdiApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(BdiApiApplication.class, args);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "bdi.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
