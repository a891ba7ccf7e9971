package com.acme.orchestrator;

import io.micronaut.runtime.Micronaut;

/**
 * Worker Application - Executes registered activities through the resilience pipeline, stores
 * their telemetry and receives OTLP data pushed by other services.
 */
public class WorkerApplication {
  public static void main(String[] args) {
    Micronaut.run(WorkerApplication.class, args);
  }
}
