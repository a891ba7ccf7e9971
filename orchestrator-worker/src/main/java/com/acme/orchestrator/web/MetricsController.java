package com.acme.orchestrator.web;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;

/** Prometheus scrape endpoint. */
@Controller
public class MetricsController {

  static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

  private final PrometheusMeterRegistry registry;

  public MetricsController(PrometheusMeterRegistry registry) {
    this.registry = registry;
  }

  @Get("/metrics")
  @Produces(PROMETHEUS_CONTENT_TYPE)
  public String scrape() {
    return registry.scrape();
  }
}
