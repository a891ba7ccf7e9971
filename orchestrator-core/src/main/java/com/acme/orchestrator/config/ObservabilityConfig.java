package com.acme.orchestrator.config;

import com.acme.orchestrator.telemetry.LogLevel;

/**
 * Logging, tracing and telemetry receiver settings. Pure POJO - no framework dependencies.
 *
 * <p>{@code logLevel} is the minimum level persisted to the log store; console verbosity is
 * controlled by the Logback configuration.
 */
public class ObservabilityConfig {

  private String logLevel = "info";
  private boolean tracingEnabled = false;
  private boolean otlpEnabled = true;
  private String otlpHost = "localhost";
  private int otlpPort = 4317;

  public String getLogLevel() {
    return logLevel;
  }

  public void setLogLevel(String logLevel) {
    this.logLevel = logLevel;
  }

  public LogLevel getPersistedLevel() {
    return LogLevel.parse(logLevel);
  }

  public boolean isTracingEnabled() {
    return tracingEnabled;
  }

  public void setTracingEnabled(boolean tracingEnabled) {
    this.tracingEnabled = tracingEnabled;
  }

  public boolean isOtlpEnabled() {
    return otlpEnabled;
  }

  public void setOtlpEnabled(boolean otlpEnabled) {
    this.otlpEnabled = otlpEnabled;
  }

  public String getOtlpHost() {
    return otlpHost;
  }

  public void setOtlpHost(String otlpHost) {
    this.otlpHost = otlpHost;
  }

  public int getOtlpPort() {
    return otlpPort;
  }

  public void setOtlpPort(int otlpPort) {
    this.otlpPort = otlpPort;
  }
}
