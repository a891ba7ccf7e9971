package com.acme.orchestrator.telemetry;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Severity of a persisted log record. Stored in lowercase. */
public enum LogLevel {
  DEBUG("debug"),
  INFO("info"),
  WARN("warn"),
  ERROR("error");

  private final String value;

  LogLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isAtLeast(LogLevel other) {
    return compareTo(other) >= 0;
  }

  /** Parses a level name case-insensitively. Unknown or empty names fall back to {@link #INFO}. */
  public static LogLevel parse(String name) {
    if (name == null || name.isBlank()) {
      return INFO;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (LogLevel level : values()) {
      if (level.value.equals(normalized)) {
        return level;
      }
    }
    return INFO;
  }
}
