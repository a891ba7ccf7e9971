package com.acme.orchestrator.telemetry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
  LOG("log"),
  METRIC("metric"),
  TRACE("trace");

  private final String value;

  EventType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static EventType fromValue(String value) {
    for (EventType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown event type: " + value);
  }
}
