package com.acme.orchestrator.otlp;

import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.KeyValue;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts OTLP attribute values into plain Java values for the JSON payload. */
public final class AttributeValues {

  private AttributeValues() {}

  /**
   * Maps a value to String, Boolean, Long, Double, a base64 String for bytes, a List for arrays or
   * a Map for key-value lists. Unset values map to null.
   */
  public static Object toJava(AnyValue value) {
    if (value == null) {
      return null;
    }
    return switch (value.getValueCase()) {
      case STRING_VALUE -> value.getStringValue();
      case BOOL_VALUE -> value.getBoolValue();
      case INT_VALUE -> value.getIntValue();
      case DOUBLE_VALUE -> value.getDoubleValue();
      case BYTES_VALUE -> Base64.getEncoder().encodeToString(value.getBytesValue().toByteArray());
      case ARRAY_VALUE -> {
        List<Object> values = new ArrayList<>();
        for (AnyValue element : value.getArrayValue().getValuesList()) {
          values.add(toJava(element));
        }
        yield values;
      }
      case KVLIST_VALUE -> toMap(value.getKvlistValue().getValuesList());
      case VALUE_NOT_SET -> null;
    };
  }

  /** Attribute list as an insertion-ordered map. Later duplicates win. */
  public static Map<String, Object> toMap(List<KeyValue> attributes) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (KeyValue attribute : attributes) {
      result.put(attribute.getKey(), toJava(attribute.getValue()));
    }
    return result;
  }

  /** String value of the first attribute named {@code key}, or {@code fallback}. */
  public static String stringValue(List<KeyValue> attributes, String key, String fallback) {
    for (KeyValue attribute : attributes) {
      if (attribute.getKey().equals(key)
          && attribute.getValue().getValueCase() == AnyValue.ValueCase.STRING_VALUE) {
        return attribute.getValue().getStringValue();
      }
    }
    return fallback;
  }
}
