package com.acme.orchestrator.persistence.jdbc.mapper;

import com.acme.orchestrator.telemetry.EventType;
import com.acme.orchestrator.telemetry.TelemetryEvent;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/** Maps between {@link TelemetryEvent} and rows of the {@code task_events} table. */
public class TelemetryEventMapper {

  private TelemetryEventMapper() {}

  public static void bindInsert(PreparedStatement ps, TelemetryEvent event) throws SQLException {
    ps.setTimestamp(1, Timestamp.from(event.timestamp()));
    ps.setString(2, event.traceId());
    ps.setString(3, event.spanId());
    ps.setString(4, event.orchestrationId());
    ps.setString(5, event.eventType().value());
    ps.setString(6, event.activity());
    ps.setString(7, event.payload());
  }

  public static TelemetryEvent toEvent(ResultSet rs) throws SQLException {
    return new TelemetryEvent(
        rs.getLong("id"),
        rs.getTimestamp("timestamp").toInstant(),
        rs.getString("trace_id"),
        rs.getString("span_id"),
        rs.getString("orchestration_id"),
        EventType.fromValue(rs.getString("event_type")),
        rs.getString("activity"),
        rs.getString("payload"));
  }
}
