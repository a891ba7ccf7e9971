package com.acme.orchestrator.persistence.jdbc.mapper;

import com.acme.orchestrator.core.Jsons;
import com.acme.orchestrator.telemetry.LogLevel;
import com.acme.orchestrator.telemetry.LogRecord;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/** Maps between {@link LogRecord} and rows of the {@code logs} table. */
public class LogRecordMapper {

  private LogRecordMapper() {}

  /** Binds every column except {@code id} in table order, then {@code raw_json}. */
  public static void bindInsert(PreparedStatement ps, LogRecord log) throws SQLException {
    ps.setTimestamp(1, Timestamp.from(log.timestamp()));
    ps.setString(2, log.level().value());
    ps.setString(3, log.traceId());
    ps.setString(4, log.spanId());
    ps.setString(5, log.orchestrationId());
    ps.setString(6, log.activity());
    ps.setString(7, log.message());
    ps.setLong(8, log.durationMs());
    ps.setString(9, log.inputHash());
    ps.setString(10, log.outputHash());
    ps.setString(11, log.errorMessage());
    ps.setString(12, log.errorHash());
    ps.setString(13, Jsons.toJson(log));
  }

  public static LogRecord toRecord(ResultSet rs) throws SQLException {
    Timestamp timestamp = rs.getTimestamp("timestamp");
    return new LogRecord(
        rs.getLong("id"),
        timestamp.toInstant(),
        LogLevel.parse(rs.getString("level")),
        rs.getString("trace_id"),
        rs.getString("span_id"),
        rs.getString("orchestration_id"),
        rs.getString("activity"),
        rs.getString("message"),
        rs.getLong("duration_ms"),
        rs.getString("input_hash"),
        rs.getString("output_hash"),
        rs.getString("error_message"),
        rs.getString("error_hash"));
  }
}
