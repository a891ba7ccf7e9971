package com.acme.orchestrator.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.orchestrator.core.ClassifiedException;
import com.acme.orchestrator.core.ErrorKind;
import com.acme.orchestrator.core.PermanentException;
import com.acme.orchestrator.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tests translation of SQLException to PermanentException or TransientException. */
class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  @Nested
  @DisplayName("Transient Error Detection")
  class TransientErrorTests {

    @Test
    @DisplayName("should return TransientException for connection timeout")
    void testConnectionTimeout() {
      SQLException cause = new SQLException("Connection timeout", "08001");

      ClassifiedException result = ExceptionTranslator.translateException(cause, "connect", logger);

      assertThat(result).isInstanceOf(TransientException.class);
      assertThat(result.getCode()).isEqualTo(ExceptionTranslator.STORAGE_TRANSIENT);
      assertThat(result.getMessage()).containsIgnoringCase("connection timeout");
      assertThat(result.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("should return TransientException when SQLite reports a locked database")
    void testSqliteLocked() {
      SQLException cause =
          new SQLException("[SQLITE_BUSY] The database file is locked (database is locked)");

      ClassifiedException result = ExceptionTranslator.translateException(cause, "flush", logger);

      assertThat(result.getKind()).isEqualTo(ErrorKind.TRANSIENT);
      assertThat(result.getCode()).isEqualTo(ExceptionTranslator.STORAGE_TRANSIENT);
    }

    @ParameterizedTest(name = "vendor code {0}")
    @CsvSource({"5", "6", "40001"})
    @DisplayName("should detect transient vendor codes")
    void testVendorCodes(int vendorCode) {
      SQLException cause = new SQLException("failure", null, vendorCode);

      assertThat(ExceptionTranslator.translateException(cause, "op", logger))
          .isInstanceOf(TransientException.class);
    }

    @ParameterizedTest(name = "SQL state {0}")
    @CsvSource({"08006", "40000", "40P01", "57P03"})
    @DisplayName("should detect transient SQL states")
    void testSqlStates(String sqlState) {
      SQLException cause = new SQLException("failure", sqlState);

      assertThat(ExceptionTranslator.translateException(cause, "op", logger))
          .isInstanceOf(TransientException.class);
    }
  }

  @Nested
  @DisplayName("Permanent Error Detection")
  class PermanentErrorTests {

    @Test
    @DisplayName("should return PermanentException when SQLite reports a missing table")
    void testSqliteMissingTable() {
      SQLException cause =
          new SQLException("[SQLITE_ERROR] SQL error or missing database (no such table: logs)");

      ClassifiedException result =
          ExceptionTranslator.translateException(cause, "flush 3 rows to logs", logger);

      assertThat(result).isInstanceOf(PermanentException.class);
      assertThat(result.getCode()).isEqualTo(ExceptionTranslator.STORAGE_PERMANENT);
      assertThat(result.getMessage())
          .startsWith("STORAGE_PERMANENT: Permanent database error during flush 3 rows to logs");
    }

    @Test
    @DisplayName("should return PermanentException for SQLite constraint code")
    void testSqliteConstraintCode() {
      SQLException cause = new SQLException("abort", null, 19);

      assertThat(ExceptionTranslator.translateException(cause, "insert", logger))
          .isInstanceOf(PermanentException.class);
    }

    @ParameterizedTest(name = "SQL state {0}")
    @CsvSource({"42P01", "42703", "23505", "22001", "3D000", "3F000"})
    @DisplayName("should detect permanent SQL states")
    void testSqlStates(String sqlState) {
      SQLException cause = new SQLException("failure", sqlState);

      assertThat(ExceptionTranslator.translateException(cause, "op", logger))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("should detect syntax errors by message")
    void testSyntaxError() {
      SQLException cause = new SQLException("near \"SELEC\": syntax error");

      assertThat(ExceptionTranslator.translateException(cause, "query", logger))
          .isInstanceOf(PermanentException.class);
    }
  }

  @Nested
  @DisplayName("Default Transient Behavior")
  class DefaultBehaviorTests {

    @Test
    @DisplayName("should fall back to a retryable storage error for unknown failures")
    void testUnknownError() {
      SQLException cause = new SQLException("Unknown database error");

      ClassifiedException result = ExceptionTranslator.translateException(cause, "query", logger);

      assertThat(result).isInstanceOf(TransientException.class);
      assertThat(result.getCode()).isEqualTo(ExceptionTranslator.STORAGE_ERROR);
      assertThat(result.getMessage())
          .isEqualTo("STORAGE_ERROR: Database error during query: Unknown database error");
    }

    @Test
    @DisplayName("should tolerate a missing message")
    void testNullMessage() {
      SQLException cause = new SQLException();

      assertThat(ExceptionTranslator.translateException(cause, "query", logger).isTransient())
          .isTrue();
    }
  }
}
