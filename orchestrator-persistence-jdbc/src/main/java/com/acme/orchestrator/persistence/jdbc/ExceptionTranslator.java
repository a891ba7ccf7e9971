package com.acme.orchestrator.persistence.jdbc;

import com.acme.orchestrator.core.ClassifiedException;
import com.acme.orchestrator.core.PermanentException;
import com.acme.orchestrator.core.TransientException;
import java.sql.SQLException;
import java.util.Locale;
import org.slf4j.Logger;

/**
 * Utility class for translating SQLException to classified exceptions.
 * Determines whether an exception is permanent (non-retryable) or transient (retryable).
 */
public class ExceptionTranslator {

  public static final String STORAGE_TRANSIENT = "STORAGE_TRANSIENT";
  public static final String STORAGE_PERMANENT = "STORAGE_PERMANENT";
  public static final String STORAGE_ERROR = "STORAGE_ERROR";

  private ExceptionTranslator() {
    // Utility class - no instantiation
  }

  /**
   * Translates a SQLException to either PermanentException or TransientException.
   *
   * @param originalException The SQLException that occurred
   * @param operation Description of the operation that failed
   * @param logger Logger for error reporting
   * @return PermanentException for non-retryable errors, TransientException for retryable ones
   */
  public static ClassifiedException translateException(
      SQLException originalException, String operation, Logger logger) {

    logger.error("Database operation failed: {}", operation, originalException);

    if (isTransientError(originalException)) {
      return new TransientException(
          STORAGE_TRANSIENT,
          String.format(
              "Transient database error during %s: %s",
              operation, originalException.getMessage()),
          originalException);
    }

    if (isPermanentError(originalException)) {
      return new PermanentException(
          STORAGE_PERMANENT,
          String.format(
              "Permanent database error during %s: %s",
              operation, originalException.getMessage()),
          originalException);
    }

    // Default to TransientException when in doubt
    return new TransientException(
        STORAGE_ERROR,
        String.format("Database error during %s: %s", operation, originalException.getMessage()),
        originalException);
  }

  /**
   * Transient errors include connection failures, lock and busy timeouts, deadlocks and pool
   * exhaustion.
   */
  private static boolean isTransientError(SQLException exception) {
    if (exception == null) {
      return false;
    }

    String message = lowerCaseMessage(exception);
    String sqlState = exception.getSQLState();

    if (message.contains("timeout")
        || message.contains("connection refused")
        || message.contains("deadlock")
        || message.contains("database is locked")
        || message.contains("sqlite_busy")
        || message.contains("too many connections")
        || message.contains("pool exhausted")) {
      return true;
    }

    if (sqlState != null) {
      // 08xxx - Connection Exception
      // 40xxx - Transaction Rollback
      if (sqlState.startsWith("08") || sqlState.startsWith("40")) {
        return true;
      }
      // 57P03 - Cannot connect now
      if (sqlState.equals("57P03")) {
        return true;
      }
    }

    return isDatabaseSpecificTransient(exception);
  }

  /**
   * Permanent errors include missing tables or columns, constraint violations, syntax errors and
   * type mismatches.
   */
  private static boolean isPermanentError(SQLException exception) {
    if (exception == null) {
      return false;
    }

    String message = lowerCaseMessage(exception);
    String sqlState = exception.getSQLState();

    if (message.contains("syntax error")
        || message.contains("no such table")
        || message.contains("no such column")
        || message.contains("does not exist")
        || message.contains("constraint failed")
        || message.contains("constraint violation")
        || message.contains("unique constraint")
        || message.contains("foreign key")
        || message.contains("type mismatch")
        || message.contains("invalid column")) {
      return true;
    }

    if (sqlState != null) {
      // 22xxx - Data Exception
      // 23xxx - Integrity Constraint Violation
      // 42xxx - Syntax Error / Access Violation
      // 3Dxxx - Invalid Catalog Name
      // 3Fxxx - Invalid Schema Name
      if (sqlState.startsWith("22")
          || sqlState.startsWith("23")
          || sqlState.startsWith("42")
          || sqlState.startsWith("3D")
          || sqlState.startsWith("3F")) {
        return true;
      }
    }

    return isDatabaseSpecificPermanent(exception);
  }

  private static boolean isDatabaseSpecificTransient(SQLException exception) {
    int errorCode = exception.getErrorCode();
    if (errorCode == 0) {
      return false;
    }

    // SQLite: 5 SQLITE_BUSY, 6 SQLITE_LOCKED
    if (errorCode == 5 || errorCode == 6) {
      return true;
    }

    // PostgreSQL vendor codes mirrored from SQL state
    return errorCode == 40001 || errorCode == 8006 || errorCode == 8003;
  }

  private static boolean isDatabaseSpecificPermanent(SQLException exception) {
    int errorCode = exception.getErrorCode();
    if (errorCode == 0) {
      return false;
    }

    // SQLite: 19 SQLITE_CONSTRAINT, 20 SQLITE_MISMATCH
    if (errorCode == 19 || errorCode == 20) {
      return true;
    }

    // PostgreSQL: undefined column, unique violation, foreign key violation
    return errorCode == 42703 || errorCode == 23505 || errorCode == 23503;
  }

  private static String lowerCaseMessage(SQLException exception) {
    String message = exception.getMessage();
    return message == null ? "" : message.toLowerCase(Locale.ROOT);
  }
}
