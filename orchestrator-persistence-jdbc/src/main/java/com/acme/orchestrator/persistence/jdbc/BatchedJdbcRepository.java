package com.acme.orchestrator.persistence.jdbc;

import com.acme.orchestrator.config.StorageConfig;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-behind buffer in front of a JDBC table using Template Method pattern. Subclasses provide
 * the insert statement and parameter binding.
 *
 * <p>Pending rows are guarded by a single lock. A flush holds that lock for the whole transaction,
 * so concurrent writers wait rather than observe a half-flushed batch. Rows leave the buffer only
 * after the transaction commits; a failed flush rolls back and keeps every row pending for the next
 * attempt.
 *
 * <p>The data source is borrowed, not owned: {@link #close()} leaves it open.
 */
public abstract class BatchedJdbcRepository<T> implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(BatchedJdbcRepository.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 10;

  protected final DataSource dataSource;

  private final int batchSize;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<T> pending = new ArrayList<>();
  private final ScheduledExecutorService flusher;
  private volatile boolean closed;

  protected BatchedJdbcRepository(DataSource dataSource, StorageConfig config) {
    this(dataSource, config.getBatchSize(), config.getFlushInterval());
  }

  protected BatchedJdbcRepository(DataSource dataSource, int batchSize, Duration flushInterval) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
    }
    if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive, was " + flushInterval);
    }
    this.dataSource = dataSource;
    this.batchSize = batchSize;
    this.flusher =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, getTableName() + "-flusher");
              t.setDaemon(true);
              return t;
            });
    long intervalMs = flushInterval.toMillis();
    flusher.scheduleWithFixedDelay(this::timedFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /** Sets the parameters of a prepared statement. */
  @FunctionalInterface
  protected interface ParameterBinder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  /** Converts the current row of a result set. */
  @FunctionalInterface
  protected interface RowMapper<R> {
    R map(ResultSet rs) throws SQLException;
  }

  /** Table this repository writes to; used for log messages and thread names. */
  protected abstract String getTableName();

  protected abstract String getInsertSql();

  protected abstract void bindInsert(PreparedStatement ps, T row) throws SQLException;

  /**
   * Appends a row to the pending batch and flushes synchronously once the batch is full.
   *
   * @throws IllegalStateException if the repository has been closed
   */
  protected void append(T row) {
    if (row == null) {
      throw new IllegalArgumentException("row must not be null");
    }
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("Repository for " + getTableName() + " is closed");
      }
      pending.add(row);
      if (pending.size() >= batchSize) {
        flushLocked();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Inserts every pending row in one transaction. */
  public void flush() {
    lock.lock();
    try {
      flushLocked();
    } finally {
      lock.unlock();
    }
  }

  public int pendingCount() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops the flush timer, waits for a running tick to finish, then flushes what is still pending.
   * Later writes are rejected. Calling close again has no effect.
   */
  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
    } finally {
      lock.unlock();
    }

    flusher.shutdown();
    try {
      if (!flusher.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        LOG.warn("Flush timer for {} did not stop in time", getTableName());
        flusher.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      flusher.shutdownNow();
    }

    flush();
    LOG.info("Closed {} repository", getTableName());
  }

  /** Runs a query against flushed rows only; pending rows are not visible. */
  protected <R> List<R> query(
      String sql, ParameterBinder binder, RowMapper<R> mapper, String operation) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      binder.bind(ps);
      List<R> results = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
      }
      return results;
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, operation, LOG);
    }
  }

  protected int update(String sql, ParameterBinder binder, String operation) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      binder.bind(ps);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, operation, LOG);
    }
  }

  protected static Timestamp cutoff(Duration age) {
    if (age == null || age.isNegative()) {
      throw new IllegalArgumentException("age must be zero or positive, was " + age);
    }
    return Timestamp.from(Instant.now().minus(age));
  }

  protected static void requirePositive(int value, String name) {
    if (value < 1) {
      throw new IllegalArgumentException(name + " must be >= 1, was " + value);
    }
  }

  private void timedFlush() {
    try {
      flush();
    } catch (Exception e) {
      LOG.error(
          "Periodic flush of {} failed, {} rows kept pending", getTableName(), pendingCount(), e);
    }
  }

  private void flushLocked() {
    if (pending.isEmpty()) {
      return;
    }
    int size = pending.size();
    try (Connection conn = dataSource.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try (PreparedStatement ps = conn.prepareStatement(getInsertSql())) {
        for (T row : pending) {
          bindInsert(ps, row);
          ps.addBatch();
        }
        ps.executeBatch();
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(conn);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(
          e, "flush " + size + " rows to " + getTableName(), LOG);
    }
    pending.clear();
    LOG.debug("Flushed {} rows to {}", size, getTableName());
  }

  private void rollback(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      LOG.warn("Rollback of {} batch failed", getTableName(), e);
    }
  }
}
