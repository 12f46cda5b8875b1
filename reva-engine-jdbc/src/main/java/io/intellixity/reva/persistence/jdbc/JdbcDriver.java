package io.intellixity.reva.persistence.jdbc;

import io.intellixity.reva.persistence.connection.Driver;
import io.intellixity.reva.persistence.exec.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JDBC {@link Driver}: opens a {@link JdbcRunner} per pooled connection.\n
 *
 * Blocking JDBC calls run on {@link #executor()}, never on the subscriber's thread. When the driver creates its own
 * executor, or is handed a data source it owns, {@link #close()} disposes them.\n
 */
public final class JdbcDriver implements Driver {
  private static final Logger log = LoggerFactory.getLogger(JdbcDriver.class);

  private final String id;
  private final DataSource dataSource;
  private final String schema;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final AutoCloseable ownedDataSource;
  private final AtomicInteger runnerSeq = new AtomicInteger();
  private volatile boolean closed;

  /** Driver over an application-managed data source; the driver owns only its executor. */
  public JdbcDriver(String id, DataSource dataSource, String schema) {
    this(id, dataSource, schema, null, null);
  }

  /**
   * @param executor executor for blocking calls; null creates a driver-owned cached pool\n
   * @param ownedDataSource closed together with the driver (usually the pool behind {@code dataSource}); may be null\n
   */
  public JdbcDriver(String id,
                    DataSource dataSource,
                    String schema,
                    ExecutorService executor,
                    AutoCloseable ownedDataSource) {
    this.id = Objects.requireNonNull(id, "id");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.ownsExecutor = (executor == null);
    this.executor = ownsExecutor ? Executors.newCachedThreadPool(daemonThreads(id)) : executor;
    this.ownedDataSource = ownedDataSource;
  }

  @Override public String id() { return id; }
  public String schema() { return schema; }
  public ExecutorService executor() { return executor; }
  public boolean isClosed() { return closed; }

  @Override
  public CompletionStage<Runner> createRunner() {
    if (closed) return CompletableFuture.failedFuture(new IllegalStateException("Driver " + id + " is closed"));
    return CompletableFuture.supplyAsync(this::openRunner, executor);
  }

  private Runner openRunner() {
    Connection c;
    try {
      c = dataSource.getConnection();
    } catch (SQLException e) {
      throw new JdbcExecutionException("Could not obtain a connection for driver " + id, e);
    }
    try {
      if (schema != null) c.setSchema(schema);
    } catch (SQLException e) {
      JdbcExecutionException failure = new JdbcExecutionException("Could not set schema '" + schema + "'", e);
      try {
        c.close();
      } catch (SQLException closeError) {
        failure.addSuppressed(closeError);
      }
      throw failure;
    }
    String runnerId = id + "-" + runnerSeq.incrementAndGet();
    log.debug("reva.jdbc op=OPEN runnerId={} schema={}", runnerId, schema);
    return new JdbcRunner(runnerId, c, executor);
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    log.debug("reva.jdbc op=CLOSE driverId={}", id);
    if (ownsExecutor) executor.shutdown();
    if (ownedDataSource != null) {
      try {
        ownedDataSource.close();
      } catch (Exception e) {
        throw new IllegalStateException("Failed to close data source of driver " + id, e);
      }
    }
  }

  private static ThreadFactory daemonThreads(String id) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "reva-jdbc-" + id + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
