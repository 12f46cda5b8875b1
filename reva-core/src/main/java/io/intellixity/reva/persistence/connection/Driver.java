package io.intellixity.reva.persistence.connection;

import io.intellixity.reva.persistence.exec.Runner;

import java.util.concurrent.CompletionStage;

/**
 * Backend descriptor for a {@link Connection}: knows how to open runners against one physical store.\n
 *
 * Example:\n
 * - JDBC: wraps a pooled {@code javax.sql.DataSource}; each runner holds one borrowed {@code java.sql.Connection}\n
 */
public interface Driver extends AutoCloseable {
  /** Unique identifier for this driver (useful for logging). */
  String id();

  /** Open a new runner. The caller owns it until it is released. */
  CompletionStage<Runner> createRunner();

  /** Dispose backend resources owned by this driver (pools, executors). */
  @Override
  void close();
}
