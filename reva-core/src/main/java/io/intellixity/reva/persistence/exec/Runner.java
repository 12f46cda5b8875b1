package io.intellixity.reva.persistence.exec;

import java.util.concurrent.CompletionStage;

/**
 * Handle to one logical database connection.\n
 *
 * A runner executes raw statements and drives at most one transaction at a time. Runners are obtained from a
 * {@link RunnerProvider} and must be handed back to the same provider once the work is done.\n
 */
public interface Runner {
  /** Identifier used in logs. */
  String id();

  /** Execute a raw statement. */
  CompletionStage<QueryResult> query(String sql);

  CompletionStage<Void> beginTransaction();

  CompletionStage<Void> commitTransaction();

  CompletionStage<Void> rollbackTransaction();

  /** True between a successful {@link #beginTransaction()} and the matching commit/rollback. */
  boolean isTransactionActive();

  /** True once the underlying connection has been given back. */
  boolean isReleased();

  /** Give the underlying connection back. Called by providers, not by application code. */
  CompletionStage<Void> release();
}
