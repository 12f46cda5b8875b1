package io.intellixity.reva.persistence.spi.exec;

import io.intellixity.reva.persistence.exec.QueryResult;
import io.intellixity.reva.persistence.exec.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Template-method base for {@link Runner}s backed by a blocking session (a JDBC connection, a client session...).\n
 *
 * Responsibilities:\n
 * - Run backend hooks off the caller thread, on the supplied {@link Executor}, one at a time\n
 * - Track transaction state so that misuse fails the returned stage instead of reaching the backend\n
 * - Roll back a transaction that is still open when the runner is released\n
 *
 * Subclasses implement the {@code do*} hooks and may throw unchecked exceptions from them; those fail the stage.\n
 */
public abstract class AbstractRunner implements Runner {
  private static final Logger log = LoggerFactory.getLogger(AbstractRunner.class);

  private enum TxPhase { NONE, ACTIVE }

  private final String id;
  private final Executor executor;
  private final Object sessionLock = new Object();
  private final AtomicReference<TxPhase> tx = new AtomicReference<>(TxPhase.NONE);
  private volatile boolean released;

  protected AbstractRunner(String id, Executor executor) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
    this.id = id;
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /** Execute one statement on the session. */
  protected abstract QueryResult doQuery(String sql);

  /** Open a transaction on the session (paired with {@link #doCommit()} or {@link #doRollback()}). */
  protected abstract void doBegin();

  protected abstract void doCommit();

  protected abstract void doRollback();

  /** Give the session back to the backend (close it / return it to its pool). */
  protected abstract void doRelease();

  @Override
  public final String id() {
    return id;
  }

  @Override
  public final boolean isTransactionActive() {
    return tx.get() == TxPhase.ACTIVE;
  }

  @Override
  public final boolean isReleased() {
    return released;
  }

  @Override
  public final CompletionStage<QueryResult> query(String sql) {
    Objects.requireNonNull(sql, "sql");
    return run("query", () -> {
      ensureOpen("query");
      if (log.isDebugEnabled()) {
        log.debug("reva.runner op=query runnerId={} tx={} sql={}", id, isTransactionActive(), abbreviate(sql));
      }
      return doQuery(sql);
    });
  }

  @Override
  public final CompletionStage<Void> beginTransaction() {
    return run("begin", () -> {
      ensureOpen("begin a transaction");
      if (tx.get() == TxPhase.ACTIVE) throw new IllegalStateException("Transaction already active on runner " + id);
      doBegin();
      tx.set(TxPhase.ACTIVE);
      log.debug("reva.runner op=begin runnerId={}", id);
      return null;
    });
  }

  @Override
  public final CompletionStage<Void> commitTransaction() {
    return run("commit", () -> {
      ensureOpen("commit");
      if (tx.get() != TxPhase.ACTIVE) throw new IllegalStateException("No active transaction on runner " + id);
      // a failed commit leaves the transaction open, so the caller can still roll it back
      doCommit();
      tx.set(TxPhase.NONE);
      log.debug("reva.runner op=commit runnerId={}", id);
      return null;
    });
  }

  @Override
  public final CompletionStage<Void> rollbackTransaction() {
    return run("rollback", () -> {
      ensureOpen("roll back");
      if (tx.get() != TxPhase.ACTIVE) throw new IllegalStateException("No active transaction on runner " + id);
      try {
        doRollback();
      } finally {
        tx.set(TxPhase.NONE);
      }
      log.debug("reva.runner op=rollback runnerId={}", id);
      return null;
    });
  }

  @Override
  public final CompletionStage<Void> release() {
    return run("release", () -> {
      if (released) throw new IllegalStateException("Runner " + id + " already released");
      released = true;
      try {
        if (tx.get() == TxPhase.ACTIVE) {
          log.warn("reva.runner releasing runnerId={} with an open transaction; rolling back", id);
          try {
            doRollback();
          } finally {
            tx.set(TxPhase.NONE);
          }
        }
      } finally {
        doRelease();
      }
      log.debug("reva.runner op=release runnerId={}", id);
      return null;
    });
  }

  private <T> CompletionStage<T> run(String op, Supplier<T> body) {
    try {
      return CompletableFuture.supplyAsync(() -> {
        synchronized (sessionLock) {
          return body.get();
        }
      }, executor);
    } catch (RuntimeException e) {
      // executor rejected the task
      log.debug("reva.runner op={} runnerId={} rejected: {}", op, id, e.toString());
      return CompletableFuture.failedFuture(e);
    }
  }

  private void ensureOpen(String what) {
    if (released) throw new IllegalStateException("Cannot " + what + ": runner " + id + " is released");
  }

  private static String abbreviate(String sql) {
    String s = sql.strip().replaceAll("\\s+", " ");
    return s.length() <= 200 ? s : s.substring(0, 200) + "...";
  }
}
