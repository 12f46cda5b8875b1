package io.intellixity.reva.persistence.jdbc;

import io.intellixity.reva.persistence.exec.QueryResult;
import io.intellixity.reva.persistence.spi.exec.AbstractRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Runner over one JDBC {@link Connection}, checked out of the driver's pool for the runner's lifetime.\n
 *
 * Outside a transaction the connection runs in auto-commit mode; {@link #beginTransaction()} switches it off until
 * commit or rollback.\n
 */
public final class JdbcRunner extends AbstractRunner {
  private static final Logger log = LoggerFactory.getLogger(JdbcRunner.class);

  private final Connection conn;

  JdbcRunner(String id, Connection conn, Executor executor) {
    super(id, executor);
    this.conn = Objects.requireNonNull(conn, "conn");
  }

  @Override
  protected QueryResult doQuery(String sql) {
    long start = System.nanoTime();
    try (Statement st = conn.createStatement()) {
      QueryResult result;
      if (st.execute(sql)) {
        try (ResultSet rs = st.getResultSet()) {
          List<Map<String, Object>> rows = JdbcRows.read(rs);
          result = QueryResult.ofRows(rows);
        }
      } else {
        result = QueryResult.ofUpdateCount(st.getUpdateCount());
      }
      debugDone("QUERY", start, result.hasRows() ? "rows=" + result.rows().size() : "updated=" + result.updateCount());
      return result;
    } catch (SQLException e) {
      throw new JdbcExecutionException("Statement failed on runner " + id(), e);
    }
  }

  @Override
  protected void doBegin() {
    try {
      conn.setAutoCommit(false);
    } catch (SQLException e) {
      throw new JdbcExecutionException("Begin failed on runner " + id(), e);
    }
  }

  @Override
  protected void doCommit() {
    long start = System.nanoTime();
    try {
      conn.commit();
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      throw new JdbcExecutionException("Commit failed on runner " + id(), e);
    }
    debugDone("COMMIT", start, "ok");
  }

  @Override
  protected void doRollback() {
    long start = System.nanoTime();
    try {
      try {
        conn.rollback();
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new JdbcExecutionException("Rollback failed on runner " + id(), e);
    }
    debugDone("ROLLBACK", start, "ok");
  }

  @Override
  protected void doRelease() {
    try {
      conn.close();
    } catch (SQLException e) {
      throw new JdbcExecutionException("Closing connection failed on runner " + id(), e);
    }
  }

  private void debugDone(String op, long startNanos, String result) {
    if (!log.isDebugEnabled()) return;
    log.debug("reva.jdbc op={} runnerId={} durationMs={} result={}",
        op, id(), (System.nanoTime() - startNanos) / 1_000_000.0, result);
  }
}
