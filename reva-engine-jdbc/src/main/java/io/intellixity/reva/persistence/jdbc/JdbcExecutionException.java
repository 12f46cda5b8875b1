package io.intellixity.reva.persistence.jdbc;

import java.sql.SQLException;

/** Unchecked wrapper for {@link SQLException}s raised by the JDBC engine. */
public final class JdbcExecutionException extends RuntimeException {
  public JdbcExecutionException(String message, SQLException cause) {
    super(message + ": " + cause.getMessage(), cause);
  }

  /** SQLSTATE of the underlying failure, may be null. */
  public String sqlState() {
    return ((SQLException) getCause()).getSQLState();
  }

  public int errorCode() {
    return ((SQLException) getCause()).getErrorCode();
  }
}
