package io.intellixity.tusk.persistence.exec;

/** A statement failed at the database; wraps the driver's exception. */
public class SqlExecutionException extends RuntimeException {
  private final String sqlState;
  private final String sql;

  public SqlExecutionException(String message, String sqlState, String sql, Throwable cause) {
    super(message, cause);
    this.sqlState = sqlState;
    this.sql = sql;
  }

  /** Five-character SQLSTATE, or {@code null} when the driver did not report one. */
  public String sqlState() { return sqlState; }
  public String sql() { return sql; }
}
