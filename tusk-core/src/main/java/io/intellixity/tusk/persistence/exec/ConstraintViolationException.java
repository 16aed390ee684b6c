package io.intellixity.tusk.persistence.exec;

/** Integrity constraint violation (SQLSTATE class 23) on an insert or update. */
public final class ConstraintViolationException extends SqlExecutionException {
  public ConstraintViolationException(String message, String sqlState, String sql, Throwable cause) {
    super(message, sqlState, sql, cause);
  }
}
