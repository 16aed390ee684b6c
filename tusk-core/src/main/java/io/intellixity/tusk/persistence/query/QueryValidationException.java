package io.intellixity.tusk.persistence.query;

/**
 * Raised when a Query references invalid/unknown fields or otherwise fails validation.
 * <p>
 * Thrown before any SQL is produced; no partial statement ever escapes a failed compile.
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
