package io.intellixity.tusk.persistence.query;

/** Malformed predicate for a specific field, e.g. a scalar value given to {@code in}. */
public final class InvalidFilterException extends QueryValidationException {
  private final String field;

  public InvalidFilterException(String field, String message) {
    super("Invalid filter on field '" + field + "': " + message);
    this.field = field;
  }

  public String field() { return field; }
}
