package io.intellixity.tusk.persistence.query;

public final class UnknownOperatorException extends QueryValidationException {
  private final String token;

  public UnknownOperatorException(String token) {
    super("Unknown filter operator '" + token + "'");
    this.token = token;
  }

  public String token() { return token; }
}
