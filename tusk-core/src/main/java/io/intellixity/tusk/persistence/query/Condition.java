package io.intellixity.tusk.persistence.query;

import java.util.Objects;

public final class Condition implements QueryElement {
  private final String field;
  private final Operator operator;
  private final Object value;

  public Condition(String field, Operator operator, Object value) {
    this.field = Objects.requireNonNull(field, "field");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
  }

  public String field() { return field; }
  public Operator operator() { return operator; }
  public Object value() { return value; }

  public static Condition of(String field, Operator operator, Object value) {
    return new Condition(field, operator, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return field.equals(c.field) && operator == c.operator && Objects.equals(value, c.value);
  }

  @Override
  public int hashCode() { return Objects.hash(field, operator, value); }

  @Override
  public String toString() { return field + "__" + operator.token() + "=" + value; }
}
