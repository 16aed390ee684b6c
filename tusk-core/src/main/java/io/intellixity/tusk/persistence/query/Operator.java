package io.intellixity.tusk.persistence.query;

import java.util.HashMap;
import java.util.Map;

/**
 * Filter operators, keyed by the token used in shorthand filters ({@code "age__greaterEq"}).
 */
public enum Operator {
  EQUAL("equal", "=", Arity.ONE),
  NOT_EQUAL("notEqual", "!=", Arity.ONE),
  GREATER("greater", ">", Arity.ONE),
  GREATER_EQ("greaterEq", ">=", Arity.ONE),
  LESS("less", "<", Arity.ONE),
  LESS_EQ("lessEq", "<=", Arity.ONE),
  LIKE("like", "LIKE", Arity.ONE),

  IN("in", "IN", Arity.LIST),
  NOT_IN("notIn", "NOT IN", Arity.LIST),

  IS_NULL("isNull", "IS NULL", Arity.NONE),
  IS_NOT_NULL("isNotNull", "IS NOT NULL", Arity.NONE);

  /** How many bind values an operator consumes. */
  public enum Arity { NONE, ONE, LIST }

  private static final Map<String, Operator> BY_TOKEN = new HashMap<>();

  static {
    for (Operator op : values()) BY_TOKEN.put(op.token, op);
  }

  private final String token;
  private final String sql;
  private final Arity arity;

  Operator(String token, String sql, Arity arity) {
    this.token = token;
    this.sql = sql;
    this.arity = arity;
  }

  public String token() { return token; }
  public String sql() { return sql; }
  public Arity arity() { return arity; }

  /** Resolve a shorthand token; unknown tokens are rejected rather than treated as equality. */
  public static Operator fromToken(String token) {
    Operator op = (token == null) ? null : BY_TOKEN.get(token);
    if (op == null) throw new UnknownOperatorException(token);
    return op;
  }
}
