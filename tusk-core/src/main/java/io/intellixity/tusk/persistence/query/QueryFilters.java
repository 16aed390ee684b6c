package io.intellixity.tusk.persistence.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String field, Object value) { return Condition.of(field, Operator.EQUAL, value); }
  public static Condition ne(String field, Object value) { return Condition.of(field, Operator.NOT_EQUAL, value); }
  public static Condition gt(String field, Object value) { return Condition.of(field, Operator.GREATER, value); }
  public static Condition ge(String field, Object value) { return Condition.of(field, Operator.GREATER_EQ, value); }
  public static Condition lt(String field, Object value) { return Condition.of(field, Operator.LESS, value); }
  public static Condition le(String field, Object value) { return Condition.of(field, Operator.LESS_EQ, value); }

  public static Condition in(String field, Collection<?> values) { return Condition.of(field, Operator.IN, values); }
  public static Condition notIn(String field, Collection<?> values) { return Condition.of(field, Operator.NOT_IN, values); }

  public static Condition like(String field, Object value) { return Condition.of(field, Operator.LIKE, value); }

  public static Condition isNull(String field) { return Condition.of(field, Operator.IS_NULL, null); }
  public static Condition isNotNull(String field) { return Condition.of(field, Operator.IS_NOT_NULL, null); }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }
}
