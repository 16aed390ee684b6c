package io.intellixity.tusk.persistence.query;

import java.util.*;

/**
 * Parses the shorthand filter call shapes into a {@link QueryElement} tree.\n
 *
 * <ul>
 *   <li>{@code Map}: {@code "field(__operator)?" -> value}, all entries AND-ed</li>
 *   <li>{@code List<Map>}: each map is an AND group, groups are OR-ed</li>
 * </ul>
 *
 * The operator suffix is everything after the last {@code "__"}; a key without one means {@code equal}.
 */
public final class FilterSpecs {
  public static final String OPERATOR_SEPARATOR = "__";

  private FilterSpecs() {}

  public static LogicalGroup parse(Map<String, ?> spec) {
    if (spec == null || spec.isEmpty()) return new LogicalGroup(Clause.AND, List.of());
    List<QueryElement> leaves = new ArrayList<>(spec.size());
    for (Map.Entry<String, ?> e : spec.entrySet()) {
      leaves.add(parseEntry(e.getKey(), e.getValue()));
    }
    return new LogicalGroup(Clause.AND, leaves);
  }

  public static LogicalGroup parse(List<? extends Map<String, ?>> anyOf) {
    if (anyOf == null || anyOf.isEmpty()) return new LogicalGroup(Clause.OR, List.of());
    List<QueryElement> groups = new ArrayList<>(anyOf.size());
    for (Map<String, ?> m : anyOf) groups.add(parse(m));
    return new LogicalGroup(Clause.OR, groups);
  }

  /** Accepts either call shape (or an already-built element). */
  @SuppressWarnings("unchecked")
  public static QueryElement parseAny(Object spec) {
    if (spec == null) return null;
    if (spec instanceof QueryElement qe) return qe;
    if (spec instanceof Map<?, ?> m) return parse((Map<String, ?>) m);
    if (spec instanceof List<?> list) {
      List<Map<String, ?>> groups = new ArrayList<>(list.size());
      for (Object o : list) {
        if (!(o instanceof Map<?, ?> gm)) {
          throw new QueryValidationException("Filter list entries must be maps, got: " + (o == null ? "null" : o.getClass().getName()));
        }
        groups.add((Map<String, ?>) gm);
      }
      return parse(groups);
    }
    throw new QueryValidationException("Unsupported filter shape: " + spec.getClass().getName());
  }

  static Condition parseEntry(String key, Object value) {
    if (key == null || key.isBlank()) throw new InvalidFilterException(String.valueOf(key), "blank filter key");
    int idx = key.lastIndexOf(OPERATOR_SEPARATOR);
    if (idx < 0) return Condition.of(key, Operator.EQUAL, value);

    String field = key.substring(0, idx);
    String token = key.substring(idx + OPERATOR_SEPARATOR.length());
    if (field.isBlank()) throw new InvalidFilterException(key, "missing field name before operator");
    return Condition.of(field, Operator.fromToken(token), value);
  }
}
