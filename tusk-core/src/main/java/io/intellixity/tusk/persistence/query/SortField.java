package io.intellixity.tusk.persistence.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  /** Prefix marking a descending sort entry, e.g. {@code "-created"}. */
  public static final char DESC_MARKER = '-';

  public SortField {
    Objects.requireNonNull(field, "field");
    if (field.isBlank()) throw new IllegalArgumentException("sort field must not be blank");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public static SortField parse(String entry) {
    Objects.requireNonNull(entry, "entry");
    String e = entry.trim();
    if (!e.isEmpty() && e.charAt(0) == DESC_MARKER) return desc(e.substring(1));
    return asc(e);
  }

  /** Shorthand form; inverse of {@link #parse(String)}. */
  public String toSpec() {
    return direction == Direction.DESC ? DESC_MARKER + field : field;
  }
}
