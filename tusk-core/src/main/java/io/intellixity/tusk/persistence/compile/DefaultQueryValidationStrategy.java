package io.intellixity.tusk.persistence.compile;

import io.intellixity.tusk.persistence.authoring.RecordShape;
import io.intellixity.tusk.persistence.query.*;

import java.util.List;
import java.util.Objects;

/**
 * Default query validation.\n
 *
 * Validates:\n
 * - filter Condition fields\n
 * - sort fields\n
 * - projection columns\n
 *
 * The primary key is always accepted even when the shape does not declare it as a field.
 * Unknown names throw {@link QueryValidationException}.\n
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(RecordShape shape, Query query) {
    Objects.requireNonNull(shape, "shape");
    if (query == null) return;

    validateElement(shape, query.filter());
    validateSort(shape, query.sort());
    validateProjection(shape, query.projection());
  }

  private static void validateSort(RecordShape shape, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    for (SortField sf : sort) {
      if (sf == null) continue;
      requireColumn(shape, sf.field(), "sort");
    }
  }

  private static void validateProjection(RecordShape shape, List<String> projection) {
    if (projection == null || projection.isEmpty()) return;
    for (String col : projection) requireColumn(shape, col, "projection");
  }

  private static void validateElement(RecordShape shape, QueryElement el) {
    if (el == null) return;

    if (el instanceof LogicalGroup g) {
      for (QueryElement c : g.elements()) validateElement(shape, c);
      return;
    }
    if (el instanceof Condition c) {
      requireColumn(shape, c.field(), "filter");
      return;
    }

    throw new QueryValidationException("Unsupported QueryElement: " + el.getClass().getName());
  }

  private static void requireColumn(RecordShape shape, String column, String usage) {
    if (column == null || column.isBlank()) {
      throw new QueryValidationException("Blank column in " + usage + " for table '" + shape.table() + "'");
    }
    if (column.equals(shape.primaryKey()) || shape.hasField(column)) return;
    throw new QueryValidationException(
        "Unknown column '" + column + "' in " + usage + " for table '" + shape.table() + "'"
    );
  }
}
