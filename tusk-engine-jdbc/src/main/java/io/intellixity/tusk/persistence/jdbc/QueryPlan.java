package io.intellixity.tusk.persistence.jdbc;

import io.intellixity.tusk.persistence.query.SortField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled select: full SQL text plus its ordered parameters and the parts it was assembled from.
 * <p>
 * The Nth placeholder in {@link #whereSql()} (and in {@link #sql()}) binds {@code parameters().get(N-1)}.
 * {@link #selectColumns()} always starts with the primary key when one was given, also for a {@code SELECT *}.
 */
public record QueryPlan(String sql,
                        List<String> selectColumns,
                        String whereSql,
                        List<SortField> orderBy,
                        Integer limit,
                        Integer offset,
                        boolean distinct,
                        List<Object> parameters) {
  public QueryPlan {
    selectColumns = List.copyOf(selectColumns == null ? List.of() : selectColumns);
    whereSql = (whereSql == null) ? "" : whereSql;
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    parameters = (parameters == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  public SqlStatement statement() {
    return new SqlStatement(sql, parameters);
  }
}
