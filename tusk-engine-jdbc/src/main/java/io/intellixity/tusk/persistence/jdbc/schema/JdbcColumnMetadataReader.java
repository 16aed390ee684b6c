package io.intellixity.tusk.persistence.jdbc.schema;

import io.intellixity.tusk.persistence.exec.SqlExecutor;
import io.intellixity.tusk.persistence.schema.ColumnInfo;
import io.intellixity.tusk.persistence.schema.ColumnMetadataReader;

import java.util.*;

/**
 * Reads live columns from {@code information_schema.columns}, in ordinal order.
 * <p>
 * Lookups are scoped to one schema: the table's own qualifier, else the configured schema, else
 * {@code current_schema()}.
 */
public final class JdbcColumnMetadataReader implements ColumnMetadataReader {
  static final String BASE_SQL =
      "SELECT column_name, data_type FROM information_schema.columns WHERE table_name = $1";

  private final SqlExecutor executor;
  private final String defaultSchema;

  public JdbcColumnMetadataReader(SqlExecutor executor, String defaultSchema) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.defaultSchema = (defaultSchema == null || defaultSchema.isBlank()) ? null : defaultSchema;
  }

  public JdbcColumnMetadataReader(SqlExecutor executor) {
    this(executor, null);
  }

  @Override
  public List<ColumnInfo> listColumns(String table) {
    Objects.requireNonNull(table, "table");
    String schema = defaultSchema;
    String name = table;
    int dot = table.lastIndexOf('.');
    if (dot > 0) {
      schema = table.substring(0, dot);
      name = table.substring(dot + 1);
    }

    List<Object> params = new ArrayList<>();
    params.add(name);
    StringBuilder sql = new StringBuilder(BASE_SQL);
    if (schema != null) {
      sql.append(" AND table_schema = $2");
      params.add(schema);
    } else {
      sql.append(" AND table_schema = current_schema()");
    }
    sql.append(" ORDER BY ordinal_position");

    List<ColumnInfo> out = new ArrayList<>();
    for (Map<String, Object> row : executor.fetch(null, sql.toString(), params)) {
      Object col = value(row, "column_name");
      Object type = value(row, "data_type");
      if (col == null || type == null) continue;
      out.add(new ColumnInfo(String.valueOf(col), String.valueOf(type)));
    }
    return out;
  }

  private static Object value(Map<String, Object> row, String label) {
    Object v = row.get(label);
    if (v != null) return v;
    for (Map.Entry<String, Object> e : row.entrySet()) {
      if (e.getKey() != null && e.getKey().equalsIgnoreCase(label)) return e.getValue();
    }
    return null;
  }
}
