package io.intellixity.tusk.persistence.jdbc.dialect;

import io.intellixity.tusk.persistence.jdbc.QueryPlan;
import io.intellixity.tusk.persistence.jdbc.SqlStatement;
import io.intellixity.tusk.persistence.jdbc.schema.MigrationStatement;
import io.intellixity.tusk.persistence.query.Query;
import io.intellixity.tusk.persistence.schema.ColumnTypeMapper;
import io.intellixity.tusk.persistence.schema.SchemaDiff;

import java.util.List;
import java.util.Map;

/**
 * Dialect for JDBC engines (statement rendering only).\n
 *
 * Everything here is pure: no method touches a connection.
 */
public interface JdbcDialect extends ColumnTypeMapper {
  String id();

  QueryPlan compileSelect(String table, String primaryKey, Query query);

  /**
   * Positional form of {@link #compileSelect(String, String, Query)}.\n
   *
   * @param predicate a shorthand map, a list of shorthand maps, or a built {@code QueryElement}
   * @param orderBy   column names, {@code "-col"} for descending
   */
  QueryPlan compileSelect(String table, String primaryKey, List<String> projection, Object predicate,
                          List<String> orderBy, Integer limit, Integer offset, boolean distinct);

  /** {@code SELECT COUNT(1)} over the filtered select; ordering and paging are ignored. */
  SqlStatement compileCount(String table, Query query);

  /** DDL for a diff, in execution order: renames, additions, type changes, removals. */
  List<MigrationStatement> renderMigration(String table, SchemaDiff diff);

  SqlStatement renderInsert(String table, Map<String, Object> values, List<String> returning);

  SqlStatement renderUpdate(String table, String primaryKey, Object id, Map<String, Object> sets);

  SqlStatement renderDelete(String table, String primaryKey, Object id);

  String quoteIdent(String ident);

  String quoteLiteral(String value);
}
