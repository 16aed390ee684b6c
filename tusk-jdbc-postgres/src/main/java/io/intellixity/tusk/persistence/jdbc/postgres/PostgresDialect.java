package io.intellixity.tusk.persistence.jdbc.postgres;

import io.intellixity.tusk.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.tusk.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tusk.persistence.jdbc.dialect.JdbcDialect;

import java.util.List;
import java.util.Set;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  private static final Set<String> CAST_TARGETS = Set.of("boolean", "integer");

  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    return PostgresQuoting.quoteIdentIfNeeded(ident);
  }

  @Override
  public String quoteLiteral(String value) {
    return PostgresQuoting.quoteLiteral(value);
  }

  @Override
  protected String quoteTable(String table) {
    return PostgresQuoting.quoteQualified(table);
  }

  @Override
  public String columnType(String typeId) {
    return PostgresTypeMapping.columnType(typeId);
  }

  @Override
  public boolean sameType(String declaredType, String liveType) {
    return PostgresTypeMapping.sameType(declaredType, liveType);
  }

  @Override
  protected void appendPage(StringBuilder sql, Integer limit, Integer offset) {
    if (limit != null) sql.append(" LIMIT ").append(limit);
    if (offset != null) sql.append(" OFFSET ").append(offset);
  }

  @Override
  protected String castClause(String column, String fromType, String toType) {
    if (!PostgresTypeMapping.isCharacterType(fromType)) return "";
    if (!CAST_TARGETS.contains(PostgresTypeMapping.canonical(toType))) return "";
    return " USING " + quoteIdent(column) + "::" + toType;
  }

  @Override
  protected ExecKind insertExecKind(List<String> returningColumns) {
    if (returningColumns == null || returningColumns.isEmpty()) return ExecKind.UPDATE;
    return ExecKind.QUERY;
  }

  @Override
  protected String applyInsertReturning(String insertSql, List<String> returningColumns) {
    if (returningColumns == null || returningColumns.isEmpty()) return insertSql;
    List<String> ret = returningColumns.stream().map(this::quoteIdent).toList();
    return insertSql + " RETURNING " + String.join(", ", ret);
  }
}
