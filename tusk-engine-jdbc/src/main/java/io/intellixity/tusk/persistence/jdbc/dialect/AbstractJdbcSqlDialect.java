package io.intellixity.tusk.persistence.jdbc.dialect;

import io.intellixity.tusk.persistence.authoring.FieldSpec;
import io.intellixity.tusk.persistence.authoring.TypeIds;
import io.intellixity.tusk.persistence.jdbc.QueryPlan;
import io.intellixity.tusk.persistence.jdbc.SqlStatement;
import io.intellixity.tusk.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.tusk.persistence.jdbc.schema.MigrationStatement;
import io.intellixity.tusk.persistence.query.*;
import io.intellixity.tusk.persistence.schema.ColumnRename;
import io.intellixity.tusk.persistence.schema.MigrationPhase;
import io.intellixity.tusk.persistence.schema.SchemaDiff;
import io.intellixity.tusk.persistence.schema.TypeChange;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - select/count: projection + QueryElement filter + sort + paging\n
 * - DDL: rename/add/alter type/drop from a SchemaDiff\n
 * - DML: insert/update/delete by primary key\n
 *
 * DB-specific dialects override hooks for quoting, paging, casts and returning.\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Object> params = new ArrayList<>();

    public String add(Object value) {
      params.add(value);
      return "$" + (n++);
    }

    public List<Object> params() { return params; }
  }

  private enum Kind { LEAF, AND, OR }

  private record Rendered(String sql, Kind kind) {
    static final Rendered EMPTY = new Rendered("", Kind.LEAF);

    boolean isEmpty() { return sql.isEmpty(); }
  }

  @Override
  public final QueryPlan compileSelect(String table, String primaryKey, Query query) {
    Objects.requireNonNull(table, "table");
    Query q = (query == null) ? new Query() : query;

    RenderCtx ctx = new RenderCtx();
    List<String> columns = selectColumns(primaryKey, q.projection());
    String where = renderPredicate(q.filter(), ctx);
    Integer limit = positiveOrNull(q.limit());
    Integer offset = positiveOrNull(q.offset());

    StringBuilder sql = new StringBuilder(selectPrefix(table, columns, q.distinct()));
    if (!where.isEmpty()) sql.append(" WHERE ").append(where);
    appendSort(sql, q.sort());
    appendPage(sql, limit, offset);

    // SELECT * still returns the primary key
    List<String> reported = (columns.isEmpty() && primaryKey != null && !primaryKey.isBlank())
        ? List.of(primaryKey) : columns;
    return new QueryPlan(sql.toString(), reported, where, q.sort(), limit, offset, q.distinct(), ctx.params());
  }

  @Override
  public final QueryPlan compileSelect(String table, String primaryKey, List<String> projection, Object predicate,
                                       List<String> orderBy, Integer limit, Integer offset, boolean distinct) {
    Query q = new Query()
        .filterBy(predicate)
        .withProjection(projection)
        .withLimit(limit)
        .withOffset(offset)
        .withDistinct(distinct);
    if (orderBy != null) q.orderBy(orderBy.toArray(new String[0]));
    return compileSelect(table, primaryKey, q);
  }

  @Override
  public final SqlStatement compileCount(String table, Query query) {
    Objects.requireNonNull(table, "table");
    Query q = (query == null) ? new Query() : query;

    RenderCtx ctx = new RenderCtx();
    List<String> columns = q.distinct() ? selectColumns(null, q.projection()) : List.of();
    String where = renderPredicate(q.filter(), ctx);

    StringBuilder inner = new StringBuilder(selectPrefix(table, columns, q.distinct()));
    if (!where.isEmpty()) inner.append(" WHERE ").append(where);
    String sql = "SELECT COUNT(1) FROM (" + inner + ") tusk_count";
    return new SqlStatement(sql, ctx.params());
  }

  private String selectPrefix(String table, List<String> columns, boolean distinct) {
    String cols;
    if (columns.isEmpty()) {
      cols = "*";
    } else {
      List<String> quoted = new ArrayList<>(columns.size());
      for (String c : columns) quoted.add(quoteIdent(c));
      cols = String.join(", ", quoted);
    }
    return "SELECT " + (distinct ? "DISTINCT " : "") + cols + " FROM " + quoteTable(table);
  }

  /** Primary key first, then the requested columns; empty when the projection is empty ({@code *}). */
  protected List<String> selectColumns(String primaryKey, List<String> projection) {
    if (projection == null || projection.isEmpty()) return List.of();
    LinkedHashSet<String> out = new LinkedHashSet<>();
    if (primaryKey != null && !primaryKey.isBlank()) out.add(primaryKey);
    for (String p : projection) {
      if (p == null || p.isBlank()) throw new QueryValidationException("Blank projection column");
      out.add(p);
    }
    return new ArrayList<>(out);
  }

  protected void appendSort(StringBuilder sql, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      parts.add(quoteIdent(sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    sql.append(" ORDER BY ").append(String.join(", ", parts));
  }

  /** Appends paging; both values are either positive or {@code null}. */
  protected abstract void appendPage(StringBuilder sql, Integer limit, Integer offset);

  private static Integer positiveOrNull(Integer v) {
    return (v == null || v <= 0) ? null : v;
  }

  /** Predicate SQL for a filter tree; empty when there is nothing to filter on. */
  protected final String renderPredicate(QueryElement el, RenderCtx ctx) {
    return render(el, ctx).sql();
  }

  private Rendered render(QueryElement el, RenderCtx ctx) {
    if (el == null) return Rendered.EMPTY;

    if (el instanceof LogicalGroup g) {
      List<Rendered> parts = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        Rendered r = render(c, ctx);
        if (!r.isEmpty()) parts.add(r);
      }
      if (parts.isEmpty()) return Rendered.EMPTY;

      if (g.clause() == Clause.OR) {
        List<String> sqls = new ArrayList<>(parts.size());
        for (Rendered r : parts) sqls.add(r.kind() == Kind.OR ? r.sql() : "(" + r.sql() + ")");
        return new Rendered("(" + String.join(" OR ", sqls) + ")", Kind.OR);
      }

      if (parts.size() == 1) return parts.get(0);
      List<String> sqls = new ArrayList<>(parts.size());
      for (Rendered r : parts) sqls.add(r.kind() == Kind.AND ? "(" + r.sql() + ")" : r.sql());
      return new Rendered(String.join(" AND ", sqls), Kind.AND);
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }
    return new Rendered(renderCondition(c, ctx), Kind.LEAF);
  }

  private String renderCondition(Condition c, RenderCtx ctx) {
    String field = c.field();
    if (field == null || field.isBlank()) throw new InvalidFilterException(String.valueOf(field), "blank field name");
    String col = quoteIdent(field);
    Operator op = c.operator();
    Object value = c.value();

    switch (op.arity()) {
      case NONE:
        return col + " " + op.sql();
      case LIST: {
        List<Object> vals = asList(value);
        if (vals == null) {
          throw new InvalidFilterException(field, "operator '" + op.token() + "' requires a list value, got "
              + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        if (vals.isEmpty()) return (op == Operator.IN) ? "FALSE" : "TRUE";
        List<String> ph = new ArrayList<>(vals.size());
        for (Object v : vals) ph.add(ctx.add(v));
        return col + " " + op.sql() + " (" + String.join(", ", ph) + ")";
      }
      default:
        if (asList(value) != null) {
          throw new InvalidFilterException(field, "operator '" + op.token() + "' takes a single value, got a list");
        }
        return col + " " + op.sql() + " " + ctx.add(value);
    }
  }

  /** Collections and non-byte arrays as a list; anything else {@code null}. */
  private static List<Object> asList(Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v != null && v.getClass().isArray() && !(v instanceof byte[])) {
      int n = Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(Array.get(v, i));
      return out;
    }
    return null;
  }

  // ---- DDL ----

  @Override
  public List<MigrationStatement> renderMigration(String table, SchemaDiff diff) {
    Objects.requireNonNull(table, "table");
    if (diff == null || diff.isEmpty()) return List.of();
    String t = "ALTER TABLE " + quoteTable(table);

    List<MigrationStatement> out = new ArrayList<>(diff.size());
    for (ColumnRename r : diff.renames()) {
      out.add(new MigrationStatement(MigrationPhase.RENAME,
          t + " RENAME COLUMN " + quoteIdent(r.from()) + " TO " + quoteIdent(r.to())));
    }
    for (FieldSpec f : diff.additions()) {
      out.add(new MigrationStatement(MigrationPhase.ADD, t + " ADD COLUMN " + columnDefinition(f)));
    }
    for (TypeChange tc : diff.typeChanges()) {
      String sql = t + " ALTER COLUMN " + quoteIdent(tc.column()) + " SET DATA TYPE " + tc.toType()
          + castClause(tc.column(), tc.fromType(), tc.toType());
      out.add(new MigrationStatement(MigrationPhase.ALTER_TYPE, sql));
    }
    for (String c : diff.removals()) {
      out.add(new MigrationStatement(MigrationPhase.DROP, t + " DROP COLUMN " + quoteIdent(c)));
    }
    return out;
  }

  protected String columnDefinition(FieldSpec f) {
    String def = quoteIdent(f.name()) + " " + columnType(f.type());
    if (f.effectiveDefault()) {
      def += " DEFAULT " + defaultLiteral(f.type(), f.defaultValue()) + " NOT NULL";
    }
    return def;
  }

  /**
   * SQL literal for a column default.\n
   *
   * Only numbers and booleans on non-textual types are written bare; everything else is a quoted string.
   */
  protected String defaultLiteral(String typeId, Object value) {
    if (!TypeIds.isTextLike(typeId)) {
      if (value instanceof BigDecimal bd) return bd.toPlainString();
      if (value instanceof Number || value instanceof Boolean) return String.valueOf(value);
    }
    return quoteLiteral(String.valueOf(value));
  }

  /** Conversion suffix for {@code SET DATA TYPE}; empty when the database converts implicitly. */
  protected String castClause(String column, String fromType, String toType) {
    return "";
  }

  // ---- DML ----

  @Override
  public SqlStatement renderInsert(String table, Map<String, Object> values, List<String> returning) {
    if (values == null || values.isEmpty()) throw new IllegalArgumentException("Insert has no columns");
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    for (Map.Entry<String, Object> e : values.entrySet()) {
      cols.add(quoteIdent(e.getKey()));
      ph.add(ctx.add(e.getValue()));
    }
    String sql = "INSERT INTO " + quoteTable(table) +
        " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    sql = applyInsertReturning(sql, returning);
    return new SqlStatement(sql, ctx.params(), insertExecKind(returning));
  }

  /**
   * Decide execution strategy for insert.\n
   *
   * <p>Default is a plain update count. Dialects that implement SQL-level returning (Postgres RETURNING)
   * override to return {@link ExecKind#QUERY} when returning columns were requested.</p>
   */
  protected ExecKind insertExecKind(List<String> returningColumns) {
    return ExecKind.UPDATE;
  }

  protected String applyInsertReturning(String insertSql, List<String> returningColumns) {
    // default: no returning support
    return insertSql;
  }

  @Override
  public SqlStatement renderUpdate(String table, String primaryKey, Object id, Map<String, Object> sets) {
    if (sets == null || sets.isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    Objects.requireNonNull(primaryKey, "primaryKey");
    RenderCtx ctx = new RenderCtx();
    List<String> parts = new ArrayList<>();
    for (Map.Entry<String, Object> e : sets.entrySet()) {
      parts.add(quoteIdent(e.getKey()) + " = " + ctx.add(e.getValue()));
    }
    String sql = "UPDATE " + quoteTable(table) + " SET " + String.join(", ", parts)
        + " WHERE " + quoteIdent(primaryKey) + " = " + ctx.add(id);
    return new SqlStatement(sql, ctx.params(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDelete(String table, String primaryKey, Object id) {
    Objects.requireNonNull(primaryKey, "primaryKey");
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + quoteTable(table) + " WHERE " + quoteIdent(primaryKey) + " = " + ctx.add(id);
    return new SqlStatement(sql, ctx.params(), ExecKind.UPDATE);
  }

  /** Table reference; {@code schema.table} is quoted per part. */
  protected String quoteTable(String table) {
    Objects.requireNonNull(table, "table");
    String[] parts = table.split("\\.", -1);
    List<String> out = new ArrayList<>(parts.length);
    for (String p : parts) out.add(quoteIdent(p));
    return String.join(".", out);
  }
}
