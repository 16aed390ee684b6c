package io.intellixity.tusk.persistence.jdbc;

import io.intellixity.tusk.persistence.authoring.RecordShape;
import io.intellixity.tusk.persistence.authoring.TypeIds;
import io.intellixity.tusk.persistence.compile.DefaultQueryValidationStrategy;
import io.intellixity.tusk.persistence.compile.QueryValidationStrategy;
import io.intellixity.tusk.persistence.exec.SqlExecutor;
import io.intellixity.tusk.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tusk.persistence.jdbc.schema.MigrationStatement;
import io.intellixity.tusk.persistence.jdbc.schema.SchemaSynchronizer;
import io.intellixity.tusk.persistence.query.Query;
import io.intellixity.tusk.persistence.schema.ColumnMetadataReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Table-level access for one {@link RecordShape}: schema sync, validated queries and by-id writes.\n
 *
 * Rows are plain column maps.
 */
public final class RecordRepository {
  private static final Logger log = LoggerFactory.getLogger(RecordRepository.class);

  private final RecordShape shape;
  private final JdbcDialect dialect;
  private final SqlExecutor executor;
  private final SchemaSynchronizer synchronizer;
  private final QueryValidationStrategy validation;

  public RecordRepository(RecordShape shape, JdbcDialect dialect, SqlExecutor executor, ColumnMetadataReader reader) {
    this(shape, dialect, executor, reader, new DefaultQueryValidationStrategy());
  }

  public RecordRepository(RecordShape shape, JdbcDialect dialect, SqlExecutor executor, ColumnMetadataReader reader,
                          QueryValidationStrategy validation) {
    this.shape = Objects.requireNonNull(shape, "shape");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.synchronizer = new SchemaSynchronizer(dialect, executor, Objects.requireNonNull(reader, "reader"));
    this.validation = Objects.requireNonNull(validation, "validation");
  }

  public RecordShape shape() { return shape; }

  public List<MigrationStatement> synchronize() {
    return synchronizer.synchronize(shape);
  }

  public List<MigrationStatement> plan() {
    return synchronizer.plan(shape);
  }

  public List<Map<String, Object>> select(Query query) {
    Query q = (query == null) ? new Query() : query;
    validation.validate(shape, q);
    QueryPlan plan = dialect.compileSelect(shape.table(), shape.primaryKey(), q);
    return executor.fetch(null, plan.sql(), plan.parameters());
  }

  public long count(Query query) {
    Query q = (query == null) ? new Query() : query;
    validation.validate(shape, q);
    SqlStatement st = dialect.compileCount(shape.table(), q);
    List<Map<String, Object>> rows = executor.fetch(null, st.sql(), st.params());
    if (rows.isEmpty()) return 0L;
    Iterator<Object> it = rows.get(0).values().iterator();
    Object v = it.hasNext() ? it.next() : null;
    return (v instanceof Number n) ? n.longValue() : 0L;
  }

  /** First row matching a shorthand filter, if any. */
  public Optional<Map<String, Object>> fetchOne(Map<String, ?> filter) {
    List<Map<String, Object>> rows = select(Query.where(filter).withLimit(1));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /**
   * Inserts a row and returns it as stored.\n
   *
   * A missing {@code uuid} primary key is generated client-side.
   */
  public Map<String, Object> insert(Map<String, Object> values) {
    Objects.requireNonNull(values, "values");
    Map<String, Object> row = new LinkedHashMap<>(values);
    String pk = shape.primaryKey();
    if (row.get(pk) == null && TypeIds.UUID.equals(shape.field(pk).type())) {
      row.put(pk, UUID.randomUUID());
    }
    for (String col : row.keySet()) shape.field(col);

    List<String> returning = new ArrayList<>();
    for (var f : shape.fields()) returning.add(f.name());
    SqlStatement st = dialect.renderInsert(shape.table(), row, returning);

    log.debug("tusk.repo insert table={} columns={}", shape.table(), row.size());
    if (st.execKind() == SqlStatement.ExecKind.QUERY) {
      List<Map<String, Object>> out = executor.inTx(tx -> executor.fetch(tx, st.sql(), st.params()));
      return out.isEmpty() ? row : out.get(0);
    }
    executor.inTx(tx -> executor.execute(tx, st.sql(), st.params()));
    return row;
  }

  /** @return rows affected; 0 when {@code sets} is empty */
  public long update(Object id, Map<String, Object> sets) {
    Objects.requireNonNull(id, "id");
    if (sets == null || sets.isEmpty()) return 0L;
    for (String col : sets.keySet()) shape.field(col);
    SqlStatement st = dialect.renderUpdate(shape.table(), shape.primaryKey(), id, sets);
    return executor.inTx(tx -> executor.execute(tx, st.sql(), st.params()));
  }

  public long delete(Object id) {
    Objects.requireNonNull(id, "id");
    SqlStatement st = dialect.renderDelete(shape.table(), shape.primaryKey(), id);
    return executor.inTx(tx -> executor.execute(tx, st.sql(), st.params()));
  }
}
