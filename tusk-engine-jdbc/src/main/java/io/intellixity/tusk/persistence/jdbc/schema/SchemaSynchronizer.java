package io.intellixity.tusk.persistence.jdbc.schema;

import io.intellixity.tusk.persistence.authoring.FieldSpec;
import io.intellixity.tusk.persistence.authoring.RecordShape;
import io.intellixity.tusk.persistence.exec.SqlExecutor;
import io.intellixity.tusk.persistence.exec.TxHandle;
import io.intellixity.tusk.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tusk.persistence.schema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converges a live table to its declared fields.
 *
 * Runs in two transactions: renames first (committed on their own), then additions, type changes
 * and drops computed against the re-read columns. A rejected statement rolls back its transaction
 * and surfaces as {@link MigrationFailedException}.
 */
public final class SchemaSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(SchemaSynchronizer.class);

  private final JdbcDialect dialect;
  private final SqlExecutor executor;
  private final ColumnMetadataReader columns;
  private final SchemaDiffer differ;

  public SchemaSynchronizer(JdbcDialect dialect, SqlExecutor executor, ColumnMetadataReader columns) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.columns = Objects.requireNonNull(columns, "columns");
    this.differ = new SchemaDiffer(dialect);
  }

  /** Statements {@link #synchronize} would run right now, without running them. */
  public List<MigrationStatement> plan(String table, List<FieldSpec> declared, RenameMap renames) {
    SchemaDiff diff = differ.diff(declared, columns.listColumns(table), renames);
    return dialect.renderMigration(table, diff);
  }

  public List<MigrationStatement> plan(RecordShape shape) {
    return plan(shape.table(), shape.fields(), shape.renames());
  }

  public List<MigrationStatement> synchronize(RecordShape shape) {
    return synchronize(shape.table(), shape.fields(), shape.renames());
  }

  /** @return the statements executed, in order; empty when the table already matches */
  public List<MigrationStatement> synchronize(String table, List<FieldSpec> declared, RenameMap renames) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(declared, "declared");
    RenameMap rm = (renames == null) ? RenameMap.empty() : renames;

    List<MigrationStatement> executed = new ArrayList<>();

    List<ColumnRename> renameOps = differ.applicableRenames(columns.listColumns(table), rm);
    if (!renameOps.isEmpty()) {
      SchemaDiff renameOnly = new SchemaDiff(renameOps, List.of(), List.of(), List.of());
      List<MigrationStatement> batch = dialect.renderMigration(table, renameOnly);
      log.info("tusk.schema phase=RENAME table={} statements={}", table, batch.size());
      runBatch(table, batch);
      executed.addAll(batch);
    }

    SchemaDiff diff = differ.diffAfterRenames(declared, columns.listColumns(table), rm);
    List<MigrationStatement> main = dialect.renderMigration(table, diff);
    if (!main.isEmpty()) {
      log.info("tusk.schema phase=MAIN table={} add={} alterType={} drop={}",
          table, diff.additions().size(), diff.typeChanges().size(), diff.removals().size());
      runBatch(table, main);
      executed.addAll(main);
    }

    if (executed.isEmpty()) {
      log.debug("tusk.schema table={} status=converged", table);
    }
    return executed;
  }

  private void runBatch(String table, List<MigrationStatement> batch) {
    TxHandle tx;
    try {
      tx = executor.begin();
    } catch (RuntimeException e) {
      throw new MigrationFailedException(table, batch.get(0).phase(), "BEGIN", e);
    }
    MigrationStatement current = null;
    try {
      for (MigrationStatement st : batch) {
        current = st;
        log.debug("tusk.schema exec phase={} table={} sql={}", st.phase(), table, st.sql());
        executor.execute(tx, st.sql(), List.of());
      }
    } catch (RuntimeException e) {
      MigrationFailedException failure = new MigrationFailedException(table, current.phase(), current.sql(), e);
      try {
        executor.rollback(tx);
      } catch (RuntimeException re) {
        failure.addSuppressed(re);
      }
      log.warn("tusk.schema failed phase={} table={} sql={}", current.phase(), table, current.sql());
      throw failure;
    }

    try {
      executor.commit(tx);
    } catch (RuntimeException e) {
      throw new MigrationFailedException(table, batch.get(batch.size() - 1).phase(), "COMMIT", e);
    }
  }
}
