package io.intellixity.tusk.persistence.jdbc.postgres;

import io.intellixity.tusk.persistence.authoring.RecordShape;
import io.intellixity.tusk.persistence.jdbc.JdbcExecutor;
import io.intellixity.tusk.persistence.jdbc.JdbcHandle;
import io.intellixity.tusk.persistence.jdbc.RecordRepository;
import io.intellixity.tusk.persistence.jdbc.schema.JdbcColumnMetadataReader;
import io.intellixity.tusk.persistence.jdbc.schema.SchemaSynchronizer;

import java.util.Objects;

/** Wires the Postgres dialect, binder and catalog reader around one {@link JdbcHandle}. */
public final class PostgresEngines {
  private final JdbcHandle handle;
  private final PostgresDialect dialect = new PostgresDialect();
  private final JdbcExecutor executor;
  private final JdbcColumnMetadataReader columns;

  public PostgresEngines(JdbcHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.executor = new JdbcExecutor(handle, new PostgresBinder());
    this.columns = new JdbcColumnMetadataReader(executor, handle.schema());
  }

  public JdbcHandle handle() { return handle; }
  public PostgresDialect dialect() { return dialect; }
  public JdbcExecutor executor() { return executor; }
  public JdbcColumnMetadataReader columns() { return columns; }

  public SchemaSynchronizer synchronizer() {
    return new SchemaSynchronizer(dialect, executor, columns);
  }

  public RecordRepository repository(RecordShape shape) {
    return new RecordRepository(shape, dialect, executor, columns);
  }
}
