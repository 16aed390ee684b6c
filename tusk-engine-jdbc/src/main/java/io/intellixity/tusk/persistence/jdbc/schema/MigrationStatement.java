package io.intellixity.tusk.persistence.jdbc.schema;

import io.intellixity.tusk.persistence.schema.MigrationPhase;

import java.util.Objects;

/** One rendered DDL statement and the phase it belongs to. */
public record MigrationStatement(MigrationPhase phase, String sql) {
  public MigrationStatement {
    Objects.requireNonNull(phase, "phase");
    Objects.requireNonNull(sql, "sql");
  }

  @Override
  public String toString() {
    return phase + ": " + sql;
  }
}
