package io.intellixity.tusk.persistence.schema;

import java.util.Objects;

/**
 * A schema-change statement was rejected by the database.
 * <p>
 * The transaction containing the statement has been rolled back; phases committed earlier stay in place.
 */
public final class MigrationFailedException extends RuntimeException {
  private final String table;
  private final MigrationPhase phase;
  private final String statement;

  public MigrationFailedException(String table, MigrationPhase phase, String statement, Throwable cause) {
    super("Migration of '" + table + "' failed in phase " + phase + " at statement [" + statement + "]: "
        + (cause == null ? "unknown error" : cause.getMessage()), cause);
    this.table = Objects.requireNonNull(table, "table");
    this.phase = Objects.requireNonNull(phase, "phase");
    this.statement = statement;
  }

  public String table() { return table; }
  public MigrationPhase phase() { return phase; }
  public String statement() { return statement; }
}
