package io.intellixity.tusk.persistence.schema;

/** Ordered stages of schema synchronization. */
public enum MigrationPhase {
  RENAME,
  ADD,
  ALTER_TYPE,
  DROP
}
