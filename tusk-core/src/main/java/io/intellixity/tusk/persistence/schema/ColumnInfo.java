package io.intellixity.tusk.persistence.schema;

import java.util.Objects;

/** One column as currently persisted, as reported by the database catalog. */
public record ColumnInfo(String name, String databaseType) {
  public ColumnInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(databaseType, "databaseType");
  }
}
