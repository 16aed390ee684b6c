package io.intellixity.tusk.persistence.schema;

import java.util.Objects;

public record ColumnRename(String from, String to) {
  public ColumnRename {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }
}
