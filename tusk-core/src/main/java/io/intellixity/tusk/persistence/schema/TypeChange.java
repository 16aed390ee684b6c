package io.intellixity.tusk.persistence.schema;

import java.util.Objects;

/**
 * @param column   column whose type changes
 * @param fromType live database type as reported by the catalog
 * @param toType   column type mapped from the declared field
 */
public record TypeChange(String column, String fromType, String toType) {
  public TypeChange {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(fromType, "fromType");
    Objects.requireNonNull(toType, "toType");
  }
}
