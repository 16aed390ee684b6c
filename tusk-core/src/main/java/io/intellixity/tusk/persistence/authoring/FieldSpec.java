package io.intellixity.tusk.persistence.authoring;

import java.util.Objects;

/**
 * One declared column of a record shape.
 *
 * @param name         column name
 * @param type         semantic type ID (see {@link TypeIds}); may be unknown or null
 * @param hasDefault   whether {@code defaultValue} should be applied when the column is added
 * @param defaultValue default scalar; a declared default of {@code null} is treated as no default
 * @param renamedFrom  previous column name, if this field was renamed
 */
public record FieldSpec(String name, String type, boolean hasDefault, Object defaultValue, String renamedFrom) {
  public FieldSpec {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("Field name must not be blank");
    type = TypeIds.normalize(type);
    if (renamedFrom != null && renamedFrom.isBlank()) renamedFrom = null;
  }

  public static FieldSpec of(String name, String type) {
    return new FieldSpec(name, type, false, null, null);
  }

  public static FieldSpec withDefault(String name, String type, Object defaultValue) {
    return new FieldSpec(name, type, true, defaultValue, null);
  }

  public FieldSpec renamedFrom(String oldName) {
    return new FieldSpec(name, type, hasDefault, defaultValue, oldName);
  }

  /** A default is only usable when one was declared and it is not null. */
  public boolean effectiveDefault() {
    return hasDefault && defaultValue != null;
  }
}
