package io.intellixity.tusk.persistence.schema;

import io.intellixity.tusk.persistence.authoring.FieldSpec;

import java.util.List;

/** Changes needed to converge a live table to its declared shape. Computed fresh per call. */
public record SchemaDiff(List<ColumnRename> renames,
                         List<FieldSpec> additions,
                         List<TypeChange> typeChanges,
                         List<String> removals) {
  public SchemaDiff {
    renames = List.copyOf(renames == null ? List.of() : renames);
    additions = List.copyOf(additions == null ? List.of() : additions);
    typeChanges = List.copyOf(typeChanges == null ? List.of() : typeChanges);
    removals = List.copyOf(removals == null ? List.of() : removals);
  }

  public static SchemaDiff empty() {
    return new SchemaDiff(List.of(), List.of(), List.of(), List.of());
  }

  public boolean isEmpty() {
    return renames.isEmpty() && additions.isEmpty() && typeChanges.isEmpty() && removals.isEmpty();
  }

  public int size() {
    return renames.size() + additions.size() + typeChanges.size() + removals.size();
  }
}
