package io.intellixity.tusk.persistence.schema;

/** Database-specific column typing used when diffing declared fields against live columns. */
public interface ColumnTypeMapper {
  /** Column type for a semantic type ID. Must be total: unknown or null IDs get a fallback type. */
  String columnType(String typeId);

  /** Whether a declared column type and a catalog-reported type name denote the same type. */
  boolean sameType(String declaredType, String liveType);
}
