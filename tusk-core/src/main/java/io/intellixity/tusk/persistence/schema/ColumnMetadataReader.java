package io.intellixity.tusk.persistence.schema;

import java.util.List;

/** Reads the committed column layout of a table from the database catalog. */
public interface ColumnMetadataReader {
  /** Columns in catalog order; an empty list when the table does not exist. */
  List<ColumnInfo> listColumns(String table);
}
