package io.intellixity.tusk.persistence.jdbc;

import io.intellixity.tusk.persistence.jdbc.schema.JdbcColumnMetadataReader;
import io.intellixity.tusk.persistence.schema.ColumnInfo;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcColumnMetadataReaderTest {
  private static Map<String, Object> row(String name, String type) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("COLUMN_NAME", name);
    m.put("DATA_TYPE", type);
    return m;
  }

  @Test
  void readsColumnsInReturnedOrderWithCaseInsensitiveLabels() {
    RecordingExecutor ex = new RecordingExecutor()
        .answering(sql -> List.of(row("id", "uuid"), row("name", "text")));
    List<ColumnInfo> cols = new JdbcColumnMetadataReader(ex).listColumns("users");

    assertEquals(List.of(new ColumnInfo("id", "uuid"), new ColumnInfo("name", "text")), cols);
    RecordingExecutor.Call c = ex.last();
    assertTrue(c.sql().contains("AND table_schema = current_schema()"), c.sql());
    assertFalse(c.sql().contains("NOT IN"), c.sql());
    assertTrue(c.sql().endsWith("ORDER BY ordinal_position"));
    assertEquals(List.of("users"), c.params());
  }

  @Test
  void qualifiedNameFiltersOnSchema() {
    RecordingExecutor ex = new RecordingExecutor();
    new JdbcColumnMetadataReader(ex, "public").listColumns("app.users");
    assertTrue(ex.last().sql().contains("table_schema = $2"));
    assertEquals(List.of("users", "app"), ex.last().params());
  }

  @Test
  void defaultSchemaAppliesToBareNames() {
    RecordingExecutor ex = new RecordingExecutor();
    new JdbcColumnMetadataReader(ex, "app").listColumns("users");
    assertEquals(List.of("users", "app"), ex.last().params());
    assertFalse(ex.last().sql().contains("current_schema()"));
  }
}
