package io.intellixity.tusk.persistence.jdbc;

import io.intellixity.tusk.persistence.authoring.RecordShape;
import io.intellixity.tusk.persistence.jdbc.dialect.QuotingTestDialect;
import io.intellixity.tusk.persistence.query.Query;
import io.intellixity.tusk.persistence.query.QueryValidationException;
import io.intellixity.tusk.persistence.schema.ColumnInfo;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class RecordRepositoryTest {
  private static final RecordShape USERS = RecordShape.builder("users")
      .field("name", "string")
      .field("age", "int")
      .build();

  private static RecordRepository repo(RecordingExecutor ex) {
    return new RecordRepository(USERS, new QuotingTestDialect(), ex,
        table -> List.of(new ColumnInfo("id", "varchar"), new ColumnInfo("name", "varchar"), new ColumnInfo("age", "int")));
  }

  @Test
  void selectCompilesAndFetchesOutsideTransaction() {
    RecordingExecutor ex = new RecordingExecutor()
        .answering(sql -> List.of(Map.of("id", "u1", "name", "ann")));
    List<Map<String, Object>> rows = repo(ex).select(Query.where(Map.of("age__greater", 30)).orderBy("-age"));

    assertEquals(1, rows.size());
    RecordingExecutor.Call c = ex.last();
    assertEquals("SELECT * FROM \"users\" WHERE \"age\" > $1 ORDER BY \"age\" DESC", c.sql());
    assertEquals(List.of(30), c.params());
    assertFalse(c.inTx());
    assertTrue(ex.txEvents.isEmpty());
  }

  @Test
  void unknownColumnsFailBeforeReachingTheDatabase() {
    RecordingExecutor ex = new RecordingExecutor();
    assertThrows(QueryValidationException.class, () -> repo(ex).select(Query.where(Map.of("email", "x"))));
    assertTrue(ex.calls.isEmpty());
  }

  @Test
  void countReadsFirstColumn() {
    RecordingExecutor ex = new RecordingExecutor().answering(sql -> List.of(Map.of("count", 3L)));
    assertEquals(3L, repo(ex).count(Query.where(Map.of("name", "ann"))));
    assertEquals("SELECT COUNT(1) FROM (SELECT * FROM \"users\" WHERE \"name\" = $1) tusk_count", ex.last().sql());
  }

  @Test
  void fetchOneLimitsToOneRow() {
    RecordingExecutor ex = new RecordingExecutor();
    Optional<Map<String, Object>> row = repo(ex).fetchOne(Map.of("name", "ann"));
    assertTrue(row.isEmpty());
    assertTrue(ex.last().sql().endsWith("FETCH FIRST 1 ROWS ONLY"), ex.last().sql());
  }

  @Test
  void insertGeneratesUuidKeyAndRunsInTransaction() {
    RecordingExecutor ex = new RecordingExecutor();
    Map<String, Object> in = new LinkedHashMap<>();
    in.put("name", "ann");
    Map<String, Object> stored = repo(ex).insert(in);

    assertTrue(stored.get("id") instanceof UUID);
    RecordingExecutor.Call c = ex.last();
    assertEquals("execute", c.kind());
    assertTrue(c.inTx());
    assertEquals("INSERT INTO \"users\" (\"name\", \"id\") VALUES ($1, $2)", c.sql());
    assertEquals(List.of("begin", "commit"), ex.txEvents);
  }

  @Test
  void insertRejectsUndeclaredColumns() {
    RecordingExecutor ex = new RecordingExecutor();
    assertThrows(IllegalArgumentException.class, () -> repo(ex).insert(Map.of("email", "x")));
    assertTrue(ex.calls.isEmpty());
  }

  @Test
  void updateWithNothingToSetIsANoop() {
    RecordingExecutor ex = new RecordingExecutor();
    assertEquals(0L, repo(ex).update("u1", Map.of()));
    assertTrue(ex.calls.isEmpty());
  }

  @Test
  void updateAndDeleteTargetPrimaryKey() {
    RecordingExecutor ex = new RecordingExecutor().updating(1);
    assertEquals(1L, repo(ex).update("u1", Map.of("age", 31)));
    assertEquals("UPDATE \"users\" SET \"age\" = $1 WHERE \"id\" = $2", ex.last().sql());
    assertEquals(List.of(31, "u1"), ex.last().params());

    assertEquals(1L, repo(ex).delete("u1"));
    assertEquals("DELETE FROM \"users\" WHERE \"id\" = $1", ex.last().sql());
  }

  @Test
  void planShowsPendingDdlWithoutExecuting() {
    RecordingExecutor ex = new RecordingExecutor();
    RecordRepository r = new RecordRepository(USERS, new QuotingTestDialect(), ex,
        table -> List.of(new ColumnInfo("id", "varchar"), new ColumnInfo("name", "varchar")));
    assertEquals(1, r.plan().size());
    assertEquals("ALTER TABLE \"users\" ADD COLUMN \"age\" INT", r.plan().get(0).sql());
    assertTrue(ex.calls.isEmpty());
  }
}
