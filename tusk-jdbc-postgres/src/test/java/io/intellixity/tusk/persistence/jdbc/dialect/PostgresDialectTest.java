package io.intellixity.tusk.persistence.jdbc.dialect;

import io.intellixity.tusk.persistence.jdbc.PositionalSql;
import io.intellixity.tusk.persistence.jdbc.QueryPlan;
import io.intellixity.tusk.persistence.jdbc.SqlStatement;
import io.intellixity.tusk.persistence.jdbc.postgres.PostgresDialect;
import io.intellixity.tusk.persistence.query.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  private QueryPlan where(Object predicate) {
    return d.compileSelect("users", "id", List.of(), predicate, List.of(), null, null, false);
  }

  @Test
  void orOfSingleConditionGroups() {
    QueryPlan p = where(List.of(Map.of("age", 5), Map.of("age", 6)));
    assertEquals("SELECT * FROM users WHERE ((age = $1) OR (age = $2))", p.sql());
    assertEquals(List.of(5, 6), p.parameters());
  }

  @Test
  void singleMapJoinsWithAndWithoutParens() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("age__greaterEq", 18);
    spec.put("name__like", "a%");
    QueryPlan p = where(spec);
    assertEquals("age >= $1 AND name LIKE $2", p.whereSql());
    assertEquals(List.of(18, "a%"), p.parameters());
  }

  @Test
  void orGroupsWithSeveralConditions() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("age__less", 10);
    a.put("name", "x");
    QueryPlan p = where(List.of(a, Map.of("age__lessEq", 70)));
    assertEquals("((age < $1 AND name = $2) OR (age <= $3))", p.whereSql());
    assertEquals(List.of(10, "x", 70), p.parameters());
  }

  @Test
  void inExpandsOnePlaceholderPerElement() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("name", "ann");
    spec.put("status__in", List.of("a", "b", "c"));
    spec.put("age__notEqual", 3);
    QueryPlan p = where(spec);
    assertEquals("name = $1 AND status IN ($2, $3, $4) AND age != $5", p.whereSql());
    assertEquals(List.of("ann", "a", "b", "c", 3), p.parameters());
  }

  @Test
  void nullOperatorsBindNothingWhateverTheValue() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("deleted_at__isNull", true);
    spec.put("age", 4);
    spec.put("name__isNotNull", "ignored");
    QueryPlan p = where(spec);
    assertEquals("deleted_at IS NULL AND age = $1 AND name IS NOT NULL", p.whereSql());
    assertEquals(List.of(4), p.parameters());
  }

  @Test
  void placeholderNumbersMatchParameterPositions() {
    Map<String, Object> g1 = new LinkedHashMap<>();
    g1.put("a__in", List.of(1, 2));
    g1.put("b__isNull", null);
    g1.put("c", 3);
    Map<String, Object> g2 = new LinkedHashMap<>();
    g2.put("d__notIn", List.of(4, 5, 6));
    g2.put("e__greater", 7);
    QueryPlan p = where(List.of(g1, g2));

    assertEquals(p.parameters().size(), countDistinctPlaceholders(p.whereSql()));
    assertEquals(List.of(1, 2, 3, 4, 5, 6, 7), p.parameters());
    assertTrue(p.whereSql().contains("e > $7"));
  }

  private static int countDistinctPlaceholders(String sql) {
    Set<String> seen = new HashSet<>();
    java.util.regex.Matcher m = java.util.regex.Pattern.compile("\\$(\\d+)").matcher(sql);
    int expected = 1;
    while (m.find()) {
      assertEquals(expected++, Integer.parseInt(m.group(1)), "placeholders must be sequential: " + sql);
      seen.add(m.group());
    }
    return seen.size();
  }

  @Test
  void equalWithNullStillBindsOneParameter() {
    Map<String, Object> spec = new HashMap<>();
    spec.put("name", null);
    QueryPlan p = where(spec);
    assertEquals("name = $1", p.whereSql());
    assertEquals(1, p.parameters().size());
    assertNull(p.parameters().get(0));
  }

  @Test
  void emptyListsShortCircuit() {
    assertEquals("FALSE", where(Map.of("age__in", List.of())).whereSql());
    assertEquals("TRUE", where(Map.of("age__notIn", List.of())).whereSql());
    assertTrue(where(Map.of("age__in", List.of())).parameters().isEmpty());
  }

  @Test
  void unknownOperatorIsRejected() {
    UnknownOperatorException ex = assertThrows(UnknownOperatorException.class,
        () -> where(Map.of("age__approx", 3)));
    assertEquals("approx", ex.token());
  }

  @Test
  void listShapeMismatchesNameTheField() {
    InvalidFilterException notList = assertThrows(InvalidFilterException.class,
        () -> where(Map.of("age__in", 3)));
    assertEquals("age", notList.field());

    InvalidFilterException list = assertThrows(InvalidFilterException.class,
        () -> where(Map.of("age__greater", List.of(1, 2))));
    assertEquals("age", list.field());
  }

  @Test
  void projectionPrefixesPrimaryKeyOnce() {
    QueryPlan p = d.compileSelect("users", "id", List.of("name", "id", "age"), null, List.of(), null, null, false);
    assertEquals("SELECT id, name, age FROM users", p.sql());
    assertEquals(List.of("id", "name", "age"), p.selectColumns());
  }

  @Test
  void orderingDistinctAndPaging() {
    QueryPlan p = d.compileSelect("users", "id", List.of("name"), Map.of("age__greater", 1),
        List.of("-age", "name"), 10, 20, true);
    assertEquals("SELECT DISTINCT id, name FROM users WHERE age > $1 ORDER BY age DESC, name ASC LIMIT 10 OFFSET 20", p.sql());
    assertTrue(p.distinct());
  }

  @Test
  void starSelectStillReportsPrimaryKey() {
    QueryPlan p = d.compileSelect("users", "id", List.of(), null, List.of(), null, null, false);
    assertEquals("SELECT * FROM users", p.sql());
    assertEquals(List.of("id"), p.selectColumns());

    QueryPlan noKey = d.compileSelect("users", " ", List.of(), null, List.of(), null, null, false);
    assertTrue(noKey.selectColumns().isEmpty());
  }

  @Test
  void dollarInColumnNameIsQuotedAndNotBound() {
    QueryPlan p = where(Map.of("price$1", 7));
    assertEquals("SELECT * FROM users WHERE \"price$1\" = $1", p.sql());
    assertEquals(List.of(7), p.parameters());

    PositionalSql.JdbcSql js = PositionalSql.toJdbc(p.sql(), p.parameters());
    assertEquals("SELECT * FROM users WHERE \"price$1\" = ?", js.sql());
    assertEquals(List.of(7), js.params());
  }

  @Test
  void nonPositivePagingIsOmitted() {
    QueryPlan p = d.compileSelect("users", "id", List.of(), null, List.of(), 0, -5, false);
    assertEquals("SELECT * FROM users", p.sql());
    assertNull(p.limit());
    assertNull(p.offset());
  }

  @Test
  void identifiersNeedingQuotesAreQuoted() {
    QueryPlan p = d.compileSelect("app.Users", "id", List.of("order"), Map.of("Name", "x"), List.of(), null, null, false);
    assertEquals("SELECT id, \"order\" FROM app.\"Users\" WHERE \"Name\" = $1", p.sql());
  }

  @Test
  void canonicalTreeNestsAndInsideOr() {
    Query q = Query.of(QueryFilters.and(
        QueryFilters.eq("tenant", "t1"),
        QueryFilters.or(QueryFilters.eq("age", 5), QueryFilters.and(QueryFilters.gt("age", 60), QueryFilters.isNull("name")))));
    QueryPlan p = d.compileSelect("users", "id", q);
    assertEquals("tenant = $1 AND ((age = $2) OR (age > $3 AND name IS NULL))", p.whereSql());
    assertEquals(List.of("t1", 5, 60), p.parameters());
  }

  @Test
  void countWrapsFilteredSelect() {
    SqlStatement st = d.compileCount("users", Query.where(Map.of("age", 5)).orderBy("name").withLimit(3));
    assertEquals("SELECT COUNT(1) FROM (SELECT * FROM users WHERE age = $1) tusk_count", st.sql());
    assertEquals(List.of(5), st.params());
  }

  @Test
  void insertReturnsRequestedColumns() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("id", UUID.fromString("00000000-0000-0000-0000-000000000001"));
    values.put("name", "ann");
    SqlStatement st = d.renderInsert("users", values, List.of("id", "name"));
    assertEquals("INSERT INTO users (id, name) VALUES ($1, $2) RETURNING id, name", st.sql());
    assertEquals(SqlStatement.ExecKind.QUERY, st.execKind());
  }
}
