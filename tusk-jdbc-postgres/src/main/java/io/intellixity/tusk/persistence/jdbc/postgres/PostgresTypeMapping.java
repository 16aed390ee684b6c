package io.intellixity.tusk.persistence.jdbc.postgres;

import io.intellixity.tusk.persistence.authoring.TypeIds;

import java.util.Locale;
import java.util.Map;

/** Semantic type ID to PostgreSQL column type, plus alias-aware type comparison. */
public final class PostgresTypeMapping {
  public static final String FALLBACK = "TEXT";

  private static final Map<String, String> COLUMN_TYPES = Map.ofEntries(
      Map.entry(TypeIds.INT, "INTEGER"),
      Map.entry(TypeIds.LONG, "BIGINT"),
      Map.entry(TypeIds.STRING, "TEXT"),
      Map.entry(TypeIds.BOOL, "BOOLEAN"),
      Map.entry(TypeIds.FLOAT, "REAL"),
      Map.entry(TypeIds.DOUBLE, "DOUBLE PRECISION"),
      Map.entry(TypeIds.DECIMAL, "NUMERIC"),
      Map.entry(TypeIds.UUID, "UUID"),
      Map.entry(TypeIds.DATE, "DATE"),
      Map.entry(TypeIds.INSTANT, "TIMESTAMPTZ"),
      Map.entry(TypeIds.JSON, "JSONB"),
      Map.entry(TypeIds.BYTES, "BYTEA"));

  private static final Map<String, String> ALIASES = Map.ofEntries(
      Map.entry("int", "integer"),
      Map.entry("int4", "integer"),
      Map.entry("int8", "bigint"),
      Map.entry("int2", "smallint"),
      Map.entry("bool", "boolean"),
      Map.entry("float4", "real"),
      Map.entry("float8", "double precision"),
      Map.entry("decimal", "numeric"),
      Map.entry("varchar", "character varying"),
      Map.entry("char", "character"),
      Map.entry("bpchar", "character"),
      Map.entry("timestamptz", "timestamp with time zone"),
      Map.entry("timestamp", "timestamp without time zone"),
      Map.entry("timetz", "time with time zone"),
      Map.entry("time", "time without time zone"));

  private PostgresTypeMapping() {}

  /** Never throws; unknown or null IDs map to {@value #FALLBACK}. */
  public static String columnType(String typeId) {
    String t = TypeIds.normalize(typeId);
    if (t == null) return FALLBACK;
    return COLUMN_TYPES.getOrDefault(t, FALLBACK);
  }

  /** Lower-case, whitespace-collapsed, modifier-free name with aliases resolved. */
  public static String canonical(String typeName) {
    if (typeName == null) return null;
    String t = typeName.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    int paren = t.indexOf('(');
    if (paren >= 0) {
      int close = t.indexOf(')', paren);
      String tail = (close >= 0) ? t.substring(close + 1) : "";
      t = (t.substring(0, paren) + tail).trim().replaceAll("\\s+", " ");
    }
    return ALIASES.getOrDefault(t, t);
  }

  public static boolean sameType(String a, String b) {
    if (a == null || b == null) return a == b;
    return canonical(a).equals(canonical(b));
  }

  /** Character types that convert to boolean or integer only with an explicit cast. */
  public static boolean isCharacterType(String typeName) {
    String c = canonical(typeName);
    return "text".equals(c) || "character varying".equals(c) || "character".equals(c);
  }
}
