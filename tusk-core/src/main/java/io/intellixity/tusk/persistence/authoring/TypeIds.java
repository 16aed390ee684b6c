package io.intellixity.tusk.persistence.authoring;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Canonical semantic type IDs used by {@link FieldSpec#type()}. */
public final class TypeIds {
  private TypeIds() {}

  public static final String INT = "int";
  public static final String LONG = "long";
  public static final String STRING = "string";
  public static final String BOOL = "bool";
  public static final String FLOAT = "float";
  public static final String DOUBLE = "double";
  public static final String DECIMAL = "decimal";
  public static final String UUID = "uuid";
  public static final String DATE = "date";
  public static final String INSTANT = "instant";
  public static final String JSON = "json";
  public static final String BYTES = "bytes";

  private static final Set<String> NON_TEXTUAL = Set.of(INT, LONG, BOOL, FLOAT, DOUBLE, DECIMAL);

  // Alternate spellings accepted for field declarations (Int, Text, Bool, Real, Uuid).
  private static final Map<String, String> ALIASES = Map.of(
      "text", STRING,
      "real", FLOAT,
      "integer", INT,
      "boolean", BOOL);

  /** Lower-cased, trimmed, alias-resolved ID; {@code null} stays {@code null}. */
  public static String normalize(String typeId) {
    if (typeId == null) return null;
    String t = typeId.trim().toLowerCase(Locale.ROOT);
    if (t.isEmpty()) return null;
    return ALIASES.getOrDefault(t, t);
  }

  /**
   * True when literals of this type are written as quoted strings.\n
   *
   * Unknown and absent IDs degrade to a textual column, so they count as text-like too.
   */
  public static boolean isTextLike(String typeId) {
    String t = normalize(typeId);
    return t == null || !NON_TEXTUAL.contains(t);
  }
}
