package io.intellixity.tusk.persistence.jdbc.postgres;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Identifier and literal quoting for PostgreSQL.\n
 *
 * Identifiers are left bare when Postgres would read them back unchanged: lower-case, not starting with a
 * digit, free of {@code $}, and not a reserved keyword. Everything else is double-quoted with embedded quotes doubled.
 */
public final class PostgresQuoting {
  private static final Pattern PLAIN = Pattern.compile("[a-z_][a-z0-9_]*");

  // Reserved and type/function-name keywords; non-reserved keywords are legal as bare column names.
  private static final Set<String> RESERVED = Set.of(
      "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric", "authorization",
      "binary", "both", "case", "cast", "check", "collate", "collation", "column", "concurrently",
      "constraint", "create", "cross", "current_catalog", "current_date", "current_role", "current_schema",
      "current_time", "current_timestamp", "current_user", "default", "deferrable", "desc", "distinct", "do",
      "else", "end", "except", "false", "fetch", "for", "foreign", "freeze", "from", "full", "grant", "group",
      "having", "ilike", "in", "initially", "inner", "intersect", "into", "is", "isnull", "join", "lateral",
      "leading", "left", "like", "limit", "localtime", "localtimestamp", "natural", "not", "notnull", "null",
      "offset", "on", "only", "or", "order", "outer", "overlaps", "placing", "primary", "references",
      "returning", "right", "select", "session_user", "similar", "some", "symmetric", "system_user", "table",
      "tablesample", "then", "to", "trailing", "true", "union", "unique", "user", "using", "variadic",
      "verbose", "when", "where", "window", "with");

  private PostgresQuoting() {}

  public static boolean needsQuoting(String ident) {
    return !PLAIN.matcher(ident).matches() || RESERVED.contains(ident);
  }

  public static String quoteIdent(String ident) {
    Objects.requireNonNull(ident, "ident");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  public static String quoteIdentIfNeeded(String ident) {
    Objects.requireNonNull(ident, "ident");
    if (ident.isEmpty()) throw new IllegalArgumentException("Empty identifier");
    return needsQuoting(ident) ? quoteIdent(ident) : ident;
  }

  /** {@code schema.table} quoted per part. */
  public static String quoteQualified(String name) {
    Objects.requireNonNull(name, "name");
    String[] parts = name.split("\\.", -1);
    List<String> out = new ArrayList<>(parts.length);
    for (String p : parts) out.add(quoteIdentIfNeeded(p));
    return String.join(".", out);
  }

  public static String quoteLiteral(String value) {
    Objects.requireNonNull(value, "value");
    return "'" + value.replace("'", "''") + "'";
  }
}
