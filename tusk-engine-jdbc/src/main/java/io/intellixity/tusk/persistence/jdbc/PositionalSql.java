package io.intellixity.tusk.persistence.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites SQL with positional parameters ({@code $1}, {@code $2}, ...) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - A param is '$' followed by one or more digits.\n
 * - A '$' directly after an identifier character belongs to that identifier (e.g. {@code price$1}).\n
 * - Text inside single quotes or double-quoted identifiers is copied verbatim.\n
 * - '::' casts pass through untouched.\n
 *
 * JDBC binds by occurrence, so the parameter list is expanded per occurrence: a SQL text that
 * references {@code $1} twice binds {@code params[0]} twice.
 */
public final class PositionalSql {
  private PositionalSql() {}

  /** JDBC SQL plus the parameters in '?' order. */
  public record JdbcSql(String sql, List<Object> params) {}

  public static JdbcSql toJdbc(String sql, List<Object> params) {
    if (sql == null) return new JdbcSql("", List.of());
    List<Object> in = (params == null) ? List.of() : params;
    StringBuilder out = new StringBuilder(sql.length());
    List<Object> ordered = new ArrayList<>(in.size());
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // Doubled quote is an escape, stay inside the literal
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (isPlaceholderStart(sql, i)) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int position = Integer.parseInt(sql.substring(i + 1, end));
        if (position < 1 || position > in.size()) {
          throw new IllegalArgumentException("Placeholder $" + position + " has no parameter (" + in.size() + " supplied)");
        }
        ordered.add(in.get(position - 1));
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    return new JdbcSql(out.toString(), ordered);
  }

  /** Number of placeholder occurrences outside quoted text. */
  public static int countPlaceholders(String sql) {
    if (sql == null) return 0;
    int n = 0;
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (quote != 0) {
        if (ch == quote) {
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) i++;
          else quote = 0;
        }
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        continue;
      }
      if (isPlaceholderStart(sql, i)) {
        n++;
        while (i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) i++;
      }
    }
    return n;
  }

  private static boolean isPlaceholderStart(String sql, int i) {
    if (sql.charAt(i) != '$' || i + 1 >= sql.length() || !isDigit(sql.charAt(i + 1))) return false;
    return i == 0 || !isIdentPart(sql.charAt(i - 1));
  }

  private static boolean isIdentPart(char c) {
    return c == '_' || c == '$' || Character.isLetterOrDigit(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
