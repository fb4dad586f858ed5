package io.intellixity.vista.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites SQL with named parameters ({@code :p1}) into JDBC SQL with {@code ?} placeholders.\n
 *
 * Rules:\n
 * - a parameter is ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is a cast, not a parameter\n
 * - anything inside single quotes is left alone ('' is an escaped quote)\n
 */
public final class ParamSqlCompiler {
  private ParamSqlCompiler() {}

  /** Parameter names in order of appearance; a name used twice appears twice. */
  public static List<String> paramNames(String sql) {
    List<String> out = new ArrayList<>();
    scan(sql, null, out);
    return out;
  }

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    scan(sql, out, null);
    return out.toString();
  }

  /**
   * Compiles a statement for execution; the bind list must line up with the placeholders.
   */
  public static SqlStatement compile(SqlStatement named) {
    int params = paramNames(named.sql()).size();
    if (params != named.binds().size()) {
      throw new IllegalArgumentException("Statement has " + params + " parameters but " + named.binds().size() + " binds");
    }
    return new SqlStatement(toJdbcSql(named.sql()), named.binds());
  }

  private static void scan(String sql, StringBuilder rewritten, List<String> names) {
    if (sql == null) return;
    boolean inQuote = false;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        if (inQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          if (rewritten != null) rewritten.append("''");
          i++;
          continue;
        }
        inQuote = !inQuote;
        if (rewritten != null) rewritten.append(ch);
        continue;
      }

      if (!inQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          if (rewritten != null) rewritten.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          if (names != null) names.add(sql.substring(start, end));
          if (rewritten != null) rewritten.append('?');
          i = end - 1;
          continue;
        }
      }

      if (rewritten != null) rewritten.append(ch);
    }
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
