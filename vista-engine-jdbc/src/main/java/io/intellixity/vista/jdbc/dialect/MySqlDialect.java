package io.intellixity.vista.jdbc.dialect;

/**
 * Backtick identifiers. MySQL has no {@code NULLS LAST} and reads a backslash inside a literal as
 * an escape, so null ordering uses {@code expr IS NULL} and LIKE escapes with {@code !}.
 */
public final class MySqlDialect extends AnsiSqlDialect {
  @Override
  public String id() {
    return "mysql";
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null || ident.isBlank()) throw new IllegalArgumentException("identifier is blank");
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  public String orderItem(String expr, boolean ascending) {
    return expr + " IS NULL, " + expr + (ascending ? " ASC" : " DESC");
  }

  @Override
  public char likeEscape() {
    return '!';
  }

  @Override
  public boolean supportsMedian() {
    return false;
  }
}
