package io.intellixity.vista.jdbc.dialect;

import java.util.Locale;

public final class Dialects {
  private Dialects() {}

  /** Dialect for a data source type; unknown JDBC types get the ANSI dialect. */
  public static JdbcDialect forType(String dataSourceType) {
    String t = dataSourceType == null ? "" : dataSourceType.toLowerCase(Locale.ROOT);
    return switch (t) {
      case "mysql", "mariadb" -> new MySqlDialect();
      default -> new AnsiSqlDialect();
    };
  }
}
