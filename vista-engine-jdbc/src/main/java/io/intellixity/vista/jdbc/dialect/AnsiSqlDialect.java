package io.intellixity.vista.jdbc.dialect;

import io.intellixity.vista.jdbc.SqlStatement;
import io.intellixity.vista.pipeline.config.SourceConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Double-quoted identifiers and {@code LIMIT n}. Serves PostgreSQL, H2 and generic JDBC sources;
 * dialects override the quoting and row-cap hooks.
 */
public class AnsiSqlDialect implements JdbcDialect {
  @Override
  public String id() {
    return "ansi";
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null || ident.isBlank()) throw new IllegalArgumentException("identifier is blank");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public final SqlStatement renderSourceSelect(SourceConfig cfg, String defaultSchema, int rowCap) {
    List<String> items = new ArrayList<>();
    for (String c : cfg.columns()) items.add(quoteIdent(c));
    String projection = items.isEmpty() ? "*" : String.join(", ", items);

    String schema = cfg.schemaName() != null ? cfg.schemaName() : defaultSchema;
    String from = (schema == null ? "" : quoteIdent(schema) + ".") + quoteIdent(cfg.tableName());

    SqlStatement base = new SqlStatement("SELECT " + projection + " FROM " + from);
    return rowCap > 0 ? applyRowCap(base, rowCap) : base;
  }

  /** Row caps are bound like any other value. */
  protected SqlStatement applyRowCap(SqlStatement base, int rowCap) {
    List<Object> binds = new ArrayList<>(base.binds());
    binds.add(rowCap);
    return new SqlStatement(base.sql() + " LIMIT :p" + binds.size(), binds);
  }
}
