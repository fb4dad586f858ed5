package io.intellixity.vista.jdbc.dialect;

import io.intellixity.vista.jdbc.SqlStatement;
import io.intellixity.vista.pipeline.config.SourceConfig;
import io.intellixity.vista.spi.query.SqlFlavor;

/** SQL flavour of a JDBC data source. */
public interface JdbcDialect extends SqlFlavor {
  String id();

  String quoteIdent(String ident);

  /**
   * {@code SELECT <columns> FROM <table>} with the row cap rendered into the statement when
   * {@code rowCap > 0}. {@code defaultSchema} applies when the step names no schema.
   */
  SqlStatement renderSourceSelect(SourceConfig cfg, String defaultSchema, int rowCap);
}
