package io.intellixity.vista.jdbc;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.jdbc.dialect.Dialects;
import io.intellixity.vista.spi.backend.BackendContext;
import io.intellixity.vista.spi.backend.BackendProvider;
import io.intellixity.vista.spi.backend.ExecutionBackend;

import javax.sql.DataSource;
import java.util.Set;

/**
 * Backends for relational sources. Connection pools come from the host through
 * {@link BackendContext#pools()}; {@code connection_config.schema} sets the default schema and
 * {@code connection_config.query_timeout_seconds} a per-statement timeout.
 */
public final class JdbcBackendProvider implements BackendProvider {
  private static final Set<String> TYPES = Set.of("postgresql", "postgres", "mysql", "mariadb", "jdbc");

  @Override
  public Set<String> types() {
    return TYPES;
  }

  @Override
  public ExecutionBackend create(DataSourceDefinition dataSource, BackendContext context) {
    DataSource pool = context.pools().pool(dataSource);
    JdbcHandle handle = new JdbcHandle(dataSource.id(), pool, dataSource.configString("schema"));
    return new JdbcBackend(dataSource, handle, Dialects.forType(dataSource.type()), timeoutSeconds(dataSource));
  }

  private static int timeoutSeconds(DataSourceDefinition ds) {
    String raw = ds.configString("query_timeout_seconds");
    if (raw == null) return 0;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("query_timeout_seconds must be an integer for data source '" + ds.id() + "'", e);
    }
  }
}
