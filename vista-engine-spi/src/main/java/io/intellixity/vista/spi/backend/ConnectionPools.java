package io.intellixity.vista.spi.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.error.DataSourceException;

import javax.sql.DataSource;

/** Supplies pooled JDBC connections for a data source; owned by the hosting application. */
@FunctionalInterface
public interface ConnectionPools {
  DataSource pool(DataSourceDefinition ds);

  static ConnectionPools none() {
    return ds -> {
      throw new DataSourceException("No connection pool configured for data source '" + ds.id() + "' (" + ds.type() + ")");
    };
  }
}
