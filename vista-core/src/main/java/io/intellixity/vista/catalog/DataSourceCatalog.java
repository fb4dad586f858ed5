package io.intellixity.vista.catalog;

import java.util.Optional;

public interface DataSourceCatalog {
  Optional<DataSourceDefinition> resolve(String id);

  /**
   * Data source whose declared tables include {@code tableName}. Certified sources are preferred
   * when several declare the same table.
   */
  Optional<DataSourceDefinition> findByTable(String tableName);
}
