package io.intellixity.vista.catalog;

import io.intellixity.vista.data.Column;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Declared (possibly stale) shape of a table, as recorded by the data source catalog. */
public record TableSchema(String tableName, String schemaName, List<Column> columns) {
  public TableSchema {
    Objects.requireNonNull(tableName, "tableName");
    columns = (columns == null) ? List.of() : List.copyOf(columns);
  }

  public Optional<Column> column(String name) {
    for (Column c : columns) if (c.name().equals(name)) return Optional.of(c);
    return Optional.empty();
  }

  public boolean matches(String table, String schema) {
    if (!tableName.equalsIgnoreCase(table)) return false;
    return schema == null || schemaName == null || schemaName.equalsIgnoreCase(schema);
  }
}
