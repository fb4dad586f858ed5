package io.intellixity.vista.catalog;

import java.util.*;

/**
 * A configured data source. {@code type} selects the backend ({@code postgresql}, {@code mysql},
 * {@code jdbc}, {@code csv}, {@code excel}); {@code connectionConfig} is backend specific.
 */
public record DataSourceDefinition(String id, String name, String type, Map<String, Object> connectionConfig,
                                   List<TableSchema> tables, boolean certified) {
  public DataSourceDefinition {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    name = (name == null) ? id : name;
    type = type.trim().toLowerCase(Locale.ROOT);
    connectionConfig = (connectionConfig == null)
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(connectionConfig));
    tables = (tables == null) ? List.of() : List.copyOf(tables);
  }

  public DataSourceDefinition(String id, String type, Map<String, Object> connectionConfig) {
    this(id, id, type, connectionConfig, List.of(), false);
  }

  public Optional<TableSchema> table(String tableName, String schemaName) {
    for (TableSchema t : tables) if (t.matches(tableName, schemaName)) return Optional.of(t);
    return Optional.empty();
  }

  public String configString(String key) {
    Object v = connectionConfig.get(key);
    if (v == null) return null;
    String s = String.valueOf(v);
    return s.isBlank() ? null : s;
  }
}
