package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;

import java.util.List;
import java.util.Objects;

/** Loads one table. Empty {@code columns} means all columns; {@code limit} is optional. */
public record SourceConfig(String dataSourceId, String tableName, String schemaName, List<String> columns, Integer limit)
    implements StepConfig {
  public SourceConfig {
    Objects.requireNonNull(dataSourceId, "dataSourceId");
    Objects.requireNonNull(tableName, "tableName");
    schemaName = (schemaName == null || schemaName.isBlank()) ? null : schemaName;
    columns = (columns == null) ? List.of() : List.copyOf(columns);
  }

  public SourceConfig(String dataSourceId, String tableName) {
    this(dataSourceId, tableName, null, List.of(), null);
  }

  @Override public StepType type() { return StepType.SOURCE; }
  @Override public List<String> referencedAliases() { return List.of(); }

  public String qualifiedTable() {
    return schemaName == null ? tableName : schemaName + "." + tableName;
  }
}
