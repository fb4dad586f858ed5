package io.intellixity.vista.semantic;

import io.intellixity.vista.data.ColumnType;

import java.util.Objects;

public record DimensionDef(String id, String name, String sqlColumn, ColumnType dataType) {
  public DimensionDef {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sqlColumn, "sqlColumn");
    name = (name == null) ? id : name;
    dataType = (dataType == null) ? ColumnType.UNKNOWN : dataType;
  }
}
