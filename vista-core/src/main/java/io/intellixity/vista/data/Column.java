package io.intellixity.vista.data;

import java.util.Objects;

public record Column(String name, ColumnType type) {
  public Column {
    Objects.requireNonNull(name, "name");
    type = (type == null) ? ColumnType.UNKNOWN : type;
  }

  public Column renamed(String newName) {
    return new Column(newName, type);
  }
}
