package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;
import io.intellixity.vista.query.SortField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Parallel {@code columns} / {@code ascending} lists; they must have the same length. */
public record SortConfig(String input, List<String> columns, List<Boolean> ascending) implements StepConfig {
  public SortConfig {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (columns.isEmpty()) throw new IllegalArgumentException("columns must not be empty");
    if (ascending == null || ascending.isEmpty()) {
      List<Boolean> all = new ArrayList<>();
      for (int i = 0; i < columns.size(); i++) all.add(Boolean.TRUE);
      ascending = List.copyOf(all);
    } else {
      ascending = List.copyOf(ascending);
    }
    if (ascending.size() != columns.size()) {
      throw new IllegalArgumentException("ascending has " + ascending.size() + " entries but columns has " + columns.size());
    }
  }

  public List<SortField> sortFields() {
    List<SortField> out = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      out.add(new SortField(columns.get(i), ascending.get(i) ? SortField.Direction.ASC : SortField.Direction.DESC));
    }
    return out;
  }

  @Override public StepType type() { return StepType.SORT; }
  @Override public List<String> referencedAliases() { return input == null ? List.of() : List.of(input); }
}
