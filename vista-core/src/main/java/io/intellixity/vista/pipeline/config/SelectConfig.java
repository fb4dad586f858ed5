package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;

import java.util.*;

public record SelectConfig(String input, List<String> columns, Map<String, String> rename) implements StepConfig {
  public SelectConfig {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (columns.isEmpty()) throw new IllegalArgumentException("columns must not be empty");
    rename = (rename == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rename));
  }

  public String outputName(String column) {
    return rename.getOrDefault(column, column);
  }

  @Override public StepType type() { return StepType.SELECT; }
  @Override public List<String> referencedAliases() { return input == null ? List.of() : List.of(input); }
}
