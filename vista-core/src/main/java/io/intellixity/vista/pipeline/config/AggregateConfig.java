package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;

import java.util.List;
import java.util.Objects;

public record AggregateConfig(String input, List<String> groupBy, List<AggregationSpec> aggregations)
    implements StepConfig {
  public AggregateConfig {
    groupBy = (groupBy == null) ? List.of() : List.copyOf(groupBy);
    aggregations = List.copyOf(Objects.requireNonNull(aggregations, "aggregations"));
    if (aggregations.isEmpty()) throw new IllegalArgumentException("aggregations must not be empty");
  }

  @Override public StepType type() { return StepType.AGGREGATE; }
  @Override public List<String> referencedAliases() { return input == null ? List.of() : List.of(input); }
}
