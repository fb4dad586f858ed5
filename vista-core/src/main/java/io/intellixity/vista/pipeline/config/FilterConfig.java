package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;
import io.intellixity.vista.query.FilterCondition;
import io.intellixity.vista.query.LogicalOperator;

import java.util.List;
import java.util.Objects;

public record FilterConfig(String input, List<FilterCondition> conditions, LogicalOperator logicalOperator)
    implements StepConfig {
  public FilterConfig {
    conditions = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
    if (conditions.isEmpty()) throw new IllegalArgumentException("conditions must not be empty");
    logicalOperator = (logicalOperator == null) ? LogicalOperator.AND : logicalOperator;
  }

  @Override public StepType type() { return StepType.FILTER; }
  @Override public List<String> referencedAliases() { return input == null ? List.of() : List.of(input); }
}
