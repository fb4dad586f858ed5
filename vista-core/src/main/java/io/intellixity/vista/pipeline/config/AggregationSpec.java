package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.query.AggregationFunction;

import java.util.Objects;

/** One aggregated output column; the alias defaults to {@code <column>_<function>}. */
public record AggregationSpec(String column, AggregationFunction function, String alias) {
  public AggregationSpec {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(function, "function");
    alias = (alias == null || alias.isBlank()) ? column + "_" + function.id() : alias;
  }
}
