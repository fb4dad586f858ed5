package io.intellixity.vista.spi.query;

import io.intellixity.vista.query.AggregationFunction;

import java.util.Objects;

/** An aggregated output column of a compiled semantic query. */
public record MeasureColumn(String alias, String column, AggregationFunction function) {
  public MeasureColumn {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(function, "function");
  }
}
