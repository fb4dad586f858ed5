package io.intellixity.vista.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AggregationFunction {
  SUM("sum"),
  MEAN("mean"),
  MEDIAN("median"),
  MIN("min"),
  MAX("max"),
  COUNT("count"),
  STD("std"),
  VAR("var"),
  COUNT_DISTINCT("count_distinct");

  private final String id;

  AggregationFunction(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  /** True when the result is always floating point regardless of input type. */
  public boolean yieldsFloat() {
    return this == MEAN || this == MEDIAN || this == STD || this == VAR;
  }

  public boolean requiresNumeric() {
    return this == SUM || yieldsFloat();
  }

  public static AggregationFunction tryParse(String raw) {
    if (raw == null) return null;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "sum" -> SUM;
      case "mean", "avg", "average" -> MEAN;
      case "median" -> MEDIAN;
      case "min" -> MIN;
      case "max" -> MAX;
      case "count" -> COUNT;
      case "std", "stddev" -> STD;
      case "var", "variance" -> VAR;
      case "count_distinct", "countdistinct", "distinct_count" -> COUNT_DISTINCT;
      default -> null;
    };
  }

  @JsonCreator
  public static AggregationFunction parse(String raw) {
    AggregationFunction f = tryParse(raw);
    if (f == null) throw new IllegalArgumentException("unknown aggregation function '" + raw + "'");
    return f;
  }
}
