package io.intellixity.vista.pipeline;

import java.util.Locale;

public enum StepType {
  SOURCE,
  FILTER,
  JOIN,
  AGGREGATE,
  SELECT,
  SORT,
  UNION;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns null for unknown type names. */
  public static StepType tryParse(String raw) {
    if (raw == null) return null;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "source" -> SOURCE;
      case "filter" -> FILTER;
      case "join" -> JOIN;
      case "aggregate" -> AGGREGATE;
      case "select" -> SELECT;
      case "sort" -> SORT;
      case "union" -> UNION;
      default -> null;
    };
  }
}
