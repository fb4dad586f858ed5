package io.intellixity.vista.query;

import java.util.Locale;

/** Flat combination of filter conditions. Nested grouping is not supported. */
public enum LogicalOperator {
  AND,
  OR;

  public static LogicalOperator parse(String raw) {
    if (raw == null || raw.isBlank()) return AND;
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "AND" -> AND;
      case "OR" -> OR;
      default -> throw new IllegalArgumentException("unknown logical_operator '" + raw + "'");
    };
  }
}
