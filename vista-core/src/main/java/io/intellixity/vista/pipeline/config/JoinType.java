package io.intellixity.vista.pipeline.config;

import java.util.Locale;

public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  OUTER;

  public boolean keepsLeftUnmatched() {
    return this == LEFT || this == OUTER;
  }

  public boolean keepsRightUnmatched() {
    return this == RIGHT || this == OUTER;
  }

  public static JoinType parse(String raw) {
    if (raw == null || raw.isBlank()) return INNER;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "inner" -> INNER;
      case "left", "left_outer" -> LEFT;
      case "right", "right_outer" -> RIGHT;
      case "outer", "full", "full_outer" -> OUTER;
      default -> throw new IllegalArgumentException("unknown join_type '" + raw + "'");
    };
  }
}
