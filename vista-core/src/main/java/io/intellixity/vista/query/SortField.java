package io.intellixity.vista.query;

import java.util.Locale;
import java.util.Objects;

public record SortField(String field, Direction direction) {
  public enum Direction {
    ASC,
    DESC;

    public static Direction parse(String raw) {
      if (raw == null || raw.isBlank()) return ASC;
      return switch (raw.trim().toUpperCase(Locale.ROOT)) {
        case "ASC", "ASCENDING" -> ASC;
        case "DESC", "DESCENDING" -> DESC;
        default -> throw new IllegalArgumentException("unknown sort direction '" + raw + "'");
      };
    }
  }

  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public boolean ascending() {
    return direction == Direction.ASC;
  }
}
