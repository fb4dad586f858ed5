package io.intellixity.vista.query;

import java.util.Locale;

/** Closed set of filter operators understood by every backend. */
public enum FilterOperator {
  EQ("=="),
  NE("!="),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),
  IN("in"),
  NOT_IN("not in"),
  CONTAINS("contains"),
  STARTS_WITH("startswith"),
  ENDS_WITH("endswith"),
  IS_NULL("is null"),
  IS_NOT_NULL("is not null");

  private final String symbol;

  FilterOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** {@code is null} / {@code is not null} take no value. */
  public boolean takesValue() {
    return this != IS_NULL && this != IS_NOT_NULL;
  }

  public boolean takesList() {
    return this == IN || this == NOT_IN;
  }

  public boolean isStringMatch() {
    return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH;
  }

  public boolean isOrdering() {
    return this == GT || this == GE || this == LT || this == LE;
  }

  /** Parses both the symbolic spelling and the common SQL spellings. Returns null if unknown. */
  public static FilterOperator tryParse(String raw) {
    if (raw == null) return null;
    String s = raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    return switch (s) {
      case "==", "=", "eq", "equals" -> EQ;
      case "!=", "<>", "ne", "not equals" -> NE;
      case ">", "gt" -> GT;
      case ">=", "ge", "gte" -> GE;
      case "<", "lt" -> LT;
      case "<=", "le", "lte" -> LE;
      case "in" -> IN;
      case "not in", "not_in", "nin" -> NOT_IN;
      case "contains", "like" -> CONTAINS;
      case "startswith", "starts with", "starts_with" -> STARTS_WITH;
      case "endswith", "ends with", "ends_with" -> ENDS_WITH;
      case "is null", "is_null", "isnull" -> IS_NULL;
      case "is not null", "is_not_null", "notnull" -> IS_NOT_NULL;
      default -> null;
    };
  }

  public static FilterOperator parse(String raw) {
    FilterOperator op = tryParse(raw);
    if (op == null) throw new IllegalArgumentException("unknown operator '" + raw + "'");
    return op;
  }
}
