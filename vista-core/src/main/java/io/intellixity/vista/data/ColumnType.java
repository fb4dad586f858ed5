package io.intellixity.vista.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.Locale;

public enum ColumnType {
  STRING,
  INTEGER,
  FLOAT,
  BOOLEAN,
  DATE,
  TIMESTAMP,
  UNKNOWN;

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }

  public boolean isTemporal() {
    return this == DATE || this == TIMESTAMP;
  }

  /** Lenient parse of declared type names ("int", "varchar", "double precision", ...). */
  @JsonCreator
  public static ColumnType parse(String raw) {
    if (raw == null || raw.isBlank()) return UNKNOWN;
    String s = raw.trim().toLowerCase(Locale.ROOT);
    int paren = s.indexOf('(');
    if (paren > 0) s = s.substring(0, paren).trim();
    return switch (s) {
      case "string", "str", "text", "varchar", "char", "character varying", "object", "category", "uuid" -> STRING;
      case "integer", "int", "int4", "int8", "int64", "int32", "bigint", "smallint", "long" -> INTEGER;
      case "float", "float64", "float32", "double", "double precision", "real", "decimal", "numeric", "number" -> FLOAT;
      case "boolean", "bool" -> BOOLEAN;
      case "date" -> DATE;
      case "timestamp", "datetime", "datetime64", "timestamptz", "timestamp with time zone" -> TIMESTAMP;
      default -> UNKNOWN;
    };
  }

  /** Type of a single (already normalized) cell value; null yields {@link #UNKNOWN}. */
  public static ColumnType ofValue(Object v) {
    if (v == null) return UNKNOWN;
    if (v instanceof String) return STRING;
    if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) return INTEGER;
    if (v instanceof Number) return FLOAT;
    if (v instanceof Boolean) return BOOLEAN;
    if (v instanceof LocalDate) return DATE;
    if (v instanceof LocalDateTime || v instanceof Temporal) return TIMESTAMP;
    return UNKNOWN;
  }

  /** Least common type of two column types; used when merging inferred types. */
  public static ColumnType widen(ColumnType a, ColumnType b) {
    if (a == null || a == UNKNOWN) return b == null ? UNKNOWN : b;
    if (b == null || b == UNKNOWN || a == b) return a;
    if (a.isNumeric() && b.isNumeric()) return FLOAT;
    if (a.isTemporal() && b.isTemporal()) return TIMESTAMP;
    return STRING;
  }

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
