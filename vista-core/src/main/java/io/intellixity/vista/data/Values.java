package io.intellixity.vista.data;

import io.intellixity.vista.error.SchemaException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Cell value normalization and comparison shared by every backend.\n
 *
 * Normalized cell values are: {@code null}, {@link String}, {@link Long}, {@link Double},
 * {@link Boolean}, {@link LocalDate}, {@link LocalDateTime}. Anything else is rendered as a string.
 */
public final class Values {
  private Values() {}

  public static Object normalize(Object v) {
    if (v == null) return null;
    if (v instanceof String || v instanceof Long || v instanceof Double || v instanceof Boolean
        || v instanceof LocalDate || v instanceof LocalDateTime) {
      return v;
    }
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
    if (v instanceof BigInteger bi) return bi.bitLength() < 64 ? (Object) bi.longValue() : (Object) bi.doubleValue();
    if (v instanceof BigDecimal bd) {
      if (bd.scale() <= 0 && bd.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
          && bd.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) >= 0) {
        return bd.longValueExact();
      }
      return bd.doubleValue();
    }
    if (v instanceof Float f) return f.doubleValue();
    if (v instanceof Number n) return n.doubleValue();
    if (v instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof java.util.Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
    if (v instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    if (v instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof ZonedDateTime zdt) return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof Character c) return String.valueOf(c);
    return String.valueOf(v);
  }

  /**
   * Coerce a filter literal to the type of the column it is compared with.
   * Returns the normalized literal unchanged when no safe coercion exists.
   */
  public static Object coerce(Object literal, ColumnType target) {
    Object v = normalize(literal);
    if (v == null || target == null) return v;
    try {
      return switch (target) {
        case STRING -> (v instanceof String) ? v : String.valueOf(v);
        case INTEGER, FLOAT -> {
          if (v instanceof String s) {
            String t = s.trim();
            if (t.matches("[-+]?\\d+")) yield Long.parseLong(t);
            yield Double.parseDouble(t);
          }
          yield v;
        }
        case BOOLEAN -> {
          if (v instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) yield Boolean.TRUE;
            if ("false".equalsIgnoreCase(s.trim())) yield Boolean.FALSE;
          }
          yield v;
        }
        case DATE -> (v instanceof String s) ? parseTemporal(s.trim()) : v;
        case TIMESTAMP -> {
          Object t = (v instanceof String s) ? parseTemporal(s.trim()) : v;
          yield (t instanceof LocalDate d) ? d.atStartOfDay() : t;
        }
        default -> v;
      };
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new SchemaException("Value '" + literal + "' is not a valid " + target.id(), e);
    }
  }

  private static Object parseTemporal(String s) {
    if (s.length() <= 10) return LocalDate.parse(s);
    return LocalDateTime.parse(s.replace(' ', 'T'));
  }

  /** Equality with numeric widening (1 == 1.0); null is never equal to anything. */
  public static boolean sameValue(Object a, Object b) {
    if (a == null || b == null) return false;
    return compareNonNull(a, b) == 0;
  }

  /**
   * Compare two non-null normalized values. Numbers compare numerically across integer and float,
   * dates compare with timestamps at start of day. Incompatible types raise {@link SchemaException}.
   */
  public static int compareNonNull(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      if (x instanceof Long lx && y instanceof Long ly) return Long.compare(lx, ly);
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    if (a instanceof String x && b instanceof String y) return x.compareTo(y);
    if (a instanceof Boolean x && b instanceof Boolean y) return Boolean.compare(x, y);
    if (a instanceof LocalDate x && b instanceof LocalDate y) return x.compareTo(y);
    if (isTemporal(a) && isTemporal(b)) return asTimestamp(a).compareTo(asTimestamp(b));
    throw new SchemaException("Cannot compare " + typeName(a) + " with " + typeName(b));
  }

  /**
   * Total order for sorting: nulls are handled by the caller, mixed types fall back to
   * ordering by type then by string form so sorting never fails.
   */
  public static int compareForSort(Object a, Object b) {
    try {
      return compareNonNull(a, b);
    } catch (SchemaException e) {
      int byType = Integer.compare(rank(a), rank(b));
      return byType != 0 ? byType : String.valueOf(a).compareTo(String.valueOf(b));
    }
  }

  public static Double toDouble(Object v) {
    if (v == null) return null;
    if (v instanceof Number n) return n.doubleValue();
    throw new SchemaException("Expected a numeric value but got " + typeName(v));
  }

  /** Hash/equality key for grouping and de-duplication; 1 and 1.0 land on the same key. */
  public static Object groupKey(Object v) {
    if (v instanceof Double d && !d.isInfinite() && !d.isNaN() && d == Math.rint(d)
        && Math.abs(d) < 9.0e15) {
      return d.longValue();
    }
    return v;
  }

  public static List<Object> groupKey(Map<String, Object> row, List<String> columns) {
    List<Object> key = new ArrayList<>(columns.size());
    for (String c : columns) key.add(groupKey(row.get(c)));
    return key;
  }

  private static boolean isTemporal(Object v) {
    return v instanceof LocalDate || v instanceof LocalDateTime;
  }

  private static LocalDateTime asTimestamp(Object v) {
    return (v instanceof LocalDate d) ? d.atStartOfDay() : (LocalDateTime) v;
  }

  private static int rank(Object v) {
    if (v instanceof Boolean) return 0;
    if (v instanceof Number) return 1;
    if (isTemporal(v)) return 2;
    if (v instanceof String) return 3;
    return 4;
  }

  private static String typeName(Object v) {
    return ColumnType.ofValue(v).id() + "(" + v.getClass().getSimpleName() + ")";
  }
}
