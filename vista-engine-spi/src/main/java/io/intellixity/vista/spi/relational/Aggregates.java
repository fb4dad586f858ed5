package io.intellixity.vista.spi.relational;

import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.Values;
import io.intellixity.vista.error.SchemaException;
import io.intellixity.vista.query.AggregationFunction;

import java.util.*;

/**
 * Aggregation of one column over one group.\n
 *
 * {@code count} counts every row of the group, nulls included; every other function ignores
 * nulls and yields null when nothing is left. std/var are sample statistics (n - 1).
 */
final class Aggregates {
  private Aggregates() {}

  static Object apply(AggregationFunction fn, String column, List<Map<String, Object>> rows) {
    return switch (fn) {
      case COUNT -> (long) rows.size();
      case COUNT_DISTINCT -> {
        Set<Object> seen = new HashSet<>();
        for (Map<String, Object> r : rows) {
          Object v = r.get(column);
          if (v != null) seen.add(Values.groupKey(v));
        }
        yield (long) seen.size();
      }
      case SUM -> sum(column, rows);
      case MEAN -> {
        List<Double> xs = numbers(column, rows);
        if (xs.isEmpty()) yield null;
        double total = 0;
        for (double x : xs) total += x;
        yield total / xs.size();
      }
      case MEDIAN -> {
        List<Double> xs = numbers(column, rows);
        if (xs.isEmpty()) yield null;
        Collections.sort(xs);
        int n = xs.size();
        yield (n % 2 == 1) ? xs.get(n / 2) : (xs.get(n / 2 - 1) + xs.get(n / 2)) / 2.0;
      }
      case VAR -> sampleVariance(numbers(column, rows));
      case STD -> {
        Double var = sampleVariance(numbers(column, rows));
        yield var == null ? null : Math.sqrt(var);
      }
      case MIN, MAX -> extreme(fn == AggregationFunction.MAX, column, rows);
    };
  }

  static ColumnType resultType(AggregationFunction fn, ColumnType input) {
    return switch (fn) {
      case COUNT, COUNT_DISTINCT -> ColumnType.INTEGER;
      case MEAN, MEDIAN, STD, VAR -> ColumnType.FLOAT;
      case SUM -> input == ColumnType.INTEGER ? ColumnType.INTEGER : (input == ColumnType.UNKNOWN ? ColumnType.UNKNOWN : ColumnType.FLOAT);
      case MIN, MAX -> input;
    };
  }

  static void checkApplicable(AggregationFunction fn, String column, ColumnType type) {
    if (fn.requiresNumeric() && type != ColumnType.UNKNOWN && !type.isNumeric()) {
      throw new SchemaException("Aggregation '" + fn.id() + "' needs a numeric column; '" + column + "' is " + type.id());
    }
  }

  private static Object sum(String column, List<Map<String, Object>> rows) {
    boolean any = false;
    boolean integral = true;
    long lsum = 0;
    double dsum = 0;
    for (Map<String, Object> r : rows) {
      Object v = r.get(column);
      if (v == null) continue;
      if (!(v instanceof Number n)) throw new SchemaException("Cannot sum non-numeric value in column '" + column + "'");
      any = true;
      if (integral && n instanceof Long l) {
        lsum = Math.addExact(lsum, l);
      } else {
        if (integral) dsum = lsum;
        integral = false;
        dsum += n.doubleValue();
      }
    }
    if (!any) return null;
    return integral ? (Object) lsum : (Object) dsum;
  }

  private static List<Double> numbers(String column, List<Map<String, Object>> rows) {
    List<Double> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) {
      Object v = r.get(column);
      if (v == null) continue;
      if (!(v instanceof Number n)) throw new SchemaException("Column '" + column + "' holds non-numeric value '" + v + "'");
      out.add(n.doubleValue());
    }
    return out;
  }

  private static Double sampleVariance(List<Double> xs) {
    int n = xs.size();
    if (n < 2) return null;
    double mean = 0;
    for (double x : xs) mean += x;
    mean /= n;
    double ss = 0;
    for (double x : xs) ss += (x - mean) * (x - mean);
    return ss / (n - 1);
  }

  private static Object extreme(boolean max, String column, List<Map<String, Object>> rows) {
    Object best = null;
    for (Map<String, Object> r : rows) {
      Object v = r.get(column);
      if (v == null) continue;
      if (best == null) {
        best = v;
        continue;
      }
      int c = Values.compareNonNull(v, best);
      if (max ? c > 0 : c < 0) best = v;
    }
    return best;
  }
}
