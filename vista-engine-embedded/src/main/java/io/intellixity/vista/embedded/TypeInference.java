package io.intellixity.vista.embedded;

import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.data.Values;
import io.intellixity.vista.error.SchemaException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Per-column type inference over raw cells.\n
 *
 * Candidates are tried in order: integer, float, boolean, date, timestamp, string. A column takes
 * the first candidate every non-empty cell satisfies; empty cells become null and do not vote.
 * A column with no values at all is a string column. Readers feed every row of a file to a
 * {@link Tracker}, including rows past a row cap, so a capped read types columns exactly as a
 * full read does.
 */
final class TypeInference {
  private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,18}");
  private static final Pattern FLOAT = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
  private static final List<ColumnType> ORDER = List.of(
      ColumnType.INTEGER, ColumnType.FLOAT, ColumnType.BOOLEAN, ColumnType.DATE, ColumnType.TIMESTAMP);

  private TypeInference() {}

  static NamedDataset toDataset(RawTable raw, String alias) {
    List<String> header = uniqueHeader(raw.header());
    int width = header.size();

    List<Column> columns = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      ColumnType t = (raw.types() != null) ? raw.types().get(c) : infer(columnCells(raw, c));
      columns.add(new Column(header.get(c), t));
    }

    List<Map<String, Object>> rows = new ArrayList<>(raw.cells().size());
    for (List<Object> cells : raw.cells()) {
      Map<String, Object> row = new LinkedHashMap<>(width * 2);
      for (int c = 0; c < width; c++) row.put(header.get(c), convert(cells.get(c), columns.get(c).type()));
      rows.add(row);
    }
    return new NamedDataset(alias, columns, rows);
  }

  static ColumnType infer(List<Object> cells) {
    Tracker t = new Tracker();
    for (Object v : cells) t.accept(Collections.singletonList(v));
    return t.type(0);
  }

  /** Narrows each column's candidate types one row at a time. */
  static final class Tracker {
    private final List<boolean[]> possible = new ArrayList<>();
    private final List<Boolean> hasValue = new ArrayList<>();

    void accept(List<Object> row) {
      for (int c = 0; c < row.size(); c++) {
        while (possible.size() <= c) {
          boolean[] all = new boolean[ORDER.size()];
          Arrays.fill(all, true);
          possible.add(all);
          hasValue.add(false);
        }
        Object v = blankToNull(row.get(c));
        if (v == null) continue;
        hasValue.set(c, true);
        boolean[] p = possible.get(c);
        for (int i = 0; i < p.length; i++) {
          if (p[i] && !fits(v, ORDER.get(i))) p[i] = false;
        }
      }
    }

    ColumnType type(int column) {
      if (column >= possible.size() || !hasValue.get(column)) return ColumnType.STRING;
      boolean[] p = possible.get(column);
      for (int i = 0; i < p.length; i++) {
        if (p[i]) return ORDER.get(i);
      }
      return ColumnType.STRING;
    }

    List<ColumnType> types(int width) {
      List<ColumnType> out = new ArrayList<>(width);
      for (int c = 0; c < width; c++) out.add(type(c));
      return out;
    }
  }

  static Object convert(Object cell, ColumnType type) {
    Object v = blankToNull(cell);
    if (v == null) return null;
    return switch (type) {
      case INTEGER -> (v instanceof String s) ? Long.parseLong(s.trim()) : ((Number) v).longValue();
      case FLOAT -> (v instanceof String s) ? Double.parseDouble(s.trim()) : ((Number) v).doubleValue();
      case BOOLEAN -> (v instanceof String s) ? Boolean.parseBoolean(s.trim()) : v;
      case DATE -> {
        if (v instanceof String s) yield LocalDate.parse(s.trim());
        if (v instanceof LocalDateTime ts) yield ts.toLocalDate();
        yield v;
      }
      case TIMESTAMP -> toTimestamp(v);
      default -> (v instanceof String s) ? s : String.valueOf(Values.normalize(v));
    };
  }

  private static boolean fits(Object v, ColumnType t) {
    if (v instanceof String s) {
      String x = s.trim();
      return switch (t) {
        case INTEGER -> INTEGER.matcher(x).matches();
        case FLOAT -> FLOAT.matcher(x).matches();
        case BOOLEAN -> x.equalsIgnoreCase("true") || x.equalsIgnoreCase("false");
        case DATE -> parses(() -> LocalDate.parse(x));
        case TIMESTAMP -> parses(() -> toTimestamp(x));
        default -> true;
      };
    }
    return switch (t) {
      case INTEGER -> (v instanceof Long || v instanceof Integer)
          || (v instanceof Double d && d == Math.rint(d) && Math.abs(d) < 1e15);
      case FLOAT -> v instanceof Number;
      case BOOLEAN -> v instanceof Boolean;
      case DATE -> v instanceof LocalDate || (v instanceof LocalDateTime ts && ts.toLocalTime().toSecondOfDay() == 0);
      case TIMESTAMP -> v instanceof LocalDate || v instanceof LocalDateTime;
      default -> true;
    };
  }

  private static LocalDateTime toTimestamp(Object v) {
    if (v instanceof LocalDateTime ts) return ts;
    if (v instanceof LocalDate d) return d.atStartOfDay();
    String s = String.valueOf(v).trim();
    if (s.length() == 10) return LocalDate.parse(s).atStartOfDay();
    return LocalDateTime.parse(s.replace(' ', 'T'));
  }

  private static boolean parses(Runnable r) {
    try {
      r.run();
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  private static Object blankToNull(Object v) {
    if (v instanceof String s && s.isBlank()) return null;
    return v;
  }

  private static List<Object> columnCells(RawTable raw, int c) {
    List<Object> out = new ArrayList<>(raw.cells().size());
    for (List<Object> row : raw.cells()) out.add(row.get(c));
    return out;
  }

  private static List<String> uniqueHeader(List<String> header) {
    Set<String> seen = new HashSet<>();
    List<String> out = new ArrayList<>(header.size());
    for (int i = 0; i < header.size(); i++) {
      String h = header.get(i) == null ? "" : header.get(i).trim();
      if (h.isEmpty()) h = "column_" + (i + 1);
      if (!seen.add(h)) throw new SchemaException("Duplicate column '" + h + "' in file header");
      out.add(h);
    }
    return out;
  }
}
