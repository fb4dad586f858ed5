package io.intellixity.vista.embedded;

import io.intellixity.vista.data.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Header plus untyped cells as read from a file. CSV cells are strings; Excel cells may already be
 * numbers, booleans or dates. Short rows are padded with nulls. {@code types}, when present, were
 * inferred over every row of the file, not only the kept {@code cells}.
 */
record RawTable(List<String> header, List<List<Object>> cells, List<ColumnType> types) {
  RawTable {
    header = List.copyOf(header);
    if (types != null && types.size() != header.size()) {
      throw new IllegalArgumentException("types must match the header width");
    }
    types = (types == null) ? null : List.copyOf(types);
    List<List<Object>> padded = new ArrayList<>(cells.size());
    for (List<Object> row : cells) {
      List<Object> r = new ArrayList<>(Objects.requireNonNull(row, "row"));
      while (r.size() < header.size()) r.add(null);
      padded.add(Collections.unmodifiableList(r.subList(0, header.size())));
    }
    cells = Collections.unmodifiableList(padded);
  }

  RawTable(List<String> header, List<List<Object>> cells) {
    this(header, cells, null);
  }

  /** Header names for files without one: {@code column_1}, {@code column_2}, ... */
  static List<String> generatedHeader(int width) {
    List<String> out = new ArrayList<>(width);
    for (int i = 1; i <= width; i++) out.add("column_" + i);
    return out;
  }
}
