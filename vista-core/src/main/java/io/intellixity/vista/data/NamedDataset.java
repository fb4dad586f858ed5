package io.intellixity.vista.data;

import io.intellixity.vista.error.SchemaException;

import java.util.*;

/**
 * Tabular result of one step, addressed by its alias.\n
 *
 * Rows are maps keyed by column name; {@link #columns()} is the authoritative column order.
 * Instances are immutable once built.
 */
public final class NamedDataset {
  private final String alias;
  private final List<Column> columns;
  private final List<Map<String, Object>> rows;

  public NamedDataset(String alias, List<Column> columns, List<Map<String, Object>> rows) {
    this.alias = Objects.requireNonNull(alias, "alias");
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    List<Map<String, Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows != null) {
      for (Map<String, Object> r : rows) copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public static NamedDataset empty(String alias, List<Column> columns) {
    return new NamedDataset(alias, columns, List.of());
  }

  public String alias() { return alias; }
  public List<Column> columns() { return columns; }
  public List<Map<String, Object>> rows() { return rows; }
  public int rowCount() { return rows.size(); }

  public List<String> columnNames() {
    List<String> out = new ArrayList<>(columns.size());
    for (Column c : columns) out.add(c.name());
    return out;
  }

  public Optional<Column> column(String name) {
    for (Column c : columns) {
      if (c.name().equals(name)) return Optional.of(c);
    }
    return Optional.empty();
  }

  public Column requireColumn(String name, String usage) {
    return column(name).orElseThrow(() -> new SchemaException(
        "Column '" + name + "' not found in dataset '" + alias + "' (" + usage + "); available: " + columnNames()));
  }

  public NamedDataset withAlias(String newAlias) {
    if (alias.equals(newAlias)) return this;
    return new NamedDataset(newAlias, columns, rows);
  }

  /** First {@code limit} rows; a non-positive limit leaves the dataset untouched. */
  public NamedDataset limit(int limit) {
    if (limit <= 0 || rows.size() <= limit) return this;
    return new NamedDataset(alias, columns, rows.subList(0, limit));
  }

  /** Rows as ordered value lists following {@link #columns()}. */
  public List<List<Object>> rowValues() {
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) {
      List<Object> vals = new ArrayList<>(columns.size());
      for (Column c : columns) vals.add(r.get(c.name()));
      out.add(vals);
    }
    return out;
  }

  @Override
  public String toString() {
    return "NamedDataset{alias=" + alias + ", columns=" + columnNames() + ", rows=" + rows.size() + "}";
  }
}
