package io.intellixity.vista.spi.relational;

import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.data.Values;
import io.intellixity.vista.error.SchemaException;
import io.intellixity.vista.pipeline.config.*;
import io.intellixity.vista.query.FilterCondition;
import io.intellixity.vista.query.FilterOperator;
import io.intellixity.vista.query.LogicalOperator;
import io.intellixity.vista.query.SortField;
import io.intellixity.vista.spi.query.LogicalQuery;
import io.intellixity.vista.spi.query.MeasureColumn;

import java.util.*;
import java.util.function.Predicate;

/**
 * In-process relational operators over materialized {@link NamedDataset}s.\n
 *
 * Every backend routes its step operations through here (or through SQL with the same semantics),
 * so these methods define the logical contract:\n
 * - comparisons against null are false; {@code !=} and {@code not in} also drop nulls\n
 * - sort is stable with nulls last in both directions\n
 * - aggregate output is ordered by group key ascending, nulls last\n
 */
public final class RowOperators {
  private RowOperators() {}

  public static NamedDataset filter(NamedDataset in, FilterConfig cfg, String alias) {
    return filter(in, cfg.conditions(), cfg.logicalOperator(), alias);
  }

  public static NamedDataset filter(NamedDataset in, List<FilterCondition> conditions, LogicalOperator op,
                                    String alias) {
    List<Predicate<Map<String, Object>>> preds = new ArrayList<>(conditions.size());
    for (FilterCondition c : conditions) preds.add(predicate(in, c));

    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> row : in.rows()) {
      if (matches(preds, op, row)) out.add(row);
    }
    return new NamedDataset(alias, in.columns(), out);
  }

  private static boolean matches(List<Predicate<Map<String, Object>>> preds, LogicalOperator op, Map<String, Object> row) {
    if (op == LogicalOperator.OR) {
      for (Predicate<Map<String, Object>> p : preds) if (p.test(row)) return true;
      return false;
    }
    for (Predicate<Map<String, Object>> p : preds) if (!p.test(row)) return false;
    return true;
  }

  static Predicate<Map<String, Object>> predicate(NamedDataset in, FilterCondition c) {
    Column col = in.requireColumn(c.column(), "filter");
    String name = col.name();
    FilterOperator op = c.operator();
    if (op.isStringMatch() && col.type() != ColumnType.STRING && col.type() != ColumnType.UNKNOWN) {
      throw new SchemaException("Operator '" + op.symbol() + "' requires a string column; '" + name + "' is " + col.type().id());
    }
    if (op.isOrdering() && col.type() == ColumnType.BOOLEAN) {
      throw new SchemaException("Operator '" + op.symbol() + "' is not valid for boolean column '" + name + "'");
    }

    return switch (op) {
      case IS_NULL -> row -> row.get(name) == null;
      case IS_NOT_NULL -> row -> row.get(name) != null;
      case EQ -> {
        Object lit = literal(c.value(), col);
        yield row -> Values.sameValue(row.get(name), lit);
      }
      case NE -> {
        Object lit = literal(c.value(), col);
        yield row -> row.get(name) != null && lit != null && !Values.sameValue(row.get(name), lit);
      }
      case GT, GE, LT, LE -> {
        Object lit = literal(c.value(), col);
        if (lit == null) throw new SchemaException("Operator '" + op.symbol() + "' on '" + name + "' requires a value");
        yield row -> {
          Object v = row.get(name);
          if (v == null) return false;
          int cmp = Values.compareNonNull(v, lit);
          return switch (op) {
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case LT -> cmp < 0;
            default -> cmp <= 0;
          };
        };
      }
      case IN, NOT_IN -> {
        Set<Object> keys = new HashSet<>();
        for (Object x : c.values()) {
          if (x == null) throw new SchemaException("Operator '" + op.symbol() + "' on '" + name + "' must not list null");
          keys.add(Values.groupKey(literal(x, col)));
        }
        boolean negate = op == FilterOperator.NOT_IN;
        yield row -> {
          Object v = row.get(name);
          if (v == null) return false;
          return keys.contains(Values.groupKey(v)) != negate;
        };
      }
      case CONTAINS, STARTS_WITH, ENDS_WITH -> {
        if (c.value() == null) throw new SchemaException("Operator '" + op.symbol() + "' on '" + name + "' requires a value");
        String needle = String.valueOf(c.value());
        yield row -> {
          Object v = row.get(name);
          if (v == null) return false;
          if (!(v instanceof String s)) {
            throw new SchemaException("Operator '" + op.symbol() + "' requires string values; '" + name + "' holds " + v.getClass().getSimpleName());
          }
          return switch (op) {
            case CONTAINS -> s.contains(needle);
            case STARTS_WITH -> s.startsWith(needle);
            default -> s.endsWith(needle);
          };
        };
      }
    };
  }

  private static Object literal(Object value, Column col) {
    return Values.coerce(value, col.type());
  }

  public static NamedDataset join(NamedDataset left, NamedDataset right, JoinConfig cfg, String alias) {
    Column lk = left.requireColumn(cfg.leftOn(), "join left_on");
    Column rk = right.requireColumn(cfg.rightOn(), "join right_on");
    boolean sharedKey = lk.name().equals(rk.name());

    Set<String> leftNames = new HashSet<>(left.columnNames());
    Set<String> rightNames = new HashSet<>(right.columnNames());
    if (sharedKey) rightNames.remove(rk.name());

    List<Column> cols = new ArrayList<>();
    List<String> leftOut = new ArrayList<>();
    for (Column c : left.columns()) {
      boolean clash = !(sharedKey && c.name().equals(lk.name())) && rightNames.contains(c.name());
      String out = clash ? c.name() + cfg.suffixLeft() : c.name();
      ColumnType t = (sharedKey && c.name().equals(lk.name())) ? ColumnType.widen(lk.type(), rk.type()) : c.type();
      cols.add(new Column(out, t));
      leftOut.add(out);
    }
    List<String> rightOut = new ArrayList<>();
    for (Column c : right.columns()) {
      if (sharedKey && c.name().equals(rk.name())) {
        rightOut.add(null);
        continue;
      }
      String out = leftNames.contains(c.name()) ? c.name() + cfg.suffixRight() : c.name();
      cols.add(new Column(out, c.type()));
      rightOut.add(out);
    }
    Set<String> seen = new HashSet<>();
    for (Column c : cols) {
      if (!seen.add(c.name())) throw new SchemaException("Join produces duplicate column '" + c.name() + "'; adjust suffixes");
    }

    Map<Object, List<Integer>> index = new HashMap<>();
    List<Map<String, Object>> rrows = right.rows();
    for (int i = 0; i < rrows.size(); i++) {
      Object k = rrows.get(i).get(rk.name());
      if (k == null) continue;
      index.computeIfAbsent(Values.groupKey(k), x -> new ArrayList<>()).add(i);
    }

    boolean[] matched = new boolean[rrows.size()];
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> lr : left.rows()) {
      Object k = lr.get(lk.name());
      List<Integer> hits = (k == null) ? List.of() : index.getOrDefault(Values.groupKey(k), List.of());
      if (hits.isEmpty()) {
        if (cfg.joinType().keepsLeftUnmatched()) out.add(combine(left, leftOut, lr, right, rightOut, null));
        continue;
      }
      for (int i : hits) {
        matched[i] = true;
        out.add(combine(left, leftOut, lr, right, rightOut, rrows.get(i)));
      }
    }
    if (cfg.joinType().keepsRightUnmatched()) {
      for (int i = 0; i < rrows.size(); i++) {
        if (matched[i]) continue;
        Map<String, Object> row = combine(left, leftOut, null, right, rightOut, rrows.get(i));
        if (sharedKey) row.put(lk.name(), rrows.get(i).get(rk.name()));
        out.add(row);
      }
    }
    return new NamedDataset(alias, cols, out);
  }

  private static Map<String, Object> combine(NamedDataset left, List<String> leftOut, Map<String, Object> lr,
                                             NamedDataset right, List<String> rightOut, Map<String, Object> rr) {
    Map<String, Object> row = new LinkedHashMap<>();
    List<Column> lc = left.columns();
    for (int i = 0; i < lc.size(); i++) row.put(leftOut.get(i), lr == null ? null : lr.get(lc.get(i).name()));
    List<Column> rc = right.columns();
    for (int i = 0; i < rc.size(); i++) {
      String out = rightOut.get(i);
      if (out == null) continue;
      row.put(out, rr == null ? null : rr.get(rc.get(i).name()));
    }
    return row;
  }

  public static NamedDataset aggregate(NamedDataset in, AggregateConfig cfg, String alias) {
    return aggregate(in, cfg.groupBy(), cfg.aggregations(), alias);
  }

  public static NamedDataset aggregate(NamedDataset in, List<String> groupBy, List<AggregationSpec> specs, String alias) {
    List<Column> cols = new ArrayList<>();
    for (String g : groupBy) cols.add(in.requireColumn(g, "group_by"));
    for (AggregationSpec s : specs) {
      Column src = in.requireColumn(s.column(), "aggregation");
      Aggregates.checkApplicable(s.function(), src.name(), src.type());
      cols.add(new Column(s.alias(), Aggregates.resultType(s.function(), src.type())));
    }

    LinkedHashMap<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    Map<List<Object>, Map<String, Object>> firstRow = new HashMap<>();
    for (Map<String, Object> r : in.rows()) {
      List<Object> key = Values.groupKey(r, groupBy);
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
      firstRow.putIfAbsent(key, r);
    }
    if (groupBy.isEmpty() && groups.isEmpty()) groups.put(List.of(), List.of());

    List<List<Object>> keys = new ArrayList<>(groups.keySet());
    keys.sort(RowOperators::compareKeys);

    List<Map<String, Object>> out = new ArrayList<>(keys.size());
    for (List<Object> key : keys) {
      List<Map<String, Object>> rows = groups.get(key);
      Map<String, Object> rep = firstRow.get(key);
      Map<String, Object> row = new LinkedHashMap<>();
      for (String g : groupBy) row.put(g, rep == null ? null : rep.get(g));
      for (AggregationSpec s : specs) row.put(s.alias(), Aggregates.apply(s.function(), s.column(), rows));
      out.add(row);
    }
    return new NamedDataset(alias, cols, out);
  }

  private static int compareKeys(List<Object> a, List<Object> b) {
    for (int i = 0; i < a.size(); i++) {
      int c = compareNullsLast(a.get(i), b.get(i), true);
      if (c != 0) return c;
    }
    return 0;
  }

  public static NamedDataset select(NamedDataset in, SelectConfig cfg, String alias) {
    List<Column> cols = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (String c : cfg.columns()) {
      Column src = in.requireColumn(c, "select");
      String out = cfg.outputName(c);
      if (!names.add(out)) throw new SchemaException("Select produces duplicate column '" + out + "'");
      cols.add(src.renamed(out));
    }
    List<Map<String, Object>> rows = new ArrayList<>(in.rowCount());
    for (Map<String, Object> r : in.rows()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (String c : cfg.columns()) row.put(cfg.outputName(c), r.get(c));
      rows.add(row);
    }
    return new NamedDataset(alias, cols, rows);
  }

  public static NamedDataset sort(NamedDataset in, List<SortField> fields, String alias) {
    for (SortField f : fields) in.requireColumn(f.field(), "sort");
    List<Map<String, Object>> rows = new ArrayList<>(in.rows());
    rows.sort((a, b) -> {
      for (SortField f : fields) {
        int c = compareNullsLast(a.get(f.field()), b.get(f.field()), f.ascending());
        if (c != 0) return c;
      }
      return 0;
    });
    return new NamedDataset(alias, in.columns(), rows);
  }

  /** Nulls sort last whatever the direction. */
  static int compareNullsLast(Object a, Object b, boolean ascending) {
    if (a == null && b == null) return 0;
    if (a == null) return 1;
    if (b == null) return -1;
    int c = Values.compareForSort(a, b);
    return ascending ? c : -c;
  }

  public static NamedDataset union(List<NamedDataset> inputs, boolean removeDuplicates, String alias) {
    if (inputs.size() < 2) throw new IllegalArgumentException("union needs at least 2 inputs");
    NamedDataset first = inputs.get(0);
    Set<String> expected = new HashSet<>(first.columnNames());
    Map<String, ColumnType> types = new LinkedHashMap<>();
    for (Column c : first.columns()) types.put(c.name(), c.type());
    for (NamedDataset ds : inputs.subList(1, inputs.size())) {
      if (!new HashSet<>(ds.columnNames()).equals(expected)) {
        throw new SchemaException("Union inputs must share the same columns: '" + first.alias() + "' has "
            + first.columnNames() + " but '" + ds.alias() + "' has " + ds.columnNames());
      }
      for (Column c : ds.columns()) types.merge(c.name(), c.type(), ColumnType::widen);
    }
    List<Column> cols = new ArrayList<>();
    for (Map.Entry<String, ColumnType> e : types.entrySet()) cols.add(new Column(e.getKey(), e.getValue()));
    List<String> names = first.columnNames();

    List<Map<String, Object>> out = new ArrayList<>();
    Set<List<Object>> seen = new HashSet<>();
    for (NamedDataset ds : inputs) {
      for (Map<String, Object> r : ds.rows()) {
        if (removeDuplicates && !seen.add(Values.groupKey(r, names))) continue;
        Map<String, Object> row = new LinkedHashMap<>();
        for (String n : names) row.put(n, r.get(n));
        out.add(row);
      }
    }
    return new NamedDataset(alias, cols, out);
  }

  /**
   * Evaluates a compiled semantic query against a fully loaded table. Mirrors the SQL form:
   * WHERE (flat AND), GROUP BY, ORDER BY, LIMIT.
   */
  public static NamedDataset evaluate(LogicalQuery q, NamedDataset table, String alias) {
    NamedDataset filtered = q.filters().isEmpty()
        ? table
        : filter(table, q.filters(), LogicalOperator.AND, alias);
    List<AggregationSpec> specs = new ArrayList<>();
    for (MeasureColumn m : q.measures()) specs.add(new AggregationSpec(m.column(), m.function(), m.alias()));
    NamedDataset grouped = aggregate(filtered, q.groupColumns(), specs, alias);
    List<SortField> order = new ArrayList<>(q.sort());
    for (String g : q.groupColumns()) order.add(new SortField(g, SortField.Direction.ASC));
    NamedDataset sorted = sort(grouped, order, alias);
    return sorted.limit(q.limit());
  }
}
