package io.intellixity.vista.engine.query;

import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.Values;
import io.intellixity.vista.error.SchemaException;
import io.intellixity.vista.query.AggregationFunction;
import io.intellixity.vista.query.FilterCondition;
import io.intellixity.vista.query.FilterOperator;
import io.intellixity.vista.query.QueryValidationException;
import io.intellixity.vista.query.SortField;
import io.intellixity.vista.semantic.*;
import io.intellixity.vista.spi.query.CompiledQuery;
import io.intellixity.vista.spi.query.LogicalQuery;
import io.intellixity.vista.spi.query.MeasureColumn;
import io.intellixity.vista.spi.query.SqlFlavor;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Compiles a {@link QueryRequest} against an entity into one aggregate statement:\n
 *
 * <pre>
 * SELECT dims, AGG(col) AS alias, ... FROM table [WHERE ...] [GROUP BY dims] [ORDER BY ...] LIMIT n
 * </pre>
 *
 * Literal values are always bound ({@code :p1}, {@code :p2}, ...). Identifiers come from the
 * entity metadata only and must match {@code [A-Za-z_][A-Za-z0-9_.]*}. The same query is also
 * described as a {@link LogicalQuery} for backends that evaluate in process. Null ordering, the
 * LIKE escape and median support follow the target's {@link SqlFlavor}.
 */
public final class SemanticQueryCompiler {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

  private final int defaultLimit;
  private final int maxRows;

  public SemanticQueryCompiler(int defaultLimit, int maxRows) {
    if (defaultLimit <= 0 || maxRows <= 0) throw new IllegalArgumentException("limits must be > 0");
    this.defaultLimit = defaultLimit;
    this.maxRows = maxRows;
  }

  /** Binds collected while rendering, named in placeholder order. */
  private static final class RenderCtx {
    private int n = 1;
    private final List<Object> binds = new ArrayList<>();

    String add(Object value) {
      binds.add(value);
      return ":p" + (n++);
    }
  }

  public CompiledQuery compile(QueryRequest request, EntityMetadata entity) {
    return compile(request, entity, SqlFlavor.ANSI);
  }

  public CompiledQuery compile(QueryRequest request, EntityMetadata entity, SqlFlavor flavor) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(flavor, "flavor");
    if (request.measureIds().isEmpty()) throw new QueryValidationException("At least one measure is required");

    String table = ident(entity.primaryTable());
    Set<String> outputNames = new HashSet<>();

    List<DimensionDef> dims = new ArrayList<>();
    for (String id : request.dimensionIds()) {
      DimensionDef d = entity.dimension(id).orElseThrow(() -> notFound(id));
      ident(d.sqlColumn());
      if (!outputNames.add(d.sqlColumn())) throw new QueryValidationException("Duplicate output column '" + d.sqlColumn() + "'");
      dims.add(d);
    }

    List<MeasureDef> measures = new ArrayList<>();
    for (String id : request.measureIds()) {
      MeasureDef m = entity.measure(id).orElseThrow(() -> notFound(id));
      ident(m.baseColumn());
      if (m.aggregationFunction() == AggregationFunction.MEDIAN && !flavor.supportsMedian()) {
        throw new QueryValidationException("Measure '" + m.id() + "': median is not supported by this data source");
      }
      if (!outputNames.add(m.alias())) throw new QueryValidationException("Duplicate output column '" + m.alias() + "'");
      measures.add(m);
    }

    RenderCtx ctx = new RenderCtx();
    List<String> selectItems = new ArrayList<>();
    List<Column> resultColumns = new ArrayList<>();
    List<String> groupColumns = new ArrayList<>();
    for (DimensionDef d : dims) {
      selectItems.add(d.sqlColumn());
      groupColumns.add(d.sqlColumn());
      resultColumns.add(new Column(d.sqlColumn(), d.dataType()));
    }
    List<MeasureColumn> measureColumns = new ArrayList<>();
    for (MeasureDef m : measures) {
      selectItems.add(aggregateSql(m.aggregationFunction(), m.baseColumn()) + " AS " + m.alias());
      resultColumns.add(new Column(m.alias(), measureType(m.aggregationFunction())));
      measureColumns.add(new MeasureColumn(m.alias(), m.baseColumn(), m.aggregationFunction()));
    }

    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", selectItems))
        .append(" FROM ").append(table);

    List<FilterCondition> conditions = new ArrayList<>();
    List<String> predicates = new ArrayList<>();
    for (QueryFilter f : request.filters()) {
      DimensionDef d = entity.dimension(f.dimensionId()).orElseThrow(() -> notFound(f.dimensionId()));
      ident(d.sqlColumn());
      FilterCondition c = condition(d, f);
      conditions.add(c);
      predicates.add(predicateSql(c, ctx, flavor.likeEscape()));
    }
    if (!predicates.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", predicates));
    if (!groupColumns.isEmpty()) sql.append(" GROUP BY ").append(String.join(", ", groupColumns));

    List<SortField> sort = new ArrayList<>();
    for (QuerySort s : request.sort()) sort.add(sortField(s, entity, dims, measures));
    List<String> orderItems = new ArrayList<>();
    Set<String> ordered = new HashSet<>();
    for (SortField s : sort) {
      if (ordered.add(s.field())) orderItems.add(flavor.orderItem(s.field(), s.ascending()));
    }
    for (String g : groupColumns) {
      if (ordered.add(g)) orderItems.add(flavor.orderItem(g, true));
    }
    if (!orderItems.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", orderItems));

    int limit = effectiveLimit(request.limit());
    sql.append(" LIMIT ").append(limit);

    LogicalQuery logical = new LogicalQuery(entity.primaryTable(), groupColumns, measureColumns, conditions, sort, limit);
    return new CompiledQuery(sql.toString(), ctx.binds, resultColumns, logical);
  }

  int effectiveLimit(Integer requested) {
    int l = (requested == null) ? defaultLimit : requested;
    return Math.max(1, Math.min(l, maxRows));
  }

  private static String aggregateSql(AggregationFunction fn, String column) {
    return switch (fn) {
      case SUM -> "SUM(" + column + ")";
      case MEAN -> "AVG(CAST(" + column + " AS DOUBLE PRECISION))";
      case MEDIAN -> "PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY " + column + ")";
      case MIN -> "MIN(" + column + ")";
      case MAX -> "MAX(" + column + ")";
      case COUNT -> "COUNT(*)";
      case COUNT_DISTINCT -> "COUNT(DISTINCT " + column + ")";
      case STD -> "STDDEV_SAMP(CAST(" + column + " AS DOUBLE PRECISION))";
      case VAR -> "VAR_SAMP(CAST(" + column + " AS DOUBLE PRECISION))";
    };
  }

  private static ColumnType measureType(AggregationFunction fn) {
    return switch (fn) {
      case COUNT, COUNT_DISTINCT -> ColumnType.INTEGER;
      case MEAN, MEDIAN, STD, VAR -> ColumnType.FLOAT;
      case SUM, MIN, MAX -> ColumnType.UNKNOWN;
    };
  }

  private static FilterCondition condition(DimensionDef d, QueryFilter f) {
    FilterOperator op = FilterOperator.tryParse(f.operator());
    if (op == null) throw new QueryValidationException("Unknown operator '" + f.operator() + "' on '" + d.id() + "'");
    if (!op.takesValue()) return FilterCondition.of(d.sqlColumn(), op, null);
    if (f.value() == null) throw new QueryValidationException("Operator '" + op.symbol() + "' on '" + d.id() + "' requires a value");

    if (op.takesList()) {
      List<Object> raw = FilterCondition.of(d.sqlColumn(), op, f.value()).values();
      if (raw.isEmpty()) throw new QueryValidationException("Operator '" + op.symbol() + "' on '" + d.id() + "' requires a non-empty list");
      List<Object> coerced = new ArrayList<>(raw.size());
      for (Object v : raw) {
        if (v == null) throw new QueryValidationException("Operator '" + op.symbol() + "' on '" + d.id() + "' must not list null; use 'is null'");
        coerced.add(coerce(v, d));
      }
      return FilterCondition.of(d.sqlColumn(), op, coerced);
    }
    if (op.isStringMatch()) {
      if (d.dataType() != ColumnType.STRING && d.dataType() != ColumnType.UNKNOWN) {
        throw new QueryValidationException("Operator '" + op.symbol() + "' requires a string dimension; '" + d.id() + "' is " + d.dataType().id());
      }
      return FilterCondition.of(d.sqlColumn(), op, String.valueOf(f.value()));
    }
    return FilterCondition.of(d.sqlColumn(), op, coerce(f.value(), d));
  }

  private static Object coerce(Object value, DimensionDef d) {
    try {
      return Values.coerce(value, d.dataType());
    } catch (SchemaException e) {
      throw new QueryValidationException("Invalid value for '" + d.id() + "': " + e.getMessage(), e);
    }
  }

  private static String predicateSql(FilterCondition c, RenderCtx ctx, char esc) {
    String col = c.column();
    String escape = " ESCAPE '" + esc + "'";
    return switch (c.operator()) {
      case EQ -> col + " = " + ctx.add(c.value());
      case NE -> col + " <> " + ctx.add(c.value());
      case GT -> col + " > " + ctx.add(c.value());
      case GE -> col + " >= " + ctx.add(c.value());
      case LT -> col + " < " + ctx.add(c.value());
      case LE -> col + " <= " + ctx.add(c.value());
      case IN -> listSql(col, "IN", c.values(), ctx);
      case NOT_IN -> listSql(col, "NOT IN", c.values(), ctx);
      case CONTAINS -> col + " LIKE " + ctx.add("%" + escapeLike((String) c.value(), esc) + "%") + escape;
      case STARTS_WITH -> col + " LIKE " + ctx.add(escapeLike((String) c.value(), esc) + "%") + escape;
      case ENDS_WITH -> col + " LIKE " + ctx.add("%" + escapeLike((String) c.value(), esc)) + escape;
      case IS_NULL -> col + " IS NULL";
      case IS_NOT_NULL -> col + " IS NOT NULL";
    };
  }

  private static String listSql(String col, String op, List<Object> values, RenderCtx ctx) {
    List<String> ph = new ArrayList<>(values.size());
    for (Object v : values) ph.add(ctx.add(v));
    return col + " " + op + " (" + String.join(", ", ph) + ")";
  }

  static String escapeLike(String s, char esc) {
    String e = String.valueOf(esc);
    return s.replace(e, e + e).replace("%", e + "%").replace("_", e + "_");
  }

  private static SortField sortField(QuerySort s, EntityMetadata entity, List<DimensionDef> dims, List<MeasureDef> measures) {
    SortField.Direction dir;
    try {
      dir = SortField.Direction.parse(s.direction());
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Invalid sort direction '" + s.direction() + "' for '" + s.fieldId() + "'", e);
    }
    for (DimensionDef d : dims) if (d.id().equals(s.fieldId())) return new SortField(d.sqlColumn(), dir);
    for (MeasureDef m : measures) if (m.id().equals(s.fieldId())) return new SortField(m.alias(), dir);
    if (entity.dimension(s.fieldId()).isPresent() || entity.measure(s.fieldId()).isPresent()) {
      throw new QueryValidationException("Sort field '" + s.fieldId() + "' is not part of the query");
    }
    throw notFound(s.fieldId());
  }

  private static String ident(String name) {
    if (name == null || !IDENT.matcher(name).matches()) {
      throw new QueryValidationException("Invalid identifier '" + name + "' in entity metadata");
    }
    return name;
  }

  private static QueryValidationException notFound(String id) {
    return new QueryValidationException("entity field not found: " + id);
  }
}
