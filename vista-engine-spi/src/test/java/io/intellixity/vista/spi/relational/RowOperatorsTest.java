package io.intellixity.vista.spi.relational;

import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.error.SchemaException;
import io.intellixity.vista.pipeline.config.*;
import io.intellixity.vista.query.*;
import io.intellixity.vista.spi.query.LogicalQuery;
import io.intellixity.vista.spi.query.MeasureColumn;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class RowOperatorsTest {

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  private static NamedDataset orders() {
    return new NamedDataset("orders",
        List.of(new Column("region", ColumnType.STRING), new Column("quantity", ColumnType.INTEGER),
            new Column("unit_price", ColumnType.FLOAT)),
        List.of(
            row("region", "North", "quantity", 10L, "unit_price", 800.0),
            row("region", "North", "quantity", 20L, "unit_price", 1000.0),
            row("region", "South", "quantity", 5L, "unit_price", 1500.0),
            row("region", null, "quantity", null, "unit_price", null)));
  }

  private static List<Object> col(NamedDataset ds, String name) {
    List<Object> out = new ArrayList<>();
    for (Map<String, Object> r : ds.rows()) out.add(r.get(name));
    return out;
  }

  @Test
  void greaterThanExcludesBoundaryAndNulls() {
    NamedDataset out = RowOperators.filter(orders(),
        List.of(FilterCondition.of("unit_price", FilterOperator.GT, 1000)), LogicalOperator.AND, "f");
    assertEquals(List.of(1500.0), col(out, "unit_price"));
    assertEquals("f", out.alias());
  }

  @Test
  void notEqualAndNotInDropNulls() {
    NamedDataset ne = RowOperators.filter(orders(),
        List.of(FilterCondition.of("region", FilterOperator.NE, "North")), LogicalOperator.AND, "f");
    assertEquals(List.of("South"), col(ne, "region"));

    NamedDataset nin = RowOperators.filter(orders(),
        List.of(FilterCondition.of("region", FilterOperator.NOT_IN, List.of("South"))), LogicalOperator.AND, "f");
    assertEquals(List.of("North", "North"), col(nin, "region"));
  }

  @Test
  void orCombinesFlatConditions() {
    NamedDataset out = RowOperators.filter(orders(), List.of(
        FilterCondition.of("quantity", FilterOperator.LE, 5),
        FilterCondition.of("region", FilterOperator.IS_NULL, null)), LogicalOperator.OR, "f");
    assertEquals(2, out.rowCount());
  }

  @Test
  void stringMatchIsCaseSensitiveAndRejectsNumericColumns() {
    NamedDataset out = RowOperators.filter(orders(),
        List.of(FilterCondition.of("region", FilterOperator.STARTS_WITH, "No")), LogicalOperator.AND, "f");
    assertEquals(2, out.rowCount());
    NamedDataset none = RowOperators.filter(orders(),
        List.of(FilterCondition.of("region", FilterOperator.CONTAINS, "north")), LogicalOperator.AND, "f");
    assertEquals(0, none.rowCount());

    SchemaException ex = assertThrows(SchemaException.class, () -> RowOperators.filter(orders(),
        List.of(FilterCondition.of("quantity", FilterOperator.CONTAINS, "1")), LogicalOperator.AND, "f"));
    assertTrue(ex.getMessage().contains("requires a string column"));
  }

  @Test
  void missingFilterColumnIsSchemaError() {
    SchemaException ex = assertThrows(SchemaException.class, () -> RowOperators.filter(orders(),
        List.of(FilterCondition.of("nope", FilterOperator.EQ, 1)), LogicalOperator.AND, "f"));
    assertTrue(ex.getMessage().contains("'nope' not found"));
  }

  @Test
  void aggregateSumsIgnoringNullsButCountIncludesThem() {
    NamedDataset out = RowOperators.aggregate(orders(), List.of("region"), List.of(
        new AggregationSpec("quantity", AggregationFunction.SUM, "total_quantity"),
        new AggregationSpec("quantity", AggregationFunction.COUNT, "n")), "agg");

    assertEquals(List.of("region", "total_quantity", "n"), out.columnNames());
    assertEquals(Arrays.asList("North", "South", null), col(out, "region"));
    assertEquals(Arrays.asList(30L, 5L, null), col(out, "total_quantity"));
    assertEquals(List.of(2L, 1L, 1L), col(out, "n"));
    assertEquals(ColumnType.INTEGER, out.column("total_quantity").orElseThrow().type());
  }

  @Test
  void aggregateStatisticsUseSampleFormulas() {
    NamedDataset out = RowOperators.aggregate(orders(), List.of(), List.of(
        new AggregationSpec("quantity", AggregationFunction.MEAN, null),
        new AggregationSpec("quantity", AggregationFunction.MEDIAN, null),
        new AggregationSpec("quantity", AggregationFunction.VAR, null),
        new AggregationSpec("quantity", AggregationFunction.MIN, null),
        new AggregationSpec("unit_price", AggregationFunction.MAX, null)), "agg");

    Map<String, Object> r = out.rows().get(0);
    assertEquals(1, out.rowCount());
    assertEquals(35.0 / 3, (Double) r.get("quantity_mean"), 1e-9);
    assertEquals(10.0, r.get("quantity_median"));
    assertEquals(58.333333333, (Double) r.get("quantity_var"), 1e-6);
    assertEquals(5L, r.get("quantity_min"));
    assertEquals(1500.0, r.get("unit_price_max"));
  }

  @Test
  void globalAggregateOverEmptyInputYieldsOneRow() {
    NamedDataset empty = NamedDataset.empty("e", List.of(new Column("x", ColumnType.INTEGER)));
    NamedDataset out = RowOperators.aggregate(empty, List.of(), List.of(
        new AggregationSpec("x", AggregationFunction.SUM, null),
        new AggregationSpec("x", AggregationFunction.COUNT, null)), "agg");
    assertEquals(1, out.rowCount());
    assertNull(out.rows().get(0).get("x_sum"));
    assertEquals(0L, out.rows().get(0).get("x_count"));
  }

  @Test
  void sumOnStringColumnIsSchemaError() {
    assertThrows(SchemaException.class, () -> RowOperators.aggregate(orders(), List.of(),
        List.of(new AggregationSpec("region", AggregationFunction.SUM, null)), "agg"));
  }

  @Test
  void sortIsStableWithNullsLast() {
    NamedDataset out = RowOperators.sort(orders(),
        List.of(new SortField("region", SortField.Direction.DESC)), "s");
    assertEquals(Arrays.asList("South", "North", "North", null), col(out, "region"));
    assertEquals(Arrays.asList(5L, 10L, 20L, null), col(out, "quantity"));
  }

  private static NamedDataset customers() {
    return new NamedDataset("customers",
        List.of(new Column("id", ColumnType.INTEGER), new Column("region", ColumnType.STRING)),
        List.of(row("id", 1L, "region", "EU"), row("id", 3L, "region", "US")));
  }

  private static NamedDataset sales() {
    return new NamedDataset("sales",
        List.of(new Column("customer_id", ColumnType.INTEGER), new Column("region", ColumnType.STRING)),
        List.of(row("customer_id", 1L, "region", "North"), row("customer_id", 2L, "region", "South")));
  }

  @Test
  void innerJoinDropsUnmatchedAndSuffixesCollisions() {
    NamedDataset out = RowOperators.join(sales(), customers(),
        new JoinConfig("sales", "customers", JoinType.INNER, "customer_id", "id"), "j");
    assertEquals(List.of("customer_id", "region_left", "id", "region_right"), out.columnNames());
    assertEquals(1, out.rowCount());
    assertEquals("EU", out.rows().get(0).get("region_right"));
  }

  @Test
  void leftRightAndOuterJoinKeepUnmatchedSides() {
    NamedDataset left = RowOperators.join(sales(), customers(),
        new JoinConfig("sales", "customers", JoinType.LEFT, "customer_id", "id"), "j");
    assertEquals(2, left.rowCount());
    assertNull(left.rows().get(1).get("id"));
    assertNull(left.rows().get(1).get("region_right"));

    NamedDataset right = RowOperators.join(sales(), customers(),
        new JoinConfig("sales", "customers", JoinType.RIGHT, "customer_id", "id"), "j");
    assertEquals(Arrays.asList(1L, null), col(right, "customer_id"));
    assertEquals(List.of(1L, 3L), col(right, "id"));

    NamedDataset outer = RowOperators.join(sales(), customers(),
        new JoinConfig("sales", "customers", JoinType.OUTER, "customer_id", "id"), "j");
    assertEquals(3, outer.rowCount());
  }

  @Test
  void sharedKeyNameAppearsOnceAndIsCoalesced() {
    NamedDataset a = new NamedDataset("a", List.of(new Column("k", ColumnType.INTEGER), new Column("x", ColumnType.STRING)),
        List.of(row("k", 1L, "x", "a1")));
    NamedDataset b = new NamedDataset("b", List.of(new Column("k", ColumnType.INTEGER), new Column("y", ColumnType.STRING)),
        List.of(row("k", 2L, "y", "b2")));
    NamedDataset out = RowOperators.join(a, b, new JoinConfig("a", "b", JoinType.OUTER, "k", "k"), "j");
    assertEquals(List.of("k", "x", "y"), out.columnNames());
    assertEquals(List.of(1L, 2L), col(out, "k"));
  }

  @Test
  void unionRemovesDuplicatesOnlyWhenAsked() {
    NamedDataset a = new NamedDataset("a", List.of(new Column("r", ColumnType.STRING), new Column("v", ColumnType.INTEGER)),
        List.of(row("r", "N", "v", 1L), row("r", "S", "v", 2L)));
    NamedDataset b = new NamedDataset("b", List.of(new Column("v", ColumnType.INTEGER), new Column("r", ColumnType.STRING)),
        List.of(row("v", 1L, "r", "N")));

    assertEquals(2, RowOperators.union(List.of(a, b), true, "u").rowCount());
    NamedDataset all = RowOperators.union(List.of(a, b), false, "u");
    assertEquals(3, all.rowCount());
    assertEquals(List.of("r", "v"), all.columnNames());
  }

  @Test
  void unionRejectsDifferentColumnSets() {
    NamedDataset a = new NamedDataset("a", List.of(new Column("r", ColumnType.STRING)), List.of());
    NamedDataset b = new NamedDataset("b", List.of(new Column("s", ColumnType.STRING)), List.of());
    SchemaException ex = assertThrows(SchemaException.class, () -> RowOperators.union(List.of(a, b), true, "u"));
    assertTrue(ex.getMessage().contains("same columns"));
  }

  @Test
  void selectProjectsAndRenames() {
    NamedDataset out = RowOperators.select(orders(),
        new SelectConfig("orders", List.of("quantity", "region"), Map.of("quantity", "qty")), "s");
    assertEquals(List.of("qty", "region"), out.columnNames());
    assertThrows(SchemaException.class, () -> RowOperators.select(orders(),
        new SelectConfig("orders", List.of("missing"), Map.of()), "s"));
  }

  @Test
  void evaluateMatchesGroupedSqlShape() {
    NamedDataset table = new NamedDataset("orders",
        List.of(new Column("region", ColumnType.STRING), new Column("sales", ColumnType.INTEGER)),
        List.of(row("region", "North", "sales", 100L), row("region", "South", "sales", 50L),
            row("region", "North", "sales", 50L)));
    LogicalQuery q = new LogicalQuery("orders", List.of("region"),
        List.of(new MeasureColumn("total_sales", "sales", AggregationFunction.SUM)),
        List.of(), List.of(new SortField("total_sales", SortField.Direction.DESC)), 1);

    NamedDataset out = RowOperators.evaluate(q, table, "q");
    assertEquals(1, out.rowCount());
    assertEquals("North", out.rows().get(0).get("region"));
    assertEquals(150L, out.rows().get(0).get("total_sales"));
  }
}
