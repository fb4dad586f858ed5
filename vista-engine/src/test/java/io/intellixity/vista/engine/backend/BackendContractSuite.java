package io.intellixity.vista.engine.backend;

import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.query.SemanticQueryCompiler;
import io.intellixity.vista.error.VistaException;
import io.intellixity.vista.pipeline.config.*;
import io.intellixity.vista.query.AggregationFunction;
import io.intellixity.vista.query.FilterCondition;
import io.intellixity.vista.query.FilterOperator;
import io.intellixity.vista.query.LogicalOperator;
import io.intellixity.vista.semantic.*;
import io.intellixity.vista.spi.backend.ExecutionBackend;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Operations every backend must answer identically. Subclasses expose two tables:\n
 *
 * <pre>
 * orders(id, customer_id, region, amount)     customers(customer_id, name)
 *   1, 10, North, 100.5                          10, Acme
 *   2, 11, South, 40                             11, Globex
 *   3, 10, North, 60
 *   4, 12, null,  10
 * </pre>
 */
abstract class BackendContractSuite {

  private static final EntityMetadata SALES = new EntityMetadata("sales", "Sales", "orders", null,
      List.of(new DimensionDef("region", "Region", "region", ColumnType.STRING)),
      List.of(
          new MeasureDef("revenue", "Revenue", "amount", AggregationFunction.SUM),
          new MeasureDef("orders", "Orders", "id", AggregationFunction.COUNT),
          new MeasureDef("avg", "Avg Amount", "amount", AggregationFunction.MEAN)));

  private final SemanticQueryCompiler compiler = new SemanticQueryCompiler(1000, 100_000);

  protected abstract ExecutionBackend backend();

  /** Data source id the tables live in. */
  protected abstract String dataSourceId();

  private NamedDataset load(String table) {
    return backend().loadSource(new SourceConfig(dataSourceId(), table), table, 0);
  }

  @Test
  void loadsProjectedAndCappedSource() {
    NamedDataset ds = backend().loadSource(
        new SourceConfig(dataSourceId(), "orders", null, List.of("region", "id"), null), "o", 2);
    assertEquals(List.of("region", "id"), ds.columnNames());
    assertEquals(2, ds.rowCount());
    assertEquals(ColumnType.INTEGER, ds.column("id").orElseThrow().type());
  }

  @Test
  void missingTableOrColumnIsReported() {
    assertThrows(VistaException.class, () -> load("no_such_table"));
    assertThrows(VistaException.class, () -> backend().loadSource(
        new SourceConfig(dataSourceId(), "orders", null, List.of("nope"), null), "o", 0));
  }

  @Test
  void filterJoinAggregateSortAgree() {
    ExecutionBackend b = backend();
    NamedDataset orders = load("orders");
    NamedDataset customers = load("customers");

    NamedDataset joined = b.join(orders, customers,
        new JoinConfig("orders", "customers", JoinType.LEFT, "customer_id", "customer_id", null, null), "j");
    assertEquals(4, joined.rowCount());
    assertEquals(List.of("id", "customer_id", "region", "amount", "name"), joined.columnNames());

    NamedDataset named = b.filter(joined, new FilterConfig("j", List.of(
        FilterCondition.of("name", FilterOperator.IS_NOT_NULL, null),
        FilterCondition.of("amount", FilterOperator.GE, 50)), LogicalOperator.AND), "f");
    assertEquals(2, named.rowCount());

    NamedDataset totals = b.aggregate(joined, new AggregateConfig("j", List.of("name"), List.of(
        new AggregationSpec("amount", AggregationFunction.SUM, "total"),
        new AggregationSpec("id", AggregationFunction.COUNT, "n"))), "a");
    NamedDataset sorted = b.sort(totals, new SortConfig("a", List.of("total"), List.of(false)), "s");
    assertEquals(List.of(
        List.of("Acme", 160.5, 2L),
        List.of("Globex", 40.0, 1L),
        Arrays.asList(null, 10.0, 1L)), sorted.rowValues());
  }

  @Test
  void selectAndUnionAgree() {
    ExecutionBackend b = backend();
    NamedDataset orders = load("orders");
    NamedDataset regions = b.select(orders, new SelectConfig("o", List.of("region"), Map.of("region", "area")), "r");
    NamedDataset all = b.union(List.of(regions, regions), new UnionConfig(List.of("r", "r2"), true), "u");
    assertEquals(List.of(List.of("North"), List.of("South"), Arrays.asList((Object) null)), all.rowValues());
    assertEquals(8, b.union(List.of(regions, regions), new UnionConfig(List.of("r", "r2"), false), "u").rowCount());
  }

  @Test
  void semanticQueryAgrees() {
    NamedDataset r = backend().runQuery(compiler.compile(
        new QueryRequest("sales", List.of("region"), List.of("revenue", "orders")), SALES, backend().sqlFlavor()), "q");

    assertEquals(List.of("region", "revenue", "orders"), r.columnNames());
    assertEquals(List.of(
        List.of("North", 160.5, 2L),
        List.of("South", 40.0, 1L),
        Arrays.asList(null, 10.0, 1L)), r.rowValues());
  }

  @Test
  void filteredSortedLimitedQueryAgrees() {
    QueryRequest req = new QueryRequest("sales", List.of("region"), List.of("avg"),
        List.of(new QueryFilter("region", "in", List.of("North", "South"))),
        List.of(new QuerySort("avg", "asc")), 1);
    NamedDataset r = backend().runQuery(compiler.compile(req, SALES, backend().sqlFlavor()), "q");
    assertEquals(List.of(List.of("South", 40.0)), r.rowValues());

    QueryRequest like = new QueryRequest("sales", List.of(), List.of("orders"),
        List.of(new QueryFilter("region", "startswith", "No")), List.of(), null);
    assertEquals(List.of(List.of(2L)), backend().runQuery(compiler.compile(like, SALES, backend().sqlFlavor()), "q").rowValues());
  }
}
