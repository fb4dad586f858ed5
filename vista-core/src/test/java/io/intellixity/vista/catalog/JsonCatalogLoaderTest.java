package io.intellixity.vista.catalog;

import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.query.AggregationFunction;
import io.intellixity.vista.semantic.EntityMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JsonCatalogLoaderTest {

  @TempDir
  Path dir;

  @Test
  void loadsAllSectionsAndResolvesRelativeFilePaths() throws Exception {
    Path file = dir.resolve("catalog.json");
    Files.writeString(file, """
        {
          "data_sources": [
            { "id": "files", "type": "CSV", "connection_config": { "directory": "data" },
              "tables": [ { "table_name": "orders", "columns": [ { "name": "qty", "type": "integer" } ] } ] },
            { "id": "wh", "type": "postgresql", "certified": true,
              "connection_config": { "jdbc_url": "jdbc:postgresql://db/wh" },
              "tables": [ { "table_name": "orders" } ] }
          ],
          "entities": [
            { "id": "order", "name": "Order", "primary_table": "orders",
              "dimensions": [ { "id": "d1", "name": "Region", "sql_column": "region", "data_type": "string" } ],
              "measures": [ { "id": "m1", "name": "Total Sales", "base_column": "sales", "aggregation_function": "SUM" } ] }
          ],
          "pipelines": [ { "id": "p1", "steps": [] } ]
        }
        """);

    InMemoryCatalog catalog = new JsonCatalogLoader().load(file);

    DataSourceDefinition files = catalog.resolve("files").orElseThrow();
    assertEquals("csv", files.type());
    assertEquals(dir.resolve("data").toAbsolutePath().normalize().toString(), files.configString("directory"));
    assertEquals(ColumnType.INTEGER, files.table("orders", null).orElseThrow().column("qty").orElseThrow().type());

    // certified source wins for the shared table
    assertEquals("wh", catalog.findByTable("orders").orElseThrow().id());

    EntityMetadata order = catalog.getEntity("order").orElseThrow();
    assertEquals("region", order.dimension("d1").orElseThrow().sqlColumn());
    assertEquals(AggregationFunction.SUM, order.measure("m1").orElseThrow().aggregationFunction());
    assertEquals("total_sales", order.measure("m1").orElseThrow().alias());
    assertTrue(catalog.getPipeline("p1").isPresent());
  }

  @Test
  void findByTablePrefersFirstWhenNoneCertified() {
    InMemoryCatalog catalog = new InMemoryCatalog()
        .putDataSource(new DataSourceDefinition("a", "a", "csv", null,
            List.of(new TableSchema("t", null, null)), false))
        .putDataSource(new DataSourceDefinition("b", "b", "csv", null,
            List.of(new TableSchema("t", null, null)), false));
    assertEquals("a", catalog.findByTable("T").orElseThrow().id());
    assertTrue(catalog.findByTable("nope").isEmpty());
  }
}
