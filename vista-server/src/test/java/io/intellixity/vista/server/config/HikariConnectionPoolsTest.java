package io.intellixity.vista.server.config;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.engine.EngineSettings;
import io.intellixity.vista.error.DataSourceException;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class HikariConnectionPoolsTest {

  @Test
  void buildsUrlFromHostAndDatabase() {
    assertEquals("jdbc:postgresql://db:5432/sales", HikariConnectionPools.jdbcUrl(
        new DataSourceDefinition("pg", "postgresql", Map.of("host", "db", "database", "sales"))));
    assertEquals("jdbc:mysql://db:3307/sales", HikariConnectionPools.jdbcUrl(
        new DataSourceDefinition("my", "mysql", Map.of("host", "db", "port", 3307, "database", "sales"))));
    assertEquals("jdbc:h2:mem:x", HikariConnectionPools.jdbcUrl(
        new DataSourceDefinition("h", "jdbc", Map.of("jdbc_url", "jdbc:h2:mem:x"))));
  }

  @Test
  void rejectsIncompleteConfig() {
    assertThrows(DataSourceException.class, () -> HikariConnectionPools.jdbcUrl(
        new DataSourceDefinition("pg", "postgresql", Map.of("host", "db"))));
    assertThrows(DataSourceException.class, () -> HikariConnectionPools.jdbcUrl(
        new DataSourceDefinition("x", "jdbc", Map.of("host", "db", "database", "d"))));
  }

  @Test
  void sharesOnePoolPerDataSource() throws Exception {
    try (HikariConnectionPools pools = new HikariConnectionPools(new VistaProperties.Pool())) {
      DataSourceDefinition h2 = new DataSourceDefinition("h2", "jdbc",
          Map.of("jdbc_url", "jdbc:h2:mem:pools;DB_CLOSE_DELAY=-1", "username", "sa"));
      DataSource first = pools.pool(h2);
      assertSame(first, pools.pool(h2));
      assertEquals(1, pools.size());
      try (Connection c = first.getConnection()) {
        assertTrue(c.isValid(1));
      }
    }
  }

  @Test
  void propertiesDefaultsMatchEngineDefaults() {
    assertEquals(EngineSettings.defaults(), new VistaProperties().getEngine().toSettings());
  }
}
