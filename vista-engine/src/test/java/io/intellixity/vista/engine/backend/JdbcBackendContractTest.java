package io.intellixity.vista.engine.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.jdbc.JdbcBackendProvider;
import io.intellixity.vista.spi.backend.BackendContext;
import io.intellixity.vista.spi.backend.ExecutionBackend;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeAll;

import java.sql.Connection;
import java.sql.Statement;
import java.util.Map;

final class JdbcBackendContractTest extends BackendContractSuite {
  private static final JdbcDataSource H2 = new JdbcDataSource();
  private static final DataSourceDefinition WAREHOUSE = new DataSourceDefinition("wh", "postgresql", Map.of());

  @BeforeAll
  static void createTables() throws Exception {
    H2.setURL("jdbc:h2:mem:contract;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    try (Connection c = H2.getConnection(); Statement st = c.createStatement()) {
      st.execute("DROP TABLE IF EXISTS orders");
      st.execute("DROP TABLE IF EXISTS customers");
      st.execute("CREATE TABLE orders (id BIGINT, customer_id BIGINT, region VARCHAR(20), amount DOUBLE PRECISION)");
      st.execute("INSERT INTO orders VALUES (1, 10, 'North', 100.5), (2, 11, 'South', 40), (3, 10, 'North', 60), (4, 12, NULL, 10)");
      st.execute("CREATE TABLE customers (customer_id BIGINT, name VARCHAR(20))");
      st.execute("INSERT INTO customers VALUES (10, 'Acme'), (11, 'Globex')");
    }
  }

  @Override
  protected ExecutionBackend backend() {
    return new JdbcBackendProvider().create(WAREHOUSE, BackendContext.defaults(ds -> H2));
  }

  @Override
  protected String dataSourceId() {
    return "wh";
  }
}
