package io.intellixity.vista.engine.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.embedded.EmbeddedBackendProvider;
import io.intellixity.vista.spi.backend.BackendContext;
import io.intellixity.vista.spi.backend.ConnectionPools;
import io.intellixity.vista.spi.backend.ExecutionBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class EmbeddedBackendContractTest extends BackendContractSuite {
  @TempDir
  Path dir;

  private ExecutionBackend backend;

  @BeforeEach
  void writeFiles() throws IOException {
    Files.writeString(dir.resolve("orders.csv"),
        "id,customer_id,region,amount\n1,10,North,100.5\n2,11,South,40\n3,10,North,60\n4,12,,10\n");
    Files.writeString(dir.resolve("customers.csv"), "customer_id,name\n10,Acme\n11,Globex\n");
    backend = new EmbeddedBackendProvider().create(
        new DataSourceDefinition("files", "csv", Map.of("directory", dir.toString())),
        BackendContext.defaults(ConnectionPools.none()));
  }

  @Override
  protected ExecutionBackend backend() {
    return backend;
  }

  @Override
  protected String dataSourceId() {
    return "files";
  }
}
