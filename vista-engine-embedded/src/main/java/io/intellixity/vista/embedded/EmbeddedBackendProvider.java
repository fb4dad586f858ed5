package io.intellixity.vista.embedded;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.spi.backend.BackendContext;
import io.intellixity.vista.spi.backend.BackendProvider;
import io.intellixity.vista.spi.backend.ExecutionBackend;

import java.util.Set;

public final class EmbeddedBackendProvider implements BackendProvider {
  @Override
  public Set<String> types() {
    return Set.of("csv", "excel");
  }

  @Override
  public ExecutionBackend create(DataSourceDefinition dataSource, BackendContext context) {
    FileFormat format = dataSource.type().equals("excel") ? FileFormat.EXCEL : FileFormat.CSV;
    return new EmbeddedBackend(dataSource, format, context.fileCacheEntries(), context.fileCacheTtlMillis());
  }
}
