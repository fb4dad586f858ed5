package io.intellixity.vista.spi.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;

import java.util.Set;

/**
 * Creates {@link ExecutionBackend}s for the data source types it supports. Discovered through
 * {@code META-INF/vista.factories}; implementations need a public no-arg constructor.
 */
public interface BackendProvider {
  /** Lower-case data source types handled, e.g. {@code postgresql}, {@code csv}. */
  Set<String> types();

  ExecutionBackend create(DataSourceDefinition dataSource, BackendContext context);
}
