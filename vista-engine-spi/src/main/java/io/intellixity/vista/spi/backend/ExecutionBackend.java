package io.intellixity.vista.spi.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.pipeline.config.*;
import io.intellixity.vista.spi.query.CompiledQuery;
import io.intellixity.vista.spi.query.SqlFlavor;

import java.util.List;

/**
 * Backend Adapter: one per data source. Step executors and the orchestrator only talk to this
 * interface, never to a concrete backend.\n
 *
 * Every implementation must give identical logical results for identical operations.
 */
public interface ExecutionBackend extends AutoCloseable {
  /** Stable id, unique per data source (used in logs and caches). */
  String id();

  DataSourceDefinition dataSource();

  /**
   * Loads a table. {@code rowCap > 0} must be enforced by the backend itself (SQL {@code LIMIT} or
   * a capped reader), never by truncating a full load.
   */
  NamedDataset loadSource(SourceConfig cfg, String alias, int rowCap);

  NamedDataset filter(NamedDataset input, FilterConfig cfg, String alias);

  NamedDataset join(NamedDataset left, NamedDataset right, JoinConfig cfg, String alias);

  NamedDataset aggregate(NamedDataset input, AggregateConfig cfg, String alias);

  NamedDataset select(NamedDataset input, SelectConfig cfg, String alias);

  NamedDataset sort(NamedDataset input, SortConfig cfg, String alias);

  NamedDataset union(List<NamedDataset> inputs, UnionConfig cfg, String alias);

  /** SQL flavour semantic queries are compiled with for this backend. */
  default SqlFlavor sqlFlavor() {
    return SqlFlavor.ANSI;
  }

  /** Runs a compiled semantic query as a single statement. */
  NamedDataset runQuery(CompiledQuery query, String alias);

  @Override
  default void close() {}
}
