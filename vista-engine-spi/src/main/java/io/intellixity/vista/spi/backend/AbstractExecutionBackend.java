package io.intellixity.vista.spi.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.pipeline.config.*;
import io.intellixity.vista.spi.relational.RowOperators;

import java.util.List;
import java.util.Objects;

/**
 * Base for backends whose step operations run on materialized datasets.\n
 *
 * Subclasses supply {@link #loadSource} and {@link #runQuery}; the relational step operations
 * default to {@link RowOperators} so every backend shares one definition of their semantics.
 */
public abstract class AbstractExecutionBackend implements ExecutionBackend {
  private final String id;
  private final DataSourceDefinition dataSource;

  protected AbstractExecutionBackend(String family, DataSourceDefinition dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.id = Objects.requireNonNull(family, "family") + ":" + dataSource.id();
  }

  @Override public String id() { return id; }
  @Override public DataSourceDefinition dataSource() { return dataSource; }

  @Override
  public NamedDataset filter(NamedDataset input, FilterConfig cfg, String alias) {
    return RowOperators.filter(input, cfg, alias);
  }

  @Override
  public NamedDataset join(NamedDataset left, NamedDataset right, JoinConfig cfg, String alias) {
    return RowOperators.join(left, right, cfg, alias);
  }

  @Override
  public NamedDataset aggregate(NamedDataset input, AggregateConfig cfg, String alias) {
    return RowOperators.aggregate(input, cfg, alias);
  }

  @Override
  public NamedDataset select(NamedDataset input, SelectConfig cfg, String alias) {
    return RowOperators.select(input, cfg, alias);
  }

  @Override
  public NamedDataset sort(NamedDataset input, SortConfig cfg, String alias) {
    return RowOperators.sort(input, cfg.sortFields(), alias);
  }

  @Override
  public NamedDataset union(List<NamedDataset> inputs, UnionConfig cfg, String alias) {
    return RowOperators.union(inputs, cfg.removeDuplicates(), alias);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + id + "}";
  }
}
