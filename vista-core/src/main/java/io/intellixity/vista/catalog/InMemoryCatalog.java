package io.intellixity.vista.catalog;

import io.intellixity.vista.pipeline.PipelineDefinition;
import io.intellixity.vista.semantic.EntityMetadata;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Read-mostly catalog of pipelines, data sources and entities held in memory. */
public final class InMemoryCatalog implements PipelineCatalog, DataSourceCatalog, EntityCatalog {
  private final Map<String, PipelineDefinition> pipelines = new ConcurrentHashMap<>();
  private final Map<String, DataSourceDefinition> dataSources = new ConcurrentHashMap<>();
  private final Map<String, EntityMetadata> entities = new ConcurrentHashMap<>();
  // insertion order drives findByTable tie-breaking
  private final List<String> dataSourceOrder = Collections.synchronizedList(new ArrayList<>());

  public InMemoryCatalog() {}

  public InMemoryCatalog(Collection<PipelineDefinition> pipelines,
                         Collection<DataSourceDefinition> dataSources,
                         Collection<EntityMetadata> entities) {
    if (pipelines != null) pipelines.forEach(this::putPipeline);
    if (dataSources != null) dataSources.forEach(this::putDataSource);
    if (entities != null) entities.forEach(this::putEntity);
  }

  public InMemoryCatalog putPipeline(PipelineDefinition p) {
    Objects.requireNonNull(p, "pipeline");
    pipelines.put(p.id(), p);
    return this;
  }

  public InMemoryCatalog putDataSource(DataSourceDefinition ds) {
    Objects.requireNonNull(ds, "dataSource");
    if (dataSources.put(ds.id(), ds) == null) dataSourceOrder.add(ds.id());
    return this;
  }

  public InMemoryCatalog putEntity(EntityMetadata e) {
    Objects.requireNonNull(e, "entity");
    entities.put(e.id(), e);
    return this;
  }

  @Override
  public Optional<PipelineDefinition> getPipeline(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(pipelines.get(id));
  }

  @Override
  public Optional<DataSourceDefinition> resolve(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(dataSources.get(id));
  }

  @Override
  public Optional<DataSourceDefinition> findByTable(String tableName) {
    if (tableName == null) return Optional.empty();
    DataSourceDefinition fallback = null;
    synchronized (dataSourceOrder) {
      for (String id : dataSourceOrder) {
        DataSourceDefinition ds = dataSources.get(id);
        if (ds == null || ds.table(tableName, null).isEmpty()) continue;
        if (ds.certified()) return Optional.of(ds);
        if (fallback == null) fallback = ds;
      }
    }
    return Optional.ofNullable(fallback);
  }

  @Override
  public Optional<EntityMetadata> getEntity(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(entities.get(id));
  }

  public Collection<PipelineDefinition> pipelines() {
    return List.copyOf(pipelines.values());
  }
}
