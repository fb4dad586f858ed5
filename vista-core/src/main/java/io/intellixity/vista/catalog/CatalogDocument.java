package io.intellixity.vista.catalog;

import io.intellixity.vista.pipeline.PipelineDefinition;
import io.intellixity.vista.semantic.EntityMetadata;

import java.util.List;

/** On-disk shape of a catalog bootstrap file. */
public record CatalogDocument(List<DataSourceDefinition> dataSources, List<EntityMetadata> entities,
                              List<PipelineDefinition> pipelines) {
  public CatalogDocument {
    dataSources = (dataSources == null) ? List.of() : List.copyOf(dataSources);
    entities = (entities == null) ? List.of() : List.copyOf(entities);
    pipelines = (pipelines == null) ? List.of() : List.copyOf(pipelines);
  }
}
