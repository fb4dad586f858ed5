package io.intellixity.vista.catalog;

import io.intellixity.vista.pipeline.PipelineDefinition;

import java.util.Optional;

public interface PipelineCatalog {
  Optional<PipelineDefinition> getPipeline(String id);
}
