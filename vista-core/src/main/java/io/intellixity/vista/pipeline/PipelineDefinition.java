package io.intellixity.vista.pipeline;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;
import java.util.Objects;

/** Immutable snapshot of a pipeline; a run never observes later edits. */
@JsonDeserialize(using = PipelineJsonDeserializer.class)
public record PipelineDefinition(String id, String name, List<StepDefinition> steps) {
  public PipelineDefinition {
    Objects.requireNonNull(id, "id");
    name = (name == null) ? id : name;
    steps = (steps == null) ? List.of() : List.copyOf(steps);
  }
}
