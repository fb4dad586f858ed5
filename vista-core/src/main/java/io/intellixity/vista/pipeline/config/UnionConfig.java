package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;

import java.util.List;
import java.util.Objects;

public record UnionConfig(List<String> sources, boolean removeDuplicates) implements StepConfig {
  public UnionConfig {
    sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    if (sources.size() < 2) throw new IllegalArgumentException("union needs at least 2 sources");
  }

  @Override public StepType type() { return StepType.UNION; }
  @Override public List<String> referencedAliases() { return sources; }
}
