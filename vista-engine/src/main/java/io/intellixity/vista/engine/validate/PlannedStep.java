package io.intellixity.vista.engine.validate;

import io.intellixity.vista.pipeline.StepType;
import io.intellixity.vista.pipeline.config.StepConfig;

import java.util.List;
import java.util.Objects;

/**
 * A validated step with its inputs resolved to concrete aliases. For a join, {@code inputs} is
 * {@code [left, right]}; for a union, the sources in config order.
 */
public record PlannedStep(int order, String name, StepType type, StepConfig config, List<String> inputs,
                          String outputAlias) {
  public PlannedStep {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(outputAlias, "outputAlias");
    inputs = List.copyOf(inputs);
  }

  public String describe() {
    return "Step " + order + " (" + name + ")";
  }
}
