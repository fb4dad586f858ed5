package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;

import java.util.List;

/**
 * Typed configuration of one step. Implementations form a closed set, one per {@link StepType}.
 */
public interface StepConfig {
  StepType type();

  /**
   * Aliases this step names explicitly in its config. An empty list on a single-input step means
   * "the previous step"; the validator resolves that into the plan.
   */
  List<String> referencedAliases();
}
