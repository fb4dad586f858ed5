package io.intellixity.vista.engine.validate;

import java.util.List;

/** Steps in execution order; the last step's output is the pipeline result. */
public record ResolvedPlan(String pipelineId, List<PlannedStep> steps) {
  public ResolvedPlan {
    steps = List.copyOf(steps);
    if (steps.isEmpty()) throw new IllegalArgumentException("plan has no steps");
  }

  public PlannedStep last() {
    return steps.get(steps.size() - 1);
  }
}
