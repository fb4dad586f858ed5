package io.intellixity.vista.engine.exec;

import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.pipeline.config.JoinConfig;

import java.util.Map;

/** Joins {@code inputs[0]} (left) with {@code inputs[1]} (right) on the left input's backend. */
final class JoinStepExecutor implements StepExecutor {
  @Override
  public NamedDataset execute(PlannedStep step, Map<String, NamedDataset> inputs, ExecutionContext context) {
    String left = step.inputs().get(0);
    String right = step.inputs().get(1);
    return context.ownerOf(left)
        .join(inputs.get(left), inputs.get(right), (JoinConfig) step.config(), step.outputAlias());
  }
}
