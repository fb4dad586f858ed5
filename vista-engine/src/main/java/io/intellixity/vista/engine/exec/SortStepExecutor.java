package io.intellixity.vista.engine.exec;

import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.pipeline.config.SortConfig;

import java.util.Map;

final class SortStepExecutor implements StepExecutor {
  @Override
  public NamedDataset execute(PlannedStep step, Map<String, NamedDataset> inputs, ExecutionContext context) {
    String in = step.inputs().get(0);
    return context.ownerOf(in).sort(inputs.get(in), (SortConfig) step.config(), step.outputAlias());
  }
}
