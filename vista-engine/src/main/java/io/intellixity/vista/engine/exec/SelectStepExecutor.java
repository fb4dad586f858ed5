package io.intellixity.vista.engine.exec;

import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.pipeline.config.SelectConfig;

import java.util.Map;

final class SelectStepExecutor implements StepExecutor {
  @Override
  public NamedDataset execute(PlannedStep step, Map<String, NamedDataset> inputs, ExecutionContext context) {
    String in = step.inputs().get(0);
    return context.ownerOf(in).select(inputs.get(in), (SelectConfig) step.config(), step.outputAlias());
  }
}
