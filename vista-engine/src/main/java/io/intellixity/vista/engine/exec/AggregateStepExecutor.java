package io.intellixity.vista.engine.exec;

import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.pipeline.config.AggregateConfig;

import java.util.Map;

final class AggregateStepExecutor implements StepExecutor {
  @Override
  public NamedDataset execute(PlannedStep step, Map<String, NamedDataset> inputs, ExecutionContext context) {
    String in = step.inputs().get(0);
    return context.ownerOf(in).aggregate(inputs.get(in), (AggregateConfig) step.config(), step.outputAlias());
  }
}
