package io.intellixity.vista.engine.exec;

import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.pipeline.config.UnionConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class UnionStepExecutor implements StepExecutor {
  @Override
  public NamedDataset execute(PlannedStep step, Map<String, NamedDataset> inputs, ExecutionContext context) {
    List<NamedDataset> ordered = new ArrayList<>(step.inputs().size());
    for (String a : step.inputs()) ordered.add(inputs.get(a));
    return context.ownerOf(step.inputs().get(0)).union(ordered, (UnionConfig) step.config(), step.outputAlias());
  }
}
