package io.intellixity.vista.engine.exec;

import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.validate.PlannedStep;

import java.util.Map;

/** Runs one planned step against the backend that owns its input(s). */
public interface StepExecutor {
  /**
   * @param inputs datasets named by {@link PlannedStep#inputs()}, keyed by alias
   * @return the step's output, named {@link PlannedStep#outputAlias()}
   */
  NamedDataset execute(PlannedStep step, Map<String, NamedDataset> inputs, ExecutionContext context);
}
