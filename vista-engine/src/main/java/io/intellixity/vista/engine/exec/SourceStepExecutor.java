package io.intellixity.vista.engine.exec;

import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.pipeline.config.SourceConfig;

import java.util.Map;

/** Loads a table; row caps are handed to the backend, never applied after a full load. */
final class SourceStepExecutor implements StepExecutor {
  @Override
  public NamedDataset execute(PlannedStep step, Map<String, NamedDataset> inputs, ExecutionContext context) {
    SourceConfig cfg = (SourceConfig) step.config();
    int cap = context.sourceRowCap(cfg.limit());
    return context.backendForSource(cfg.dataSourceId()).loadSource(cfg, step.outputAlias(), cap);
  }
}
