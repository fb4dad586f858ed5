package io.intellixity.vista.engine;

import io.intellixity.vista.run.RunStatus;
import io.intellixity.vista.run.StepLogEntry;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a pipeline run. {@code data} is null unless the run succeeded.
 */
public record PipelineResult(String runId, String pipelineId, RunStatus status, long rowsProcessed,
                             double executionTimeSeconds, Data data, List<StepLogEntry> executionLog,
                             String errorMessage) {
  public PipelineResult {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(status, "status");
    executionLog = (executionLog == null) ? List.of() : List.copyOf(executionLog);
  }

  /** Final dataset as column names plus rows in column order. */
  public record Data(List<String> columns, List<List<Object>> rows) {
    public Data {
      columns = List.copyOf(columns);
      rows = List.copyOf(rows);
    }
  }
}
