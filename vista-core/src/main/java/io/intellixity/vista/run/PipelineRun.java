package io.intellixity.vista.run;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Auditable record of one execution. Created when the run starts and completed exactly once;
 * the only later change is {@code success -> partial}.
 */
public record PipelineRun(String id, RunKind kind, String pipelineId, String entityId, RunStatus status,
                          Instant startedAt, Instant completedAt, long rowsProcessed, double executionTimeSeconds,
                          List<StepLogEntry> executionLog, String errorMessage) {
  public PipelineRun {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(status, "status");
    executionLog = (executionLog == null) ? List.of() : List.copyOf(executionLog);
  }

  public static PipelineRun queued(String id, RunKind kind, String pipelineId, String entityId, Instant startedAt) {
    return new PipelineRun(id, kind, pipelineId, entityId, RunStatus.QUEUED, startedAt, null, 0, 0, List.of(), null);
  }

  public PipelineRun withStatus(RunStatus newStatus) {
    return new PipelineRun(id, kind, pipelineId, entityId, newStatus, startedAt, completedAt, rowsProcessed,
        executionTimeSeconds, executionLog, errorMessage);
  }

  public PipelineRun completed(RunStatus finalStatus, Instant at, long rows, double seconds,
                               List<StepLogEntry> log, String error) {
    return new PipelineRun(id, kind, pipelineId, entityId, finalStatus, startedAt, at, rows, seconds, log, error);
  }

  public PipelineRun withError(RunStatus newStatus, String error) {
    return new PipelineRun(id, kind, pipelineId, entityId, newStatus, startedAt, completedAt, rowsProcessed,
        executionTimeSeconds, executionLog, error);
  }
}
