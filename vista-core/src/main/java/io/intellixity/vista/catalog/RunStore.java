package io.intellixity.vista.catalog;

import io.intellixity.vista.run.PipelineRun;
import io.intellixity.vista.run.RunStatus;
import io.intellixity.vista.run.StepLogEntry;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of run records. Implementations must be thread-safe: runs complete on worker
 * threads while callers read them.
 */
public interface RunStore {
  PipelineRun create(PipelineRun run);

  /** Moves a queued run to running. */
  PipelineRun markRunning(String runId);

  /**
   * Records the single terminal transition of a run. A run that is already terminal is rejected
   * with {@link IllegalStateException}.
   */
  PipelineRun complete(String runId, RunStatus status, long rowsProcessed, double executionTimeSeconds,
                       List<StepLogEntry> log, String errorMessage);

  /** {@code success -> partial}; any other current state is rejected with {@link IllegalStateException}. */
  PipelineRun markPartial(String runId, String message);

  Optional<PipelineRun> get(String runId);

  /**
   * Runs of one pipeline, newest {@code startedAt} first, skipping {@code offset} and returning at
   * most {@code limit}. Query runs are never listed.
   */
  List<PipelineRun> listByPipeline(String pipelineId, int offset, int limit);
}
