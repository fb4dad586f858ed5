package io.intellixity.vista.engine.exec;

import io.intellixity.vista.catalog.DataSourceCatalog;
import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.RunOptions;
import io.intellixity.vista.engine.backend.BackendResolver;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.error.DataSourceException;
import io.intellixity.vista.error.ExecutionTimeoutException;
import io.intellixity.vista.pipeline.StepType;
import io.intellixity.vista.pipeline.config.SourceConfig;
import io.intellixity.vista.spi.backend.ExecutionBackend;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State of one pipeline run: the datasets produced so far, the backend that owns each of them and
 * the cancellation flag. Owned by a single worker thread; only {@link #cancel()} is called from
 * outside.
 */
public final class ExecutionContext {
  private final String runId;
  private final RunOptions options;
  private final int previewRowCap;
  private final DataSourceCatalog dataSources;
  private final BackendResolver backends;

  private final Map<String, NamedDataset> datasets = new HashMap<>();
  private final Map<String, ExecutionBackend> owners = new HashMap<>();
  private volatile boolean cancelled;

  public ExecutionContext(String runId, RunOptions options, int previewRowCap, DataSourceCatalog dataSources,
                          BackendResolver backends) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.options = Objects.requireNonNull(options, "options");
    this.previewRowCap = previewRowCap;
    this.dataSources = Objects.requireNonNull(dataSources, "dataSources");
    this.backends = Objects.requireNonNull(backends, "backends");
  }

  public String runId() { return runId; }
  public RunOptions options() { return options; }

  public NamedDataset dataset(String alias) {
    NamedDataset ds = datasets.get(alias);
    if (ds == null) throw new IllegalStateException("No dataset for alias '" + alias + "'");
    return ds;
  }

  public Map<String, NamedDataset> inputsOf(PlannedStep step) {
    Map<String, NamedDataset> out = new HashMap<>();
    for (String a : step.inputs()) out.put(a, dataset(a));
    return out;
  }

  /** Backend that produced {@code alias}; step operations on that dataset run there. */
  public ExecutionBackend ownerOf(String alias) {
    ExecutionBackend b = owners.get(alias);
    if (b == null) throw new IllegalStateException("No backend for alias '" + alias + "'");
    return b;
  }

  public ExecutionBackend backendForSource(String dataSourceId) {
    DataSourceDefinition ds = dataSources.resolve(dataSourceId)
        .orElseThrow(() -> new DataSourceException("Data source not found: " + dataSourceId));
    return backends.backendFor(ds);
  }

  /** Stores a step's output under its alias; the owner is the source backend or the first input's owner. */
  public void record(PlannedStep step, NamedDataset output) {
    ExecutionBackend owner = step.type() == StepType.SOURCE
        ? backendForSource(((SourceConfig) step.config()).dataSourceId())
        : ownerOf(step.inputs().get(0));
    datasets.put(step.outputAlias(), output);
    owners.put(step.outputAlias(), owner);
  }

  /**
   * Row cap for a source read: the smallest of the run limit, the preview cap (in preview mode)
   * and the step's own limit. 0 means uncapped.
   */
  public int sourceRowCap(Integer stepLimit) {
    int cap = 0;
    cap = tighter(cap, options.limit());
    if (options.previewMode()) cap = tighter(cap, previewRowCap);
    cap = tighter(cap, stepLimit);
    return cap;
  }

  private static int tighter(int current, Integer candidate) {
    if (candidate == null || candidate <= 0) return current;
    return current == 0 ? candidate : Math.min(current, candidate);
  }

  public void cancel() {
    cancelled = true;
  }

  public boolean cancelled() {
    return cancelled;
  }

  public void checkCancelled() {
    if (cancelled || Thread.currentThread().isInterrupted()) {
      throw new ExecutionTimeoutException("Run " + runId + " was cancelled");
    }
  }
}
