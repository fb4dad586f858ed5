package io.intellixity.vista.engine;

import io.intellixity.vista.catalog.*;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.engine.backend.BackendResolver;
import io.intellixity.vista.engine.exec.ExecutionContext;
import io.intellixity.vista.engine.exec.StepExecutionException;
import io.intellixity.vista.engine.exec.StepExecutors;
import io.intellixity.vista.engine.query.SemanticQueryCompiler;
import io.intellixity.vista.engine.validate.*;
import io.intellixity.vista.error.DataSourceException;
import io.intellixity.vista.error.ExecutionTimeoutException;
import io.intellixity.vista.error.NotFoundException;
import io.intellixity.vista.pipeline.PipelineDefinition;
import io.intellixity.vista.query.QueryValidationException;
import io.intellixity.vista.run.*;
import io.intellixity.vista.semantic.EntityMetadata;
import io.intellixity.vista.semantic.QueryRequest;
import io.intellixity.vista.semantic.QueryResult;
import io.intellixity.vista.spi.backend.ExecutionBackend;
import io.intellixity.vista.spi.query.CompiledQuery;
import io.intellixity.vista.spi.query.SqlFlavor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the engine: validates and runs pipelines, compiles and runs semantic queries, and
 * keeps the run record of every execution.\n
 *
 * Runs execute on a bounded worker pool; the calling thread waits for the outcome up to the run's
 * hard timeout. The calling thread writes the terminal state of the run, so a worker that is still
 * busy after a timeout can never overwrite it.\n
 *
 * Run lifecycle: {@code queued -> running -> success | failed}, and {@code success -> partial} via
 * {@link #reportDeliveryFailure}.
 */
public final class ExecutionOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

  private final PipelineCatalog pipelines;
  private final DataSourceCatalog dataSources;
  private final EntityCatalog entities;
  private final RunStore runs;
  private final BackendResolver backends;
  private final EngineSettings settings;
  private final Clock clock;

  private final StepGraphValidator validator;
  private final SemanticQueryCompiler compiler;
  private final ExecutorService workers;

  public ExecutionOrchestrator(PipelineCatalog pipelines, DataSourceCatalog dataSources, EntityCatalog entities,
                               RunStore runs, BackendResolver backends, EngineSettings settings, Clock clock) {
    this.pipelines = Objects.requireNonNull(pipelines, "pipelines");
    this.dataSources = Objects.requireNonNull(dataSources, "dataSources");
    this.entities = Objects.requireNonNull(entities, "entities");
    this.runs = Objects.requireNonNull(runs, "runs");
    this.backends = Objects.requireNonNull(backends, "backends");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.validator = new StepGraphValidator(dataSources);
    this.compiler = new SemanticQueryCompiler(settings.defaultQueryLimit(), settings.maxQueryRows());
    this.workers = Executors.newFixedThreadPool(settings.workerPoolSize(), workerThreads());
  }

  public ValidationResult validate(String pipelineId) {
    return validator.validate(pipeline(pipelineId));
  }

  /**
   * Validates then runs a pipeline. An invalid pipeline throws {@link PipelineValidationException}
   * and creates no run; any later failure is reported in the result with status {@code failed}.
   */
  public PipelineResult executePipeline(String pipelineId, RunOptions options) {
    Objects.requireNonNull(options, "options");
    PipelineDefinition pipeline = pipeline(pipelineId);
    ValidationResult validation = validator.validate(pipeline);
    if (!validation.valid()) throw new PipelineValidationException(pipelineId, validation);
    ResolvedPlan plan = validation.plan();

    String runId = newRunId();
    runs.create(PipelineRun.queued(runId, RunKind.PIPELINE, pipelineId, null, clock.instant()));
    ExecutionContext ctx = new ExecutionContext(runId, options, settings.previewRowCap(), dataSources, backends);
    StepTrace trace = new StepTrace(plan);
    log.info("vista.run start runId={} kind=pipeline pipelineId={} steps={} preview={} limit={}",
        runId, pipelineId, plan.steps().size(), options.previewMode(), options.limit());

    Duration timeout = options.previewMode() ? settings.previewTimeout() : settings.runTimeout();
    long start = System.nanoTime();
    PlanOutcome outcome = await(() -> runPlan(plan, ctx, trace), timeout, ctx);
    double seconds = elapsedSeconds(start);

    if (outcome.error() != null) {
      runs.complete(runId, RunStatus.FAILED, 0, seconds, trace.finish(), outcome.error());
      log.warn("vista.run failed runId={} pipelineId={} seconds={} error={}", runId, pipelineId, seconds, outcome.error());
      return new PipelineResult(runId, pipelineId, RunStatus.FAILED, 0, seconds, null, trace.finish(), outcome.error());
    }

    NamedDataset out = outcome.output();
    int finalCap = ctx.sourceRowCap(null);
    if (finalCap > 0) out = out.limit(finalCap);
    runs.complete(runId, RunStatus.SUCCESS, out.rowCount(), seconds, trace.finish(), null);
    log.info("vista.run done runId={} pipelineId={} status=success rows={} seconds={}",
        runId, pipelineId, out.rowCount(), seconds);
    return new PipelineResult(runId, pipelineId, RunStatus.SUCCESS, out.rowCount(), seconds,
        new PipelineResult.Data(out.columnNames(), out.rowValues()), trace.finish(), null);
  }

  /**
   * Compiles and runs one semantic query. Unknown entities and invalid requests throw
   * {@link QueryValidationException} before a run exists; a query run ends {@code success} or
   * {@code failed}.
   */
  public QueryResult executeQuery(QueryRequest request) {
    Objects.requireNonNull(request, "request");
    EntityMetadata entity = entities.getEntity(request.entityId())
        .orElseThrow(() -> new QueryValidationException("Entity not found: " + request.entityId()));
    CompiledQuery query = compiler.compile(request, entity);

    String runId = newRunId();
    runs.create(PipelineRun.queued(runId, RunKind.QUERY, null, entity.id(), clock.instant()));
    ExecutionContext ctx = new ExecutionContext(runId, RunOptions.full(), settings.previewRowCap(), dataSources, backends);
    if (log.isDebugEnabled()) {
      log.debug("vista.run start runId={} kind=query entityId={} bindCount={} sql={}",
          runId, entity.id(), query.binds().size(), query.sql());
    }

    AtomicReference<CompiledQuery> sent = new AtomicReference<>(query);
    long start = System.nanoTime();
    PlanOutcome outcome = await(() -> runQuery(request, entity, sent, ctx), settings.runTimeout(), ctx);
    double seconds = elapsedSeconds(start);

    if (outcome.error() != null) {
      runs.complete(runId, RunStatus.FAILED, 0, seconds, List.of(), outcome.error());
      log.warn("vista.run failed runId={} entityId={} seconds={} error={}", runId, entity.id(), seconds, outcome.error());
      return new QueryResult(runId, RunStatus.FAILED, entity.name(), query.resultColumnNames(), List.of(), 0,
          sent.get().sql(), seconds, outcome.error());
    }
    NamedDataset out = outcome.output();
    runs.complete(runId, RunStatus.SUCCESS, out.rowCount(), seconds, List.of(), null);
    log.info("vista.run done runId={} entityId={} status=success rows={} seconds={}", runId, entity.id(), out.rowCount(), seconds);
    return new QueryResult(runId, RunStatus.SUCCESS, entity.name(), out.columnNames(), out.rowValues(), out.rowCount(),
        sent.get().sql(), seconds, null);
  }

  /** Records a delivery failure against a successful run, moving it to {@code partial}. */
  public PipelineRun reportDeliveryFailure(String runId, String message) {
    PipelineRun run = runs.markPartial(runId, message == null || message.isBlank() ? "Delivery failed" : message);
    log.warn("vista.run partial runId={} message={}", runId, run.errorMessage());
    return run;
  }

  public PipelineRun getRun(String runId) {
    return runs.get(runId).orElseThrow(() -> new NotFoundException("run", runId));
  }

  /** Run history of an existing pipeline, newest first; the head is its last run. */
  public List<PipelineRun> listRuns(String pipelineId, int offset, int limit) {
    pipeline(pipelineId);
    return runs.listByPipeline(pipelineId, offset, limit);
  }

  @Override
  public void close() {
    workers.shutdownNow();
  }

  private PipelineDefinition pipeline(String pipelineId) {
    return pipelines.getPipeline(pipelineId).orElseThrow(() -> new NotFoundException("pipeline", pipelineId));
  }

  private PlanOutcome runPlan(ResolvedPlan plan, ExecutionContext ctx, StepTrace trace) {
    if (!start(ctx)) return PlanOutcome.failed("Run " + ctx.runId() + " was cancelled before it started");

    for (PlannedStep step : plan.steps()) {
      long t0 = System.nanoTime();
      int rowsIn = 0;
      try {
        ctx.checkCancelled();
        Map<String, NamedDataset> inputs = ctx.inputsOf(step);
        for (NamedDataset d : inputs.values()) rowsIn += d.rowCount();
        NamedDataset out = StepExecutors.forType(step.type()).execute(step, inputs, ctx);
        ctx.record(step, out);
        long ms = (System.nanoTime() - t0) / 1_000_000;
        trace.add(new StepLogEntry(step.order(), step.name(), step.type().id(), step.outputAlias(), step.inputs(),
            rowsIn, out.rowCount(), ms, StepStatus.SUCCESS, null));
        if (log.isDebugEnabled()) {
          log.debug("vista.run step runId={} order={} type={} alias={} rowsIn={} rowsOut={} durationMs={}",
              ctx.runId(), step.order(), step.type().id(), step.outputAlias(), rowsIn, out.rowCount(), ms);
        }
      } catch (RuntimeException e) {
        long ms = (System.nanoTime() - t0) / 1_000_000;
        StepExecutionException failure = new StepExecutionException(step.order(), step.name(), e);
        trace.add(new StepLogEntry(step.order(), step.name(), step.type().id(), step.outputAlias(), step.inputs(),
            rowsIn, 0, ms, StepStatus.FAILED, e.getMessage()));
        if (e instanceof ExecutionTimeoutException) return PlanOutcome.failed(e.getMessage());
        log.debug("vista.run step_failed runId={} order={} err={}", ctx.runId(), step.order(), e.toString());
        return PlanOutcome.failed(failure.getMessage());
      }
    }
    return PlanOutcome.succeeded(ctx.dataset(plan.last().outputAlias()));
  }

  // the pre-run compile is ANSI; recompile for engines with their own flavour
  private PlanOutcome runQuery(QueryRequest request, EntityMetadata entity, AtomicReference<CompiledQuery> sent,
                               ExecutionContext ctx) {
    if (!start(ctx)) return PlanOutcome.failed("Run " + ctx.runId() + " was cancelled before it started");
    try {
      DataSourceDefinition ds = dataSourceFor(entity);
      ExecutionBackend backend = backends.backendFor(ds);
      if (backend.sqlFlavor() != SqlFlavor.ANSI) sent.set(compiler.compile(request, entity, backend.sqlFlavor()));
      return PlanOutcome.succeeded(backend.runQuery(sent.get(), "result"));
    } catch (RuntimeException e) {
      return PlanOutcome.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }
  }

  private DataSourceDefinition dataSourceFor(EntityMetadata entity) {
    if (entity.dataSourceId() != null) {
      return dataSources.resolve(entity.dataSourceId())
          .orElseThrow(() -> new DataSourceException("Data source not found: " + entity.dataSourceId()));
    }
    return dataSources.findByTable(entity.primaryTable())
        .orElseThrow(() -> new DataSourceException("No data source declares table '" + entity.primaryTable() + "'"));
  }

  /** Moves the run to running unless it was already given up on. */
  private boolean start(ExecutionContext ctx) {
    if (ctx.cancelled()) return false;
    try {
      runs.markRunning(ctx.runId());
      return true;
    } catch (IllegalStateException e) {
      return false;
    }
  }

  /** Submits work to the pool and waits up to {@code timeout}; a timeout cancels the worker. */
  private PlanOutcome await(Callable<PlanOutcome> work, Duration timeout, ExecutionContext ctx) {
    Future<PlanOutcome> future;
    try {
      future = workers.submit(work);
    } catch (RejectedExecutionException e) {
      return PlanOutcome.failed("Worker pool is shut down");
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      ctx.cancel();
      future.cancel(true);
      String msg = new ExecutionTimeoutException("Run " + ctx.runId() + " exceeded " + timeout.toMillis() + "ms").getMessage();
      return PlanOutcome.failed(msg);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      ctx.cancel();
      future.cancel(true);
      return PlanOutcome.failed("Interrupted while waiting for run " + ctx.runId());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      return PlanOutcome.failed(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
    }
  }

  private static double elapsedSeconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }

  private static String newRunId() {
    return UUID.randomUUID().toString();
  }

  private static ThreadFactory workerThreads() {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "vista-run-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  private record PlanOutcome(NamedDataset output, String error) {
    static PlanOutcome succeeded(NamedDataset output) {
      return new PlanOutcome(Objects.requireNonNull(output, "output"), null);
    }

    static PlanOutcome failed(String error) {
      return new PlanOutcome(null, error);
    }
  }

  /**
   * Step log shared between the worker and the waiting thread. {@link #finish()} fills in every
   * step that has no entry yet as skipped.
   */
  private static final class StepTrace {
    private final ResolvedPlan plan;
    private final List<StepLogEntry> entries = new ArrayList<>();

    StepTrace(ResolvedPlan plan) {
      this.plan = plan;
    }

    synchronized void add(StepLogEntry e) {
      entries.add(e);
    }

    synchronized List<StepLogEntry> finish() {
      List<StepLogEntry> out = new ArrayList<>(entries);
      for (int i = entries.size(); i < plan.steps().size(); i++) {
        PlannedStep s = plan.steps().get(i);
        out.add(StepLogEntry.skipped(s.order(), s.name(), s.type().id(), s.outputAlias(), s.inputs()));
      }
      return out;
    }
  }
}
