package io.intellixity.vista.engine;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.catalog.InMemoryCatalog;
import io.intellixity.vista.catalog.InMemoryRunStore;
import io.intellixity.vista.catalog.RunStore;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.embedded.EmbeddedBackendProvider;
import io.intellixity.vista.engine.backend.BackendResolver;
import io.intellixity.vista.engine.validate.PipelineValidationException;
import io.intellixity.vista.engine.validate.ValidationResult;
import io.intellixity.vista.error.ExecutionTimeoutException;
import io.intellixity.vista.error.NotFoundException;
import io.intellixity.vista.pipeline.PipelineDefinition;
import io.intellixity.vista.pipeline.StepDefinition;
import io.intellixity.vista.pipeline.config.SourceConfig;
import io.intellixity.vista.query.AggregationFunction;
import io.intellixity.vista.query.QueryValidationException;
import io.intellixity.vista.run.*;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.semantic.*;
import io.intellixity.vista.spi.backend.*;
import io.intellixity.vista.spi.query.CompiledQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutionOrchestratorTest {

  @TempDir
  Path dir;

  private InMemoryCatalog catalog;
  private CountingRunStore runs;
  private ExecutionOrchestrator orchestrator;

  @BeforeEach
  void setUp() throws IOException {
    Files.writeString(dir.resolve("orders.csv"),
        "id,customer_id,region,amount\n1,10,North,100.5\n2,11,South,40\n3,10,North,60\n4,12,,10\n");
    Files.writeString(dir.resolve("customers.csv"), "customer_id,name\n10,Acme\n11,Globex\n");

    catalog = new InMemoryCatalog()
        .putDataSource(new DataSourceDefinition("files", "csv", Map.of("directory", dir.toString())))
        .putDataSource(new DataSourceDefinition("slow", "slow", Map.of()))
        .putEntity(new EntityMetadata("sales", "Sales", "orders", "files",
            List.of(new DimensionDef("region", "Region", "region", ColumnType.STRING)),
            List.of(new MeasureDef("revenue", "Revenue", "amount", AggregationFunction.SUM))))
        .putEntity(new EntityMetadata("ghost", "Ghost", "nothing_here", "files",
            List.of(), List.of(new MeasureDef("n", "Rows", "id", AggregationFunction.COUNT))));
    runs = new CountingRunStore();
    orchestrator = orchestrator(EngineSettings.defaults());
  }

  @AfterEach
  void tearDown() {
    orchestrator.close();
  }

  private ExecutionOrchestrator orchestrator(EngineSettings settings) {
    DiscoveredBackendRegistry registry = new DiscoveredBackendRegistry(List.of(new EmbeddedBackendProvider(), new SlowProvider()));
    BackendResolver resolver = new BackendResolver(registry, BackendContext.defaults(ConnectionPools.none()), 8);
    return new ExecutionOrchestrator(catalog, catalog, catalog, runs, resolver, settings, Clock.systemUTC());
  }

  private static Map<String, Object> source(String table) {
    return Map.of("data_source_id", "files", "table_name", table);
  }

  private void salesPipeline() {
    catalog.putPipeline(new PipelineDefinition("sales", "Sales by region", List.of(
        new StepDefinition(0, "source", "orders", source("orders"), "orders"),
        new StepDefinition(1, "source", "customers", source("customers"), "customers"),
        new StepDefinition(2, "join", "enrich", Map.of("left_source", "orders", "right_source", "customers",
            "left_on", "customer_id", "right_on", "customer_id")),
        new StepDefinition(3, "filter", "big", Map.of("input", "step_2", "conditions",
            List.of(Map.of("column", "amount", "operator", ">", "value", 20)))),
        new StepDefinition(4, "aggregate", "by region", Map.of("input", "step_3", "group_by", List.of("region"),
            "aggregations", List.of(Map.of("column", "amount", "function", "sum", "alias", "total")))),
        new StepDefinition(5, "sort", "rank", Map.of("input", "step_4", "columns", List.of("total"), "ascending", false)))));
  }

  @Test
  void runsPipelineEndToEnd() {
    salesPipeline();
    PipelineResult r = orchestrator.executePipeline("sales", RunOptions.full());

    assertEquals(RunStatus.SUCCESS, r.status(), r.errorMessage());
    assertEquals(List.of("region", "total"), r.data().columns());
    assertEquals(List.of(List.of("North", 160.5), List.of("South", 40.0)), r.data().rows());
    assertEquals(2, r.rowsProcessed());
    assertEquals(6, r.executionLog().size());
    assertTrue(r.executionLog().stream().allMatch(e -> e.status() == StepStatus.SUCCESS));
    assertEquals(3, r.executionLog().get(2).rowsOut());

    PipelineRun run = orchestrator.getRun(r.runId());
    assertEquals(RunStatus.SUCCESS, run.status());
    assertEquals(RunKind.PIPELINE, run.kind());
    assertEquals("sales", run.pipelineId());
    assertNotNull(run.completedAt());
    assertEquals(2, run.rowsProcessed());
  }

  @Test
  void previewAndLimitCapTheOutput() {
    catalog.putPipeline(new PipelineDefinition("raw", "Raw", List.of(
        new StepDefinition(0, "source", "orders", source("orders")))));
    orchestrator.close();
    orchestrator = orchestrator(new EngineSettings(2, Duration.ofMinutes(1), Duration.ofMinutes(1), 2, 1000, 100_000,
        8, 4, Duration.ofMinutes(1)));

    assertEquals(2, orchestrator.executePipeline("raw", RunOptions.preview()).rowsProcessed());
    assertEquals(3, orchestrator.executePipeline("raw", new RunOptions(3, false)).rowsProcessed());
    assertEquals(4, orchestrator.executePipeline("raw", RunOptions.full()).rowsProcessed());
  }

  @Test
  void repeatedRunsOverUnchangedDataAreIdentical() {
    catalog.putPipeline(new PipelineDefinition("unsorted", "Join without sort", List.of(
        new StepDefinition(0, "source", "orders", source("orders"), "orders"),
        new StepDefinition(1, "source", "customers", source("customers"), "customers"),
        new StepDefinition(2, "join", "enrich", Map.of("left_source", "orders", "right_source", "customers",
            "left_on", "customer_id", "right_on", "customer_id", "join_type", "left")),
        new StepDefinition(3, "aggregate", "by customer", Map.of("group_by", List.of("name", "region"),
            "aggregations", List.of(Map.of("column", "amount", "function", "mean")))))));

    PipelineResult first = orchestrator.executePipeline("unsorted", RunOptions.full());
    PipelineResult second = orchestrator.executePipeline("unsorted", RunOptions.full());

    assertEquals(RunStatus.SUCCESS, first.status(), first.errorMessage());
    assertEquals(RunStatus.SUCCESS, second.status(), second.errorMessage());
    assertNotEquals(first.runId(), second.runId());
    assertEquals(first.data().columns(), second.data().columns());
    assertEquals(first.data().rows(), second.data().rows());
    assertEquals(first.rowsProcessed(), second.rowsProcessed());
  }

  @Test
  void gappedOrDuplicateOrdersCreateNoRun() {
    catalog.putPipeline(new PipelineDefinition("gapped", "Gapped", List.of(
        new StepDefinition(0, "source", "orders", source("orders")),
        new StepDefinition(2, "select", "cols", Map.of("columns", List.of("id"))))));
    catalog.putPipeline(new PipelineDefinition("twice", "Duplicated", List.of(
        new StepDefinition(0, "source", "orders", source("orders")),
        new StepDefinition(0, "source", "again", source("customers")))));

    PipelineValidationException gap = assertThrows(PipelineValidationException.class,
        () -> orchestrator.executePipeline("gapped", RunOptions.full()));
    assertEquals(List.of("Step order gap: expected 1"), gap.result().errors());

    PipelineValidationException dup = assertThrows(PipelineValidationException.class,
        () -> orchestrator.executePipeline("twice", RunOptions.preview()));
    assertTrue(dup.result().errors().contains("Duplicate step order 0"));

    assertEquals(0, runs.created.get());
    assertTrue(orchestrator.listRuns("gapped", 0, 10).isEmpty());
  }

  @Test
  void invalidPipelineCreatesNoRun() {
    catalog.putPipeline(new PipelineDefinition("broken", "Broken", List.of(
        new StepDefinition(0, "source", "orders", source("orders")),
        new StepDefinition(1, "select", "cols", Map.of("input", "nope", "columns", List.of("id"))))));

    ValidationResult v = orchestrator.validate("broken");
    assertFalse(v.valid());
    assertEquals(List.of("Step 1 (cols): alias not found: 'nope'"), v.errors());

    PipelineValidationException e = assertThrows(PipelineValidationException.class,
        () -> orchestrator.executePipeline("broken", RunOptions.full()));
    assertEquals(v.errors(), e.result().errors());
    assertEquals(0, runs.created.get());
  }

  @Test
  void unknownPipelineAndRunAreNotFound() {
    assertThrows(NotFoundException.class, () -> orchestrator.validate("missing"));
    assertThrows(NotFoundException.class, () -> orchestrator.executePipeline("missing", RunOptions.full()));
    assertThrows(NotFoundException.class, () -> orchestrator.getRun("missing"));
  }

  @Test
  void failingStepFailsRunAndSkipsTheRest() {
    catalog.putPipeline(new PipelineDefinition("bad", "Bad", List.of(
        new StepDefinition(0, "source", "orders", source("orders")),
        new StepDefinition(1, "filter", "typo", Map.of("conditions",
            List.of(Map.of("column", "amout", "operator", ">", "value", 1)))),
        new StepDefinition(2, "select", "cols", Map.of("columns", List.of("id"))))));

    PipelineResult r = orchestrator.executePipeline("bad", RunOptions.full());

    assertEquals(RunStatus.FAILED, r.status());
    assertNull(r.data());
    assertTrue(r.errorMessage().startsWith("Step 1 (typo) failed: "), r.errorMessage());
    assertTrue(r.errorMessage().contains("amout"));
    assertEquals(List.of(StepStatus.SUCCESS, StepStatus.FAILED, StepStatus.SKIPPED),
        r.executionLog().stream().map(StepLogEntry::status).toList());

    PipelineRun run = orchestrator.getRun(r.runId());
    assertEquals(RunStatus.FAILED, run.status());
    assertEquals(r.errorMessage(), run.errorMessage());
    assertEquals(3, run.executionLog().size());
  }

  @Test
  void hardTimeoutFailsTheRun() {
    catalog.putPipeline(new PipelineDefinition("slow", "Slow", List.of(
        new StepDefinition(0, "source", "wait", Map.of("data_source_id", "slow", "table_name", "t")),
        new StepDefinition(1, "select", "cols", Map.of("columns", List.of("x"))))));
    orchestrator.close();
    orchestrator = orchestrator(EngineSettings.defaults().withTimeouts(Duration.ofMillis(200), Duration.ofMillis(200)));

    PipelineResult r = orchestrator.executePipeline("slow", RunOptions.full());

    assertEquals(RunStatus.FAILED, r.status());
    assertTrue(r.errorMessage().startsWith(ExecutionTimeoutException.MARKER), r.errorMessage());
    assertEquals(RunStatus.FAILED, orchestrator.getRun(r.runId()).status());
    assertEquals(StepStatus.SKIPPED, r.executionLog().get(r.executionLog().size() - 1).status());
  }

  @Test
  void runsSemanticQuery() {
    QueryResult r = orchestrator.executeQuery(new QueryRequest("sales", List.of("region"), List.of("revenue")));

    assertEquals(RunStatus.SUCCESS, r.status(), r.errorMessage());
    assertEquals("Sales", r.entityName());
    assertEquals(List.of("region", "revenue"), r.columns());
    assertEquals(List.of("North", 160.5), r.rows().get(0));
    assertEquals(Arrays.asList(null, 10.0), r.rows().get(2));
    assertEquals(3, r.rowCount());
    assertTrue(r.generatedSql().startsWith("SELECT region, SUM(amount) AS revenue FROM orders GROUP BY region"));

    PipelineRun run = orchestrator.getRun(r.runId());
    assertEquals(RunKind.QUERY, run.kind());
    assertEquals("sales", run.entityId());
    assertEquals(RunStatus.SUCCESS, run.status());
  }

  @Test
  void queryFailuresAreReportedOnTheRun() {
    assertThrows(QueryValidationException.class,
        () -> orchestrator.executeQuery(new QueryRequest("nobody", List.of(), List.of("n"))));
    assertEquals(0, runs.created.get());

    QueryResult r = orchestrator.executeQuery(new QueryRequest("ghost", List.of(), List.of("n")));
    assertEquals(RunStatus.FAILED, r.status());
    assertTrue(r.errorMessage().contains("File not found"), r.errorMessage());
    assertEquals(RunStatus.FAILED, orchestrator.getRun(r.runId()).status());
  }

  @Test
  void deliveryFailureMovesSuccessToPartial() {
    salesPipeline();
    PipelineResult ok = orchestrator.executePipeline("sales", RunOptions.full());
    PipelineRun partial = orchestrator.reportDeliveryFailure(ok.runId(), "smtp refused");
    assertEquals(RunStatus.PARTIAL, partial.status());
    assertEquals("smtp refused", partial.errorMessage());
    assertEquals(2, partial.rowsProcessed());

    QueryResult failed = orchestrator.executeQuery(new QueryRequest("ghost", List.of(), List.of("n")));
    assertThrows(IllegalStateException.class, () -> orchestrator.reportDeliveryFailure(failed.runId(), null));
  }

  /** Backend whose source loads block until interrupted. */
  private static final class SlowProvider implements BackendProvider {
    @Override public Set<String> types() { return Set.of("slow"); }

    @Override
    public ExecutionBackend create(DataSourceDefinition dataSource, BackendContext context) {
      return new AbstractExecutionBackend("slow", dataSource) {
        @Override
        public NamedDataset loadSource(SourceConfig cfg, String alias, int rowCap) {
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionTimeoutException("interrupted");
          }
          return NamedDataset.empty(alias, List.of());
        }

        @Override
        public NamedDataset runQuery(CompiledQuery query, String alias) {
          throw new UnsupportedOperationException("queries");
        }
      };
    }
  }

  private static final class CountingRunStore implements RunStore {
    private final InMemoryRunStore delegate = new InMemoryRunStore();
    private final AtomicInteger created = new AtomicInteger();

    @Override
    public PipelineRun create(PipelineRun run) {
      created.incrementAndGet();
      return delegate.create(run);
    }

    @Override public PipelineRun markRunning(String runId) { return delegate.markRunning(runId); }

    @Override
    public PipelineRun complete(String runId, RunStatus status, long rowsProcessed, double executionTimeSeconds,
                                List<StepLogEntry> log, String errorMessage) {
      return delegate.complete(runId, status, rowsProcessed, executionTimeSeconds, log, errorMessage);
    }

    @Override public PipelineRun markPartial(String runId, String message) { return delegate.markPartial(runId, message); }
    @Override public Optional<PipelineRun> get(String runId) { return delegate.get(runId); }

    @Override
    public List<PipelineRun> listByPipeline(String pipelineId, int offset, int limit) {
      return delegate.listByPipeline(pipelineId, offset, limit);
    }
  }
}
