package io.intellixity.vista.server.web;

import io.intellixity.vista.catalog.InMemoryCatalog;
import io.intellixity.vista.catalog.InMemoryRunStore;
import io.intellixity.vista.engine.EngineSettings;
import io.intellixity.vista.engine.ExecutionOrchestrator;
import io.intellixity.vista.engine.PipelineResult;
import io.intellixity.vista.engine.backend.BackendResolver;
import io.intellixity.vista.engine.validate.PipelineValidationException;
import io.intellixity.vista.error.NotFoundException;
import io.intellixity.vista.pipeline.PipelineDefinition;
import io.intellixity.vista.pipeline.StepDefinition;
import io.intellixity.vista.query.QueryValidationException;
import io.intellixity.vista.run.PipelineRun;
import io.intellixity.vista.run.RunStatus;
import io.intellixity.vista.semantic.QueryFilter;
import io.intellixity.vista.semantic.QueryRequest;
import io.intellixity.vista.semantic.QueryResult;
import io.intellixity.vista.semantic.QuerySort;
import io.intellixity.vista.server.config.VistaServerConfig;
import io.intellixity.vista.spi.backend.BackendContext;
import io.intellixity.vista.spi.backend.ConnectionPools;
import io.intellixity.vista.spi.backend.DiscoveredBackendRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ControllersTest {
  private InMemoryCatalog catalog;
  private ExecutionOrchestrator orchestrator;
  private PipelineController pipelines;
  private QueryController queries;
  private RunController runs;
  private final ApiExceptionHandler errors = new ApiExceptionHandler();

  @BeforeEach
  void setUp() {
    catalog = VistaServerConfig.loadCatalog(new ClassPathResource("catalog/catalog.json"));
    BackendResolver backends = new BackendResolver(new DiscoveredBackendRegistry(),
        BackendContext.defaults(ConnectionPools.none()), 8);
    orchestrator = new ExecutionOrchestrator(catalog, catalog, catalog, new InMemoryRunStore(), backends,
        EngineSettings.defaults(), Clock.systemUTC());
    pipelines = new PipelineController(orchestrator);
    queries = new QueryController(orchestrator);
    runs = new RunController(orchestrator);
  }

  @AfterEach
  void tearDown() {
    orchestrator.close();
  }

  @Test
  void validatesSamplePipeline() {
    PipelineController.ValidationResponse r = pipelines.validate("sales_by_manager");
    assertTrue(r.valid(), () -> r.errors().toString());
    assertEquals(6, r.steps().size());
    assertEquals("Step 2 (Attach manager)", r.steps().get(2));
  }

  @Test
  void executesSamplePipeline() {
    PipelineResult r = pipelines.execute("sales_by_manager", null);

    assertEquals(RunStatus.SUCCESS, r.status(), r.errorMessage());
    assertEquals(List.of("region", "manager", "total_sales", "orders"), r.data().columns());
    assertEquals(List.of(
        Arrays.asList("East", null, 6400.0, 1L),
        List.of("North", "Avery", 3000.0, 1L),
        List.of("South", "Jordan", 1000.0, 1L)), r.data().rows());

    PipelineRun run = runs.get(r.runId());
    assertEquals(RunStatus.SUCCESS, run.status());
    assertEquals(3, run.rowsProcessed());
  }

  @Test
  void previewRequestCapsRows() {
    catalog.putPipeline(new PipelineDefinition("raw", "Raw sales", List.of(
        new StepDefinition(0, "source", "load", Map.of("data_source_id", "sample_files", "table_name", "sales")))));
    PipelineResult r = pipelines.execute("raw", new PipelineController.ExecuteRequest(2, true));
    assertEquals(2, r.rowsProcessed());
    assertEquals(2, r.data().rows().size());
  }

  @Test
  void executesSemanticQuery() {
    QueryResult r = queries.execute(new QueryRequest("order", List.of("region"), List.of("total_sales", "order_count"),
        List.of(new QueryFilter("region", "in", List.of("North", "South"))),
        List.of(new QuerySort("total_sales", "desc")), null));

    assertEquals(RunStatus.SUCCESS, r.status(), r.errorMessage());
    assertEquals("Order", r.entityName());
    assertEquals(List.of("region", "total_sales", "order_count"), r.columns());
    assertEquals(List.of(List.of("North", 5650.0, 3L), List.of("South", 1125.0, 2L)), r.rows());
    assertTrue(r.generatedSql().contains("GROUP BY region"));
  }

  @Test
  void deliveryFailureMarksRunPartial() {
    PipelineResult ok = pipelines.execute("sales_by_manager", null);
    PipelineRun partial = runs.deliveryFailure(ok.runId(), new RunController.DeliveryFailureRequest("mailbox full"));
    assertEquals(RunStatus.PARTIAL, partial.status());

    IllegalStateException again = assertThrows(IllegalStateException.class,
        () -> runs.deliveryFailure(ok.runId(), null));
    assertEquals(HttpStatus.CONFLICT, errors.conflict(again).getStatusCode());
  }

  @Test
  void listsRunHistoryNewestFirst() {
    PipelineResult first = pipelines.execute("sales_by_manager", null);
    PipelineResult second = pipelines.execute("sales_by_manager", new PipelineController.ExecuteRequest(1, false));
    queries.execute(new QueryRequest("order", List.of("region"), List.of("total_sales")));

    List<PipelineRun> history = pipelines.runs("sales_by_manager", 0, 50);
    assertEquals(List.of(second.runId(), first.runId()), history.stream().map(PipelineRun::id).toList());
    assertEquals(1, history.get(0).rowsProcessed());
    assertEquals(List.of(first.runId()), pipelines.runs("sales_by_manager", 1, 50).stream().map(PipelineRun::id).toList());

    assertThrows(NotFoundException.class, () -> pipelines.runs("nope", 0, 50));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> pipelines.runs("sales_by_manager", 0, 0));
    assertEquals(HttpStatus.BAD_REQUEST, errors.badRequest(e).getStatusCode());
  }

  @Test
  void invalidPipelineMapsToBadRequest() {
    catalog.putPipeline(new PipelineDefinition("bad", "Bad", List.of(
        new StepDefinition(0, "source", "load", Map.of("data_source_id", "sample_files", "table_name", "sales")),
        new StepDefinition(1, "sort", "rank", Map.of("input", "missing", "columns", List.of("sales"))))));

    PipelineValidationException e = assertThrows(PipelineValidationException.class,
        () -> pipelines.execute("bad", null));
    ResponseEntity<ApiExceptionHandler.ErrorResponse> resp = errors.invalidPipeline(e);
    assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode());
    assertEquals(List.of("Step 1 (rank): alias not found: 'missing'"), resp.getBody().errors());
  }

  @Test
  void unknownIdsMapToNotFound() {
    NotFoundException e = assertThrows(NotFoundException.class, () -> pipelines.validate("nope"));
    assertEquals(HttpStatus.NOT_FOUND, errors.notFound(e).getStatusCode());
    assertThrows(NotFoundException.class, () -> runs.get("nope"));

    QueryValidationException q = assertThrows(QueryValidationException.class,
        () -> queries.execute(new QueryRequest("nope", List.of(), List.of("x"))));
    ResponseEntity<ApiExceptionHandler.ErrorResponse> resp = errors.invalidQuery(q);
    assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode());
    assertEquals("Entity not found: nope", resp.getBody().error());
  }

  @Test
  void nonPositiveLimitIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> pipelines.execute("sales_by_manager", new PipelineController.ExecuteRequest(0, false)));
    assertEquals(HttpStatus.BAD_REQUEST, errors.badRequest(e).getStatusCode());
  }
}
