package io.intellixity.vista.server.web;

import io.intellixity.vista.engine.ExecutionOrchestrator;
import io.intellixity.vista.semantic.QueryRequest;
import io.intellixity.vista.semantic.QueryResult;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/query")
public final class QueryController {
  private final ExecutionOrchestrator orchestrator;

  public QueryController(ExecutionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping("/execute")
  public QueryResult execute(@RequestBody QueryRequest request) {
    return orchestrator.executeQuery(request);
  }
}
