package io.intellixity.vista.server.web;

import io.intellixity.vista.engine.ExecutionOrchestrator;
import io.intellixity.vista.run.PipelineRun;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/runs")
public final class RunController {
  private final ExecutionOrchestrator orchestrator;

  public RunController(ExecutionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  public record DeliveryFailureRequest(String message) {}

  @GetMapping("/{id}")
  public PipelineRun get(@PathVariable("id") String id) {
    return orchestrator.getRun(id);
  }

  /** Called by the report scheduler when a successful run could not be delivered. */
  @PostMapping("/{id}/delivery-failure")
  public PipelineRun deliveryFailure(@PathVariable("id") String id,
                                     @RequestBody(required = false) DeliveryFailureRequest req) {
    return orchestrator.reportDeliveryFailure(id, req == null ? null : req.message());
  }
}
