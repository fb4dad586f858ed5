package io.intellixity.vista.server.web;

import io.intellixity.vista.engine.ExecutionOrchestrator;
import io.intellixity.vista.engine.PipelineResult;
import io.intellixity.vista.engine.RunOptions;
import io.intellixity.vista.engine.validate.PlannedStep;
import io.intellixity.vista.engine.validate.ValidationResult;
import io.intellixity.vista.run.PipelineRun;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/pipelines")
public final class PipelineController {
  private final ExecutionOrchestrator orchestrator;

  public PipelineController(ExecutionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  public record ExecuteRequest(Integer limit, Boolean previewMode) {
    RunOptions toOptions() {
      return new RunOptions(limit, previewMode != null && previewMode);
    }
  }

  /** {@code steps} lists the resolved plan of a valid pipeline. */
  public record ValidationResponse(boolean valid, List<String> errors, List<String> warnings, List<String> steps) {
    static ValidationResponse of(ValidationResult r) {
      List<String> steps = new ArrayList<>();
      if (r.plan() != null) for (PlannedStep s : r.plan().steps()) steps.add(s.describe());
      return new ValidationResponse(r.valid(), r.errors(), r.warnings(), steps);
    }
  }

  @PostMapping("/{id}/validate")
  public ValidationResponse validate(@PathVariable("id") String id) {
    return ValidationResponse.of(orchestrator.validate(id));
  }

  @PostMapping("/{id}/execute")
  public PipelineResult execute(@PathVariable("id") String id, @RequestBody(required = false) ExecuteRequest req) {
    RunOptions options = (req == null) ? RunOptions.full() : req.toOptions();
    return orchestrator.executePipeline(id, options);
  }

  @GetMapping("/{id}/runs")
  public List<PipelineRun> runs(@PathVariable("id") String id,
                                @RequestParam(name = "skip", defaultValue = "0") int skip,
                                @RequestParam(name = "limit", defaultValue = "50") int limit) {
    return orchestrator.listRuns(id, skip, limit);
  }
}
