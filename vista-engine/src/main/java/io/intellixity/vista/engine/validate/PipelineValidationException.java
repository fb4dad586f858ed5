package io.intellixity.vista.engine.validate;

import io.intellixity.vista.error.VistaException;

/** Thrown instead of starting a run when a pipeline fails validation. */
public final class PipelineValidationException extends VistaException {
  private final String pipelineId;
  private final ValidationResult result;

  public PipelineValidationException(String pipelineId, ValidationResult result) {
    super("Pipeline " + pipelineId + " is invalid: " + String.join("; ", result.errors()));
    this.pipelineId = pipelineId;
    this.result = result;
  }

  public String pipelineId() { return pipelineId; }
  public ValidationResult result() { return result; }
}
