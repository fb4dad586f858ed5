package io.intellixity.vista.engine.exec;

import io.intellixity.vista.error.VistaException;

/** A step failed; the message is {@code "Step N (name) failed: <cause>"}. */
public final class StepExecutionException extends VistaException {
  private final int order;
  private final String stepName;

  public StepExecutionException(int order, String stepName, Throwable cause) {
    super("Step " + order + " (" + stepName + ") failed: " + describe(cause), cause);
    this.order = order;
    this.stepName = stepName;
  }

  public int order() { return order; }
  public String stepName() { return stepName; }

  private static String describe(Throwable t) {
    String m = t.getMessage();
    return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
  }
}
