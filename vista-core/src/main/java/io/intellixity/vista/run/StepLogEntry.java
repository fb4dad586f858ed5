package io.intellixity.vista.run;

import java.util.List;

/** One line of a run's execution trace. Skipped steps carry zero counts and no duration. */
public record StepLogEntry(int order, String name, String type, String outputAlias, List<String> inputs,
                           int rowsIn, int rowsOut, long durationMs, StepStatus status, String error) {
  public StepLogEntry {
    inputs = (inputs == null) ? List.of() : List.copyOf(inputs);
  }

  public static StepLogEntry skipped(int order, String name, String type, String outputAlias, List<String> inputs) {
    return new StepLogEntry(order, name, type, outputAlias, inputs, 0, 0, 0, StepStatus.SKIPPED, null);
  }
}
