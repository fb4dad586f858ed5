package io.intellixity.vista.engine.validate;

import java.util.List;

/** Outcome of validating a pipeline. {@code plan} is present exactly when there are no errors. */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings, ResolvedPlan plan) {
  public ValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    if (valid != errors.isEmpty()) throw new IllegalArgumentException("valid must match an empty error list");
    if (valid && plan == null) throw new IllegalArgumentException("a valid result needs a plan");
    if (!valid) plan = null;
  }

  public static ValidationResult invalid(List<String> errors, List<String> warnings) {
    return new ValidationResult(false, errors, warnings, null);
  }
}
