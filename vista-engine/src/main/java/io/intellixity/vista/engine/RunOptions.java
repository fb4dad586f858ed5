package io.intellixity.vista.engine;

/**
 * Per-run options for pipeline execution. {@code limit} caps source reads and the final result;
 * {@code previewMode} adds the preview row cap and the shorter preview timeout.
 */
public record RunOptions(Integer limit, boolean previewMode) {
  public RunOptions {
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  public static RunOptions full() {
    return new RunOptions(null, false);
  }

  public static RunOptions preview() {
    return new RunOptions(null, true);
  }
}
