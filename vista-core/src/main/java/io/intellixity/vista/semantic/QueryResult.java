package io.intellixity.vista.semantic;

import io.intellixity.vista.run.RunStatus;

import java.util.List;
import java.util.Objects;

/**
 * Result of a semantic query run. A failed run has no rows and carries {@code errorMessage};
 * the generated SQL is always present.
 */
public record QueryResult(String runId, RunStatus status, String entityName, List<String> columns,
                          List<List<Object>> rows, int rowCount, String generatedSql, double executionTimeSeconds,
                          String errorMessage) {
  public QueryResult {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(status, "status");
    columns = List.copyOf(columns);
    rows = List.copyOf(rows);
  }
}
