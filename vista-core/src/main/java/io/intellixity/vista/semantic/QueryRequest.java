package io.intellixity.vista.semantic;

import java.util.List;

public record QueryRequest(String entityId, List<String> dimensionIds, List<String> measureIds,
                           List<QueryFilter> filters, List<QuerySort> sort, Integer limit) {
  public QueryRequest {
    dimensionIds = (dimensionIds == null) ? List.of() : List.copyOf(dimensionIds);
    measureIds = (measureIds == null) ? List.of() : List.copyOf(measureIds);
    filters = (filters == null) ? List.of() : List.copyOf(filters);
    sort = (sort == null) ? List.of() : List.copyOf(sort);
  }

  public QueryRequest(String entityId, List<String> dimensionIds, List<String> measureIds) {
    this(entityId, dimensionIds, measureIds, List.of(), List.of(), null);
  }
}
