package io.intellixity.vista.spi.query;

import io.intellixity.vista.query.FilterCondition;
import io.intellixity.vista.query.SortField;

import java.util.List;
import java.util.Objects;

/**
 * Backend-neutral form of a compiled semantic query: filter the table (flat AND), group by
 * {@code groupColumns}, compute {@code measures}, order by {@code sort} (output column names),
 * then keep {@code limit} rows.
 */
public record LogicalQuery(String table, List<String> groupColumns, List<MeasureColumn> measures,
                           List<FilterCondition> filters, List<SortField> sort, int limit) {
  public LogicalQuery {
    Objects.requireNonNull(table, "table");
    groupColumns = List.copyOf(groupColumns);
    measures = List.copyOf(measures);
    filters = List.copyOf(filters);
    sort = List.copyOf(sort);
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }
}
