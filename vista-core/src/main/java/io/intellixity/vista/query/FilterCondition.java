package io.intellixity.vista.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public record FilterCondition(String column, FilterOperator operator, Object value) {
  public FilterCondition {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
  }

  public static FilterCondition of(String column, FilterOperator operator, Object value) {
    return new FilterCondition(column, operator, value);
  }

  /** Value as a list; scalars become a singleton list. */
  public List<Object> values() {
    if (value == null) return List.of();
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    if (value instanceof Object[] arr) return List.of(arr);
    List<Object> one = new ArrayList<>(1);
    one.add(value);
    return one;
  }
}
