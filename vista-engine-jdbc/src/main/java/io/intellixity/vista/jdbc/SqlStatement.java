package io.intellixity.vista.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL with named placeholders ({@code :p1}) and the values bound to them, in placeholder order.
 * Values are never spliced into the SQL text.
 */
public record SqlStatement(String sql, List<Object> binds) {
  public SqlStatement {
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
  }

  public SqlStatement(String sql) {
    this(sql, List.of());
  }
}
