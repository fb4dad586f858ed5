package io.intellixity.vista.spi.query;

import io.intellixity.vista.data.Column;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A semantic query ready to run. SQL backends execute {@link #sql()} with {@link #binds()} in
 * placeholder order; embedded backends evaluate {@link #logical()}. Both describe the same result.
 */
public record CompiledQuery(String sql, List<Object> binds, List<Column> resultColumns, LogicalQuery logical) {
  public CompiledQuery {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(logical, "logical");
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    resultColumns = List.copyOf(resultColumns);
  }

  public List<String> resultColumnNames() {
    List<String> out = new ArrayList<>(resultColumns.size());
    for (Column c : resultColumns) out.add(c.name());
    return out;
  }
}
