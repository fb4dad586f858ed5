package io.intellixity.vista.semantic;

import io.intellixity.vista.query.AggregationFunction;

import java.util.Locale;
import java.util.Objects;

public record MeasureDef(String id, String name, String baseColumn, AggregationFunction aggregationFunction) {
  public MeasureDef {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(baseColumn, "baseColumn");
    Objects.requireNonNull(aggregationFunction, "aggregationFunction");
    name = (name == null) ? id : name;
  }

  /** Output column name: lower-cased name with every non-alphanumeric run replaced by '_'. */
  public String alias() {
    String s = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    s = s.replaceAll("^_+|_+$", "");
    if (s.isEmpty()) s = "measure_" + id.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    return Character.isDigit(s.charAt(0)) ? "m_" + s : s;
  }
}
