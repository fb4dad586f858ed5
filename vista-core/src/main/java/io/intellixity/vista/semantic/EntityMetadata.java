package io.intellixity.vista.semantic;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Semantic entity: a primary table with named dimensions and measures. {@code dataSourceId} is
 * optional; when absent the data source is found by table name.
 */
public record EntityMetadata(String id, String name, String primaryTable, String dataSourceId,
                             List<DimensionDef> dimensions, List<MeasureDef> measures) {
  public EntityMetadata {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(primaryTable, "primaryTable");
    name = (name == null) ? id : name;
    dimensions = (dimensions == null) ? List.of() : List.copyOf(dimensions);
    measures = (measures == null) ? List.of() : List.copyOf(measures);
  }

  public Optional<DimensionDef> dimension(String dimensionId) {
    for (DimensionDef d : dimensions) if (d.id().equals(dimensionId)) return Optional.of(d);
    return Optional.empty();
  }

  public Optional<MeasureDef> measure(String measureId) {
    for (MeasureDef m : measures) if (m.id().equals(measureId)) return Optional.of(m);
    return Optional.empty();
  }
}
