package io.intellixity.vista.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A step as persisted by the catalog. The type and config are kept raw here; they are parsed
 * and checked by the graph validator, never trusted as-is.
 */
public record StepDefinition(int order, String type, String name, Map<String, Object> config, String outputAlias) {
  /** Stored when a persisted order is present but not an integer; never a valid position. */
  public static final int INVALID_ORDER = Integer.MIN_VALUE;

  public StepDefinition {
    config = (config == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    name = (name == null || name.isBlank()) ? (order == INVALID_ORDER ? "step ?" : "step " + order) : name;
    outputAlias = (outputAlias == null || outputAlias.isBlank()) ? null : outputAlias.trim();
  }

  public StepDefinition(int order, String type, String name, Map<String, Object> config) {
    this(order, type, name, config, null);
  }

  public String describe() {
    return "Step " + order + " (" + Objects.requireNonNullElse(name, "") + ")";
  }
}
