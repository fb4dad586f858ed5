package io.intellixity.vista.pipeline;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * JSON deserializer for {@link PipelineDefinition}.\n
 *
 * Step fields accept both the short names ({@code order}, {@code type}, {@code name}) and the
 * persisted column names ({@code step_order}, {@code step_type}, {@code step_name}).
 */
public final class PipelineJsonDeserializer extends JsonDeserializer<PipelineDefinition> {
  @Override
  public PipelineDefinition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Pipeline JSON must be an object");

    String id = textOrNull(root.get("id"));
    if (id == null) throw new IllegalArgumentException("Pipeline JSON requires 'id'");
    String name = textOrNull(root.get("name"));

    List<StepDefinition> steps = new ArrayList<>();
    JsonNode arr = root.get("steps");
    if (arr != null && arr.isArray()) {
      int position = 0;
      for (JsonNode s : arr) {
        if (!s.isObject()) throw new IllegalArgumentException("Pipeline '" + id + "' step " + position + " must be an object");
        steps.add(parseStep(s, position, codec));
        position++;
      }
    }
    return new PipelineDefinition(id, name, steps);
  }

  private static StepDefinition parseStep(JsonNode s, int position, ObjectCodec codec) throws IOException {
    JsonNode orderNode = first(s, "order", "step_order");
    int order = orderOf(orderNode, position);
    String type = textOrNull(first(s, "type", "step_type"));
    String name = textOrNull(first(s, "name", "step_name"));
    String alias = textOrNull(first(s, "output_alias", "outputAlias"));

    Map<String, Object> config = Map.of();
    JsonNode cfg = s.get("config");
    if (cfg != null && cfg.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(cfg, Map.class);
      config = m;
    }
    return new StepDefinition(order, type, name, config, alias);
  }

  // absent -> position; present but not an int -> INVALID_ORDER so validation rejects it
  private static int orderOf(JsonNode n, int position) {
    if (n == null) return position;
    if (n.isIntegralNumber() && n.canConvertToInt()) return n.asInt();
    return StepDefinition.INVALID_ORDER;
  }

  private static JsonNode first(JsonNode n, String... names) {
    for (String k : names) {
      JsonNode v = n.get(k);
      if (v != null && !v.isNull()) return v;
    }
    return null;
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String s = n.asText();
    return s == null || s.isBlank() ? null : s;
  }
}
