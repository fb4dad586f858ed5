package io.intellixity.vista.pipeline.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vista.pipeline.StepType;
import io.intellixity.vista.query.AggregationFunction;
import io.intellixity.vista.query.FilterCondition;
import io.intellixity.vista.query.FilterOperator;
import io.intellixity.vista.query.LogicalOperator;

import java.util.*;

/**
 * Parses the raw config map of a step into its typed {@link StepConfig}.\n
 *
 * Problems are appended to the caller's list instead of thrown so the validator can report every
 * problem of a pipeline at once. A {@code null} return always comes with at least one problem.
 */
public final class StepConfigParser {
  private static final ObjectMapper JSON = new ObjectMapper();

  private StepConfigParser() {}

  public static StepConfig parse(StepType type, Map<String, Object> raw, List<String> problems) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(problems, "problems");
    JsonNode cfg = JSON.valueToTree(raw == null ? Map.of() : raw);
    int before = problems.size();
    try {
      StepConfig out = switch (type) {
        case SOURCE -> parseSource(cfg, problems);
        case FILTER -> parseFilter(cfg, problems);
        case JOIN -> parseJoin(cfg, problems);
        case AGGREGATE -> parseAggregate(cfg, problems);
        case SELECT -> parseSelect(cfg, problems);
        case SORT -> parseSort(cfg, problems);
        case UNION -> parseUnion(cfg, problems);
      };
      return problems.size() > before ? null : out;
    } catch (IllegalArgumentException e) {
      problems.add(e.getMessage());
      return null;
    }
  }

  private static SourceConfig parseSource(JsonNode cfg, List<String> problems) {
    String ds = requiredText(cfg, "data_source_id", problems);
    String table = requiredText(cfg, "table_name", problems);
    String schema = optionalText(cfg, "schema_name");
    List<String> columns = optionalStrings(cfg, "columns", problems);
    Integer limit = null;
    JsonNode l = cfg.get("limit");
    if (l != null && !l.isNull()) {
      if (!l.canConvertToInt() || l.asInt() < 0) problems.add("'limit' must be a non-negative integer");
      else limit = l.asInt();
    }
    if (ds == null || table == null) return null;
    return new SourceConfig(ds, table, schema, columns, limit);
  }

  private static FilterConfig parseFilter(JsonNode cfg, List<String> problems) {
    String input = optionalText(cfg, "input");
    JsonNode conds = cfg.get("conditions");
    if (conds == null || !conds.isArray() || conds.isEmpty()) {
      problems.add("'conditions' must be a non-empty list");
      return null;
    }
    List<FilterCondition> out = new ArrayList<>();
    int i = 0;
    for (JsonNode c : conds) {
      FilterCondition fc = parseCondition(c, i++, problems);
      if (fc != null) out.add(fc);
    }
    LogicalOperator lop;
    try {
      lop = LogicalOperator.parse(optionalText(cfg, "logical_operator"));
    } catch (IllegalArgumentException e) {
      problems.add(e.getMessage());
      return null;
    }
    if (out.size() != conds.size()) return null;
    return new FilterConfig(input, out, lop);
  }

  private static FilterCondition parseCondition(JsonNode c, int idx, List<String> problems) {
    String where = "condition " + idx;
    if (c == null || !c.isObject()) {
      problems.add(where + " must be an object");
      return null;
    }
    String column = optionalText(c, "column");
    String opRaw = optionalText(c, "operator");
    if (column == null) problems.add(where + " is missing 'column'");
    if (opRaw == null) problems.add(where + " is missing 'operator'");
    if (column == null || opRaw == null) return null;

    FilterOperator op = FilterOperator.tryParse(opRaw);
    if (op == null) {
      problems.add(where + ": unknown operator '" + opRaw + "'");
      return null;
    }
    JsonNode v = c.get("value");
    boolean hasValue = v != null && !v.isNull();
    if (op.takesValue() && !hasValue) {
      problems.add(where + ": operator '" + op.symbol() + "' requires a value");
      return null;
    }
    if (op.takesList() && !v.isArray()) {
      problems.add(where + ": operator '" + op.symbol() + "' requires a list value");
      return null;
    }
    if (op.takesList()) {
      for (JsonNode e : v) {
        if (e.isNull()) {
          problems.add(where + ": operator '" + op.symbol() + "' list must not contain null; use 'is null'");
          return null;
        }
      }
    }
    if (op.takesValue() && !op.takesList() && (v.isArray() || v.isObject())) {
      problems.add(where + ": operator '" + op.symbol() + "' requires a scalar value");
      return null;
    }
    Object value = op.takesValue() ? toJava(v) : null;
    return new FilterCondition(column, op, value);
  }

  private static JoinConfig parseJoin(JsonNode cfg, List<String> problems) {
    String left = optionalText(cfg, "left_source");
    String right = requiredText(cfg, "right_source", problems);
    String leftOn = requiredText(cfg, "left_on", problems);
    String rightOn = requiredText(cfg, "right_on", problems);
    JoinType jt = JoinType.parse(optionalText(cfg, "join_type"));
    if (right == null || leftOn == null || rightOn == null) return null;
    return new JoinConfig(left, right, jt, leftOn, rightOn,
        optionalText(cfg, "suffix_left"), optionalText(cfg, "suffix_right"));
  }

  private static AggregateConfig parseAggregate(JsonNode cfg, List<String> problems) {
    String input = optionalText(cfg, "input");
    List<String> groupBy = optionalStrings(cfg, "group_by", problems);
    JsonNode aggs = cfg.get("aggregations");
    if (aggs == null || !aggs.isArray() || aggs.isEmpty()) {
      problems.add("'aggregations' must be a non-empty list");
      return null;
    }
    List<AggregationSpec> specs = new ArrayList<>();
    Set<String> aliases = new HashSet<>(groupBy);
    int i = 0;
    for (JsonNode a : aggs) {
      String where = "aggregation " + i++;
      if (!a.isObject()) {
        problems.add(where + " must be an object");
        continue;
      }
      String column = optionalText(a, "column");
      String fn = optionalText(a, "function");
      if (column == null || fn == null) {
        problems.add(where + " requires 'column' and 'function'");
        continue;
      }
      AggregationFunction f = AggregationFunction.tryParse(fn);
      if (f == null) {
        problems.add(where + ": unknown aggregation function '" + fn + "'");
        continue;
      }
      AggregationSpec spec = new AggregationSpec(column, f, optionalText(a, "alias"));
      if (!aliases.add(spec.alias())) problems.add(where + ": duplicate output column '" + spec.alias() + "'");
      specs.add(spec);
    }
    if (specs.size() != aggs.size()) return null;
    return new AggregateConfig(input, groupBy, specs);
  }

  private static SelectConfig parseSelect(JsonNode cfg, List<String> problems) {
    String input = optionalText(cfg, "input");
    List<String> columns = optionalStrings(cfg, "columns", problems);
    if (columns.isEmpty()) {
      problems.add("'columns' must be a non-empty list");
      return null;
    }
    Map<String, String> rename = new LinkedHashMap<>();
    JsonNode r = cfg.get("rename");
    if (r != null && !r.isNull()) {
      if (!r.isObject()) {
        problems.add("'rename' must be an object");
        return null;
      }
      Iterator<Map.Entry<String, JsonNode>> it = r.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        if (!e.getValue().isTextual() || e.getValue().asText().isBlank()) {
          problems.add("'rename." + e.getKey() + "' must be a non-blank string");
          continue;
        }
        rename.put(e.getKey(), e.getValue().asText());
      }
    }
    return new SelectConfig(input, columns, rename);
  }

  private static SortConfig parseSort(JsonNode cfg, List<String> problems) {
    String input = optionalText(cfg, "input");
    List<String> columns = optionalStrings(cfg, "columns", problems);
    if (columns.isEmpty()) {
      problems.add("'columns' must be a non-empty list");
      return null;
    }
    List<Boolean> asc = new ArrayList<>();
    JsonNode a = cfg.get("ascending");
    if (a != null && !a.isNull()) {
      if (a.isBoolean()) {
        for (int i = 0; i < columns.size(); i++) asc.add(a.asBoolean());
      } else if (a.isArray()) {
        for (JsonNode x : a) {
          if (!x.isBoolean()) {
            problems.add("'ascending' must contain only booleans");
            return null;
          }
          asc.add(x.asBoolean());
        }
        if (asc.size() != columns.size()) {
          problems.add("'columns' and 'ascending' must have the same length (" + columns.size() + " vs " + asc.size() + ")");
          return null;
        }
      } else {
        problems.add("'ascending' must be a boolean or a list of booleans");
        return null;
      }
    }
    return new SortConfig(input, columns, asc);
  }

  private static UnionConfig parseUnion(JsonNode cfg, List<String> problems) {
    List<String> sources = optionalStrings(cfg, "sources", problems);
    if (sources.size() < 2) {
      problems.add("'sources' must list at least 2 aliases");
      return null;
    }
    JsonNode rd = cfg.get("remove_duplicates");
    boolean removeDuplicates = rd == null || rd.isNull() || rd.asBoolean(true);
    return new UnionConfig(sources, removeDuplicates);
  }

  private static String requiredText(JsonNode cfg, String field, List<String> problems) {
    String v = optionalText(cfg, field);
    if (v == null) problems.add("missing required field '" + field + "'");
    return v;
  }

  private static String optionalText(JsonNode cfg, String field) {
    JsonNode n = cfg.get(field);
    if (n == null || n.isNull() || !n.isValueNode()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s.trim();
  }

  private static List<String> optionalStrings(JsonNode cfg, String field, List<String> problems) {
    JsonNode n = cfg.get(field);
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) {
      problems.add("'" + field + "' must be a list of strings");
      return List.of();
    }
    List<String> out = new ArrayList<>();
    for (JsonNode x : n) {
      if (!x.isTextual() || x.asText().isBlank()) {
        problems.add("'" + field + "' must contain only non-blank strings");
        return List.of();
      }
      out.add(x.asText());
    }
    return out;
  }

  private static Object toJava(JsonNode v) {
    try {
      return JSON.treeToValue(v, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("unreadable value: " + v, e);
    }
  }
}
