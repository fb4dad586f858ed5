package io.intellixity.vista.engine.validate;

import io.intellixity.vista.catalog.DataSourceCatalog;
import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.catalog.TableSchema;
import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.error.SchemaException;
import io.intellixity.vista.pipeline.PipelineDefinition;
import io.intellixity.vista.pipeline.StepDefinition;
import io.intellixity.vista.pipeline.StepType;
import io.intellixity.vista.pipeline.config.*;
import io.intellixity.vista.query.FilterCondition;
import io.intellixity.vista.spi.relational.RowOperators;

import java.util.*;

/**
 * Checks a pipeline's structure, step configs, alias wiring and (where table metadata is declared)
 * column usage, and produces the {@link ResolvedPlan} the executor runs.\n
 *
 * Never mutates the pipeline; safe to call concurrently.\n
 *
 * Static schemas start from the data source's declared tables and are pushed through each step by
 * running the step's operator over an empty dataset of that schema. Columns missing from declared
 * metadata are warnings (metadata may be stale); type misuse on known columns is an error.
 */
public final class StepGraphValidator {
  private final DataSourceCatalog dataSources;

  public StepGraphValidator(DataSourceCatalog dataSources) {
    this.dataSources = Objects.requireNonNull(dataSources, "dataSources");
  }

  public ValidationResult validate(PipelineDefinition pipeline) {
    Objects.requireNonNull(pipeline, "pipeline");
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    List<StepDefinition> steps = pipeline.steps();
    if (steps.isEmpty()) {
      errors.add("Pipeline has no steps");
      return ValidationResult.invalid(errors, warnings);
    }
    if (!checkOrders(steps, errors)) return ValidationResult.invalid(errors, warnings);

    List<StepDefinition> ordered = new ArrayList<>(steps);
    ordered.sort(Comparator.comparingInt(StepDefinition::order));

    if (StepType.tryParse(ordered.get(0).type()) != StepType.SOURCE) errors.add("First step must be a source");

    // alias -> static schema; a null value means "exists, schema unknown"
    Map<String, List<Column>> available = new LinkedHashMap<>();
    List<PlannedStep> planned = new ArrayList<>(ordered.size());
    String previousAlias = null;

    for (StepDefinition def : ordered) {
      String alias = def.outputAlias() != null ? def.outputAlias() : "step_" + def.order();
      StepType type = StepType.tryParse(def.type());
      if (type == null) {
        errors.add("Step " + def.order() + ": unknown step type '" + def.type() + "'");
        available.putIfAbsent(alias, null);
        previousAlias = alias;
        continue;
      }

      String where = def.describe();
      List<String> problems = new ArrayList<>();
      StepConfig cfg = StepConfigParser.parse(type, def.config(), problems);
      for (String p : problems) errors.add(where + ": " + p);

      if (available.containsKey(alias)) errors.add(where + ": duplicate output alias '" + alias + "'");

      List<Column> schema = null;
      if (cfg != null) {
        List<String> inputs = resolveInputs(cfg, where, previousAlias, available, errors, warnings);
        if (inputs != null) {
          schema = staticSchema(cfg, inputs, available, where, errors, warnings);
          planned.add(new PlannedStep(def.order(), def.name(), type, cfg, inputs, alias));
        }
      }

      available.putIfAbsent(alias, schema);
      previousAlias = alias;
    }

    if (!errors.isEmpty()) return ValidationResult.invalid(errors, warnings);
    return new ValidationResult(true, errors, warnings, new ResolvedPlan(pipeline.id(), planned));
  }

  private static boolean checkOrders(List<StepDefinition> steps, List<String> errors) {
    int n = steps.size();
    Map<Integer, Integer> counts = new TreeMap<>();
    boolean ok = true;
    for (StepDefinition s : steps) {
      if (s.order() < 0) {
        errors.add("Invalid step order for step '" + s.name() + "'");
        ok = false;
        continue;
      }
      counts.merge(s.order(), 1, Integer::sum);
    }

    for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
      if (e.getValue() > 1) {
        errors.add("Duplicate step order " + e.getKey());
        ok = false;
      }
    }
    for (int i = 0; i < n; i++) {
      if (!counts.containsKey(i)) {
        errors.add("Step order gap: expected " + i);
        ok = false;
      }
    }
    return ok;
  }

  /** Returns null when an input could not be resolved (errors already recorded). */
  private List<String> resolveInputs(StepConfig cfg, String where, String previousAlias,
                                     Map<String, List<Column>> available, List<String> errors, List<String> warnings) {
    List<String> inputs = new ArrayList<>();
    boolean ok = true;
    switch (cfg.type()) {
      case SOURCE -> {
        SourceConfig src = (SourceConfig) cfg;
        if (dataSources.resolve(src.dataSourceId()).isEmpty()) {
          errors.add(where + ": data source not found: " + src.dataSourceId());
          ok = false;
        }
      }
      case JOIN -> {
        JoinConfig join = (JoinConfig) cfg;
        if (join.leftIsPrevious()) {
          ok = implicitPrevious(where, "left_source", previousAlias, inputs, errors, warnings);
        } else {
          ok = explicit(join.leftSource(), where, available, inputs, errors);
        }
        ok &= explicit(join.rightSource(), where, available, inputs, errors);
      }
      case UNION -> {
        for (String s : cfg.referencedAliases()) ok &= explicit(s, where, available, inputs, errors);
      }
      case FILTER, AGGREGATE, SELECT, SORT -> {
        List<String> refs = cfg.referencedAliases();
        if (refs.isEmpty()) {
          ok = implicitPrevious(where, "input", previousAlias, inputs, errors, warnings);
        } else {
          for (String r : refs) ok &= explicit(r, where, available, inputs, errors);
        }
      }
    }
    return ok ? inputs : null;
  }

  private static boolean explicit(String alias, String where, Map<String, List<Column>> available,
                                  List<String> inputs, List<String> errors) {
    if (!available.containsKey(alias)) {
      errors.add(where + ": alias not found: '" + alias + "'");
      return false;
    }
    inputs.add(alias);
    return true;
  }

  private static boolean implicitPrevious(String where, String field, String previousAlias, List<String> inputs,
                                          List<String> errors, List<String> warnings) {
    if (previousAlias == null) {
      errors.add(where + ": no previous step to use as '" + field + "'");
      return false;
    }
    warnings.add(where + ": no explicit '" + field + "'; using output of the previous step '" + previousAlias + "'");
    inputs.add(previousAlias);
    return true;
  }

  private List<Column> staticSchema(StepConfig cfg, List<String> inputs, Map<String, List<Column>> available,
                                    String where, List<String> errors, List<String> warnings) {
    if (cfg instanceof SourceConfig src) return sourceSchema(src, where, warnings);

    List<NamedDataset> in = new ArrayList<>(inputs.size());
    for (String a : inputs) {
      List<Column> cols = available.get(a);
      if (cols == null) return null;
      in.add(NamedDataset.empty(a, cols));
    }
    if (!columnsPresent(cfg, in, where, warnings)) return null;

    try {
      NamedDataset out = switch (cfg.type()) {
        case FILTER -> RowOperators.filter(in.get(0), (FilterConfig) cfg, "out");
        case JOIN -> RowOperators.join(in.get(0), in.get(1), (JoinConfig) cfg, "out");
        case AGGREGATE -> RowOperators.aggregate(in.get(0), (AggregateConfig) cfg, "out");
        case SELECT -> RowOperators.select(in.get(0), (SelectConfig) cfg, "out");
        case SORT -> RowOperators.sort(in.get(0), ((SortConfig) cfg).sortFields(), "out");
        case UNION -> RowOperators.union(in, ((UnionConfig) cfg).removeDuplicates(), "out");
        case SOURCE -> throw new IllegalStateException("source steps have no inputs");
      };
      return out.columns();
    } catch (SchemaException e) {
      // type misuse on known columns is fatal; shape mismatches may come from stale metadata
      if (cfg instanceof FilterConfig || cfg instanceof AggregateConfig) errors.add(where + ": " + e.getMessage());
      else warnings.add(where + ": " + e.getMessage());
      return null;
    }
  }

  private List<Column> sourceSchema(SourceConfig src, String where, List<String> warnings) {
    Optional<DataSourceDefinition> ds = dataSources.resolve(src.dataSourceId());
    if (ds.isEmpty()) return null;
    Optional<TableSchema> table = ds.get().table(src.tableName(), src.schemaName());
    if (table.isEmpty() || table.get().columns().isEmpty()) return null;
    if (src.columns().isEmpty()) return table.get().columns();

    List<Column> out = new ArrayList<>(src.columns().size());
    for (String c : src.columns()) {
      Optional<Column> col = table.get().column(c);
      if (col.isEmpty()) {
        warnings.add(where + ": column '" + c + "' is not declared for table '" + src.qualifiedTable() + "'");
        out.add(new Column(c, ColumnType.UNKNOWN));
      } else {
        out.add(col.get());
      }
    }
    return out;
  }

  private static boolean columnsPresent(StepConfig cfg, List<NamedDataset> in, String where, List<String> warnings) {
    List<String> missing = new ArrayList<>();
    switch (cfg.type()) {
      case FILTER -> {
        for (FilterCondition c : ((FilterConfig) cfg).conditions()) missingFrom(in.get(0), c.column(), missing);
      }
      case JOIN -> {
        JoinConfig j = (JoinConfig) cfg;
        missingFrom(in.get(0), j.leftOn(), missing);
        missingFrom(in.get(1), j.rightOn(), missing);
      }
      case AGGREGATE -> {
        AggregateConfig a = (AggregateConfig) cfg;
        for (String g : a.groupBy()) missingFrom(in.get(0), g, missing);
        for (AggregationSpec spec : a.aggregations()) missingFrom(in.get(0), spec.column(), missing);
      }
      case SELECT -> {
        for (String c : ((SelectConfig) cfg).columns()) missingFrom(in.get(0), c, missing);
      }
      case SORT -> {
        for (String c : ((SortConfig) cfg).columns()) missingFrom(in.get(0), c, missing);
      }
      case SOURCE, UNION -> { }
    }
    for (String m : missing) warnings.add(where + ": column '" + m + "' not found in declared schema");
    return missing.isEmpty();
  }

  private static void missingFrom(NamedDataset ds, String column, List<String> missing) {
    if (ds.column(column).isEmpty() && !missing.contains(column)) missing.add(column);
  }
}
