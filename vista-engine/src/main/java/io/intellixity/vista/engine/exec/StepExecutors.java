package io.intellixity.vista.engine.exec;

import io.intellixity.vista.pipeline.StepType;

/** Executor lookup by step type. */
public final class StepExecutors {
  private static final StepExecutor SOURCE = new SourceStepExecutor();
  private static final StepExecutor FILTER = new FilterStepExecutor();
  private static final StepExecutor JOIN = new JoinStepExecutor();
  private static final StepExecutor AGGREGATE = new AggregateStepExecutor();
  private static final StepExecutor SELECT = new SelectStepExecutor();
  private static final StepExecutor SORT = new SortStepExecutor();
  private static final StepExecutor UNION = new UnionStepExecutor();

  private StepExecutors() {}

  public static StepExecutor forType(StepType type) {
    return switch (type) {
      case SOURCE -> SOURCE;
      case FILTER -> FILTER;
      case JOIN -> JOIN;
      case AGGREGATE -> AGGREGATE;
      case SELECT -> SELECT;
      case SORT -> SORT;
      case UNION -> UNION;
    };
  }
}
