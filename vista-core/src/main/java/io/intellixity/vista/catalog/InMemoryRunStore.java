package io.intellixity.vista.catalog;

import io.intellixity.vista.error.NotFoundException;
import io.intellixity.vista.run.PipelineRun;
import io.intellixity.vista.run.RunStatus;
import io.intellixity.vista.run.StepLogEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemoryRunStore implements RunStore {
  private final ConcurrentHashMap<String, PipelineRun> runs = new ConcurrentHashMap<>();
  // creation sequence; breaks startedAt ties in listings
  private final ConcurrentHashMap<String, Long> created = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public InMemoryRunStore() {
    this(Clock.systemUTC());
  }

  public InMemoryRunStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public PipelineRun create(PipelineRun run) {
    Objects.requireNonNull(run, "run");
    if (runs.putIfAbsent(run.id(), run) != null) {
      throw new IllegalStateException("Run already exists: " + run.id());
    }
    created.put(run.id(), sequence.incrementAndGet());
    return run;
  }

  @Override
  public PipelineRun markRunning(String runId) {
    return runs.compute(runId, (id, cur) -> {
      requireExisting(id, cur);
      if (cur.status() != RunStatus.QUEUED) {
        throw new IllegalStateException("Run " + id + " cannot start from status " + cur.status().id());
      }
      return cur.withStatus(RunStatus.RUNNING);
    });
  }

  @Override
  public PipelineRun complete(String runId, RunStatus status, long rowsProcessed, double executionTimeSeconds,
                              List<StepLogEntry> log, String errorMessage) {
    Objects.requireNonNull(status, "status");
    if (!status.terminal()) throw new IllegalArgumentException("Not a terminal status: " + status.id());
    return runs.compute(runId, (id, cur) -> {
      requireExisting(id, cur);
      if (cur.status().terminal()) {
        throw new IllegalStateException("Run " + id + " is already " + cur.status().id());
      }
      return cur.completed(status, clock.instant(), rowsProcessed, executionTimeSeconds, log, errorMessage);
    });
  }

  @Override
  public PipelineRun markPartial(String runId, String message) {
    return runs.compute(runId, (id, cur) -> {
      requireExisting(id, cur);
      if (cur.status() != RunStatus.SUCCESS) {
        throw new IllegalStateException("Run " + id + " is " + cur.status().id() + "; only a successful run can become partial");
      }
      return cur.withError(RunStatus.PARTIAL, message);
    });
  }

  @Override
  public Optional<PipelineRun> get(String runId) {
    return runId == null ? Optional.empty() : Optional.ofNullable(runs.get(runId));
  }

  @Override
  public List<PipelineRun> listByPipeline(String pipelineId, int offset, int limit) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    List<PipelineRun> matching = new ArrayList<>();
    for (PipelineRun r : runs.values()) {
      if (Objects.equals(pipelineId, r.pipelineId())) matching.add(r);
    }
    Comparator<PipelineRun> oldestFirst = Comparator
        .comparing(PipelineRun::startedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
        .thenComparing(r -> created.getOrDefault(r.id(), 0L));
    matching.sort(oldestFirst.reversed());
    if (offset >= matching.size()) return List.of();
    return List.copyOf(matching.subList(offset, Math.min(matching.size(), offset + limit)));
  }

  private static void requireExisting(String id, PipelineRun cur) {
    if (cur == null) throw new NotFoundException("run", id);
  }
}
