package io.intellixity.vista.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for the engine. Hosts bind these from their own configuration.
 *
 * @param workerPoolSize     runs executing concurrently; further runs queue
 * @param runTimeout         hard limit for a normal run
 * @param previewTimeout     hard limit for a preview run
 * @param previewRowCap      source row cap applied in preview mode
 * @param defaultQueryLimit  semantic query limit when the request gives none
 * @param maxQueryRows       upper clamp for semantic query limits
 * @param backendCacheEntries live backends kept (one per data source definition)
 * @param fileCacheEntries   cached file tables per embedded backend
 * @param fileCacheTtl       expire-after-write for cached file tables
 */
public record EngineSettings(int workerPoolSize, Duration runTimeout, Duration previewTimeout, int previewRowCap,
                             int defaultQueryLimit, int maxQueryRows, int backendCacheEntries, int fileCacheEntries,
                             Duration fileCacheTtl) {
  public EngineSettings {
    if (workerPoolSize <= 0) throw new IllegalArgumentException("workerPoolSize must be > 0");
    Objects.requireNonNull(runTimeout, "runTimeout");
    Objects.requireNonNull(previewTimeout, "previewTimeout");
    Objects.requireNonNull(fileCacheTtl, "fileCacheTtl");
    if (runTimeout.isNegative() || runTimeout.isZero()) throw new IllegalArgumentException("runTimeout must be > 0");
    if (previewTimeout.isNegative() || previewTimeout.isZero()) throw new IllegalArgumentException("previewTimeout must be > 0");
    if (previewRowCap <= 0) throw new IllegalArgumentException("previewRowCap must be > 0");
    if (maxQueryRows <= 0) throw new IllegalArgumentException("maxQueryRows must be > 0");
    if (defaultQueryLimit <= 0) throw new IllegalArgumentException("defaultQueryLimit must be > 0");
    if (backendCacheEntries <= 0) throw new IllegalArgumentException("backendCacheEntries must be > 0");
    if (fileCacheEntries <= 0) throw new IllegalArgumentException("fileCacheEntries must be > 0");
  }

  public static EngineSettings defaults() {
    return new EngineSettings(4, Duration.ofMinutes(30), Duration.ofSeconds(60), 1000, 1000, 100_000, 32, 16,
        Duration.ofMinutes(10));
  }

  public EngineSettings withTimeouts(Duration run, Duration preview) {
    return new EngineSettings(workerPoolSize, run, preview, previewRowCap, defaultQueryLimit, maxQueryRows,
        backendCacheEntries, fileCacheEntries, fileCacheTtl);
  }
}
