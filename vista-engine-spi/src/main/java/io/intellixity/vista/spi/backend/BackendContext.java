package io.intellixity.vista.spi.backend;

import java.util.Objects;

/**
 * Shared services handed to {@link BackendProvider}s.
 *
 * @param pools            JDBC pools for SQL backends
 * @param fileCacheEntries max cached file tables per embedded backend
 * @param fileCacheTtlMillis expire-after-write for cached file tables; 0 disables
 */
public record BackendContext(ConnectionPools pools, int fileCacheEntries, long fileCacheTtlMillis) {
  public BackendContext {
    Objects.requireNonNull(pools, "pools");
    if (fileCacheEntries <= 0) throw new IllegalArgumentException("fileCacheEntries must be > 0");
    if (fileCacheTtlMillis < 0) throw new IllegalArgumentException("fileCacheTtlMillis must be >= 0");
  }

  public static BackendContext defaults(ConnectionPools pools) {
    return new BackendContext(pools, 16, 10 * 60_000L);
  }
}
