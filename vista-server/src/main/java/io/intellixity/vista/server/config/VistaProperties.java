package io.intellixity.vista.server.config;

import io.intellixity.vista.engine.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "vista")
public class VistaProperties {
  /** Catalog bootstrap file; {@code classpath:} and {@code file:} locations are accepted. */
  private String catalogPath = "classpath:catalog/catalog.json";
  private final Engine engine = new Engine();
  private final Pool pool = new Pool();

  public String getCatalogPath() { return catalogPath; }
  public void setCatalogPath(String catalogPath) { this.catalogPath = catalogPath; }
  public Engine getEngine() { return engine; }
  public Pool getPool() { return pool; }

  public static class Engine {
    private int workerPoolSize = 4;
    private Duration runTimeout = Duration.ofMinutes(30);
    private Duration previewTimeout = Duration.ofSeconds(60);
    private int previewRowCap = 1000;
    private int defaultQueryLimit = 1000;
    private int maxQueryRows = 100_000;
    private int backendCacheEntries = 32;
    private int fileCacheEntries = 16;
    private Duration fileCacheTtl = Duration.ofMinutes(10);

    public int getWorkerPoolSize() { return workerPoolSize; }
    public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
    public Duration getRunTimeout() { return runTimeout; }
    public void setRunTimeout(Duration runTimeout) { this.runTimeout = runTimeout; }
    public Duration getPreviewTimeout() { return previewTimeout; }
    public void setPreviewTimeout(Duration previewTimeout) { this.previewTimeout = previewTimeout; }
    public int getPreviewRowCap() { return previewRowCap; }
    public void setPreviewRowCap(int previewRowCap) { this.previewRowCap = previewRowCap; }
    public int getDefaultQueryLimit() { return defaultQueryLimit; }
    public void setDefaultQueryLimit(int defaultQueryLimit) { this.defaultQueryLimit = defaultQueryLimit; }
    public int getMaxQueryRows() { return maxQueryRows; }
    public void setMaxQueryRows(int maxQueryRows) { this.maxQueryRows = maxQueryRows; }
    public int getBackendCacheEntries() { return backendCacheEntries; }
    public void setBackendCacheEntries(int backendCacheEntries) { this.backendCacheEntries = backendCacheEntries; }
    public int getFileCacheEntries() { return fileCacheEntries; }
    public void setFileCacheEntries(int fileCacheEntries) { this.fileCacheEntries = fileCacheEntries; }
    public Duration getFileCacheTtl() { return fileCacheTtl; }
    public void setFileCacheTtl(Duration fileCacheTtl) { this.fileCacheTtl = fileCacheTtl; }

    public EngineSettings toSettings() {
      return new EngineSettings(workerPoolSize, runTimeout, previewTimeout, previewRowCap, defaultQueryLimit,
          maxQueryRows, backendCacheEntries, fileCacheEntries, fileCacheTtl);
    }
  }

  public static class Pool {
    private int maximumPoolSize = 10;
    private Duration connectionTimeout = Duration.ofSeconds(30);

    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
  }
}
