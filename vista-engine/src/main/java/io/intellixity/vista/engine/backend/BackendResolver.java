package io.intellixity.vista.engine.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.spi.backend.BackendContext;
import io.intellixity.vista.spi.backend.DiscoveredBackendRegistry;
import io.intellixity.vista.spi.backend.ExecutionBackend;
import io.intellixity.vista.util.LruTtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Hands out one live {@link ExecutionBackend} per data source definition. A changed definition
 * (new connection config) gets a fresh backend; evicted backends are closed.
 */
public final class BackendResolver implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BackendResolver.class);

  private final DiscoveredBackendRegistry registry;
  private final BackendContext context;
  private final LruTtlCache<DataSourceDefinition, ExecutionBackend> backends;

  public BackendResolver(DiscoveredBackendRegistry registry, BackendContext context, int maxBackends) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.context = Objects.requireNonNull(context, "context");
    this.backends = new LruTtlCache<>(maxBackends, 0, 0, System::currentTimeMillis, BackendResolver::closeQuietly);
  }

  public ExecutionBackend backendFor(DataSourceDefinition dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return backends.getOrCompute(dataSource, () -> {
      ExecutionBackend b = registry.create(dataSource, context);
      log.debug("vista.backend created id={} type={}", b.id(), dataSource.type());
      return b;
    });
  }

  @Override
  public void close() {
    backends.clear();
  }

  private static void closeQuietly(DataSourceDefinition ds, ExecutionBackend backend) {
    try {
      backend.close();
    } catch (Exception e) {
      log.warn("vista.backend close failed id={} err={}", backend.id(), e.toString());
    }
  }
}
