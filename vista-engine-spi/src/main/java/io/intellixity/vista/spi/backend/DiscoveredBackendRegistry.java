package io.intellixity.vista.spi.backend;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.error.DataSourceException;
import io.intellixity.vista.util.VistaFactoriesLoader;

import java.util.*;

/**
 * Maps data source types to {@link BackendProvider}s found via {@code META-INF/vista.factories}.\n
 *
 * The first provider registered for a type wins; later ones for the same type are ignored.
 */
public final class DiscoveredBackendRegistry {
  private final Map<String, BackendProvider> byType;

  public DiscoveredBackendRegistry() {
    this(VistaFactoriesLoader.load(BackendProvider.class));
  }

  public DiscoveredBackendRegistry(List<BackendProvider> providers) {
    Map<String, BackendProvider> m = new LinkedHashMap<>();
    for (BackendProvider p : providers) {
      if (p == null || p.types() == null) continue;
      for (String t : p.types()) {
        if (t == null || t.isBlank()) continue;
        m.putIfAbsent(t.trim().toLowerCase(Locale.ROOT), p);
      }
    }
    this.byType = Collections.unmodifiableMap(m);
  }

  public Set<String> supportedTypes() {
    return byType.keySet();
  }

  public ExecutionBackend create(DataSourceDefinition ds, BackendContext ctx) {
    BackendProvider p = byType.get(ds.type());
    if (p == null) {
      throw new DataSourceException("Unsupported data source type '" + ds.type() + "' for '" + ds.id()
          + "'; supported: " + byType.keySet());
    }
    return p.create(ds, ctx);
  }
}
