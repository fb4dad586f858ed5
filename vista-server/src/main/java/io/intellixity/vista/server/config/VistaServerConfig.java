package io.intellixity.vista.server.config;

import io.intellixity.vista.catalog.InMemoryCatalog;
import io.intellixity.vista.catalog.InMemoryRunStore;
import io.intellixity.vista.catalog.JsonCatalogLoader;
import io.intellixity.vista.catalog.RunStore;
import io.intellixity.vista.engine.EngineSettings;
import io.intellixity.vista.engine.ExecutionOrchestrator;
import io.intellixity.vista.engine.backend.BackendResolver;
import io.intellixity.vista.spi.backend.BackendContext;
import io.intellixity.vista.spi.backend.DiscoveredBackendRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(VistaProperties.class)
public class VistaServerConfig {

  @Bean
  public InMemoryCatalog catalog(VistaProperties props, ResourceLoader resources) {
    return loadCatalog(resources.getResource(props.getCatalogPath()));
  }

  public static InMemoryCatalog loadCatalog(Resource resource) {
    JsonCatalogLoader loader = new JsonCatalogLoader();
    try {
      if (resource.isFile()) return loader.load(resource.getFile().toPath());
      // packaged resources: relative file paths resolve against the working directory
      try (InputStream in = resource.getInputStream()) {
        return loader.load(in, Path.of(System.getProperty("user.dir")));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read catalog " + resource.getDescription(), e);
    }
  }

  @Bean
  public RunStore runStore() {
    return new InMemoryRunStore();
  }

  @Bean
  public EngineSettings engineSettings(VistaProperties props) {
    return props.getEngine().toSettings();
  }

  @Bean(destroyMethod = "close")
  public HikariConnectionPools connectionPools(VistaProperties props) {
    return new HikariConnectionPools(props.getPool());
  }

  @Bean(destroyMethod = "close")
  public BackendResolver backendResolver(HikariConnectionPools pools, EngineSettings settings) {
    BackendContext ctx = new BackendContext(pools, settings.fileCacheEntries(), settings.fileCacheTtl().toMillis());
    return new BackendResolver(new DiscoveredBackendRegistry(), ctx, settings.backendCacheEntries());
  }

  @Bean(destroyMethod = "close")
  public ExecutionOrchestrator executionOrchestrator(InMemoryCatalog catalog, RunStore runs,
                                                     BackendResolver backends, EngineSettings settings) {
    return new ExecutionOrchestrator(catalog, catalog, catalog, runs, backends, settings, Clock.systemUTC());
  }
}
