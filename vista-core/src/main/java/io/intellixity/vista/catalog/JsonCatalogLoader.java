package io.intellixity.vista.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a {@link CatalogDocument} (snake_case JSON) into an {@link InMemoryCatalog}.\n
 *
 * Relative {@code file_path} / {@code directory} entries of file-backed data sources are resolved
 * against the directory of the catalog file.
 */
public final class JsonCatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(JsonCatalogLoader.class);
  static final List<String> PATH_KEYS = List.of("file_path", "directory");

  private final ObjectMapper json;

  public JsonCatalogLoader() {
    this(new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
  }

  public JsonCatalogLoader(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public InMemoryCatalog load(Path file) {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file)) {
      CatalogDocument doc = json.readValue(in, CatalogDocument.class);
      Path base = file.toAbsolutePath().getParent();
      return toCatalog(doc, base, file.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load catalog " + file, e);
    }
  }

  public InMemoryCatalog load(InputStream in, Path baseDir) {
    try {
      CatalogDocument doc = json.readValue(in, CatalogDocument.class);
      return toCatalog(doc, baseDir, "<stream>");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load catalog", e);
    }
  }

  private static InMemoryCatalog toCatalog(CatalogDocument doc, Path baseDir, String origin) {
    List<DataSourceDefinition> sources = new ArrayList<>();
    for (DataSourceDefinition ds : doc.dataSources()) sources.add(resolvePaths(ds, baseDir));
    InMemoryCatalog catalog = new InMemoryCatalog(doc.pipelines(), sources, doc.entities());
    log.info("vista.catalog loaded origin={} dataSources={} entities={} pipelines={}",
        origin, sources.size(), doc.entities().size(), doc.pipelines().size());
    return catalog;
  }

  private static DataSourceDefinition resolvePaths(DataSourceDefinition ds, Path baseDir) {
    if (baseDir == null) return ds;
    Map<String, Object> cfg = new LinkedHashMap<>(ds.connectionConfig());
    boolean changed = false;
    for (String key : PATH_KEYS) {
      Object v = cfg.get(key);
      if (!(v instanceof String s) || s.isBlank()) continue;
      Path p = Path.of(s);
      if (p.isAbsolute()) continue;
      cfg.put(key, baseDir.resolve(p).normalize().toString());
      changed = true;
    }
    if (!changed) return ds;
    return new DataSourceDefinition(ds.id(), ds.name(), ds.type(), cfg, ds.tables(), ds.certified());
  }
}
