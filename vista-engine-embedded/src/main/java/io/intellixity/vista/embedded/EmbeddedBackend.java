package io.intellixity.vista.embedded;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.error.DataSourceException;
import io.intellixity.vista.pipeline.config.SourceConfig;
import io.intellixity.vista.spi.backend.AbstractExecutionBackend;
import io.intellixity.vista.spi.query.CompiledQuery;
import io.intellixity.vista.spi.relational.RowOperators;
import io.intellixity.vista.util.LruTtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * In-process backend for CSV and Excel sources.\n
 *
 * Files are resolved from {@code connection_config.file_path} (one file; for Excel the table name
 * picks the sheet) or {@code connection_config.directory} ({@code <table>.csv}, {@code <table>.xlsx}).
 * Full loads are cached per file version (path, size, mtime). Capped loads keep only the first rows
 * but scan the rest of the file for column types, so they type columns as a full load does.
 * Semantic queries are evaluated on the loaded table through their logical form.
 */
public final class EmbeddedBackend extends AbstractExecutionBackend {
  private static final Logger log = LoggerFactory.getLogger(EmbeddedBackend.class);

  private final FileFormat format;
  private final LruTtlCache<FileKey, NamedDataset> tables;

  record FileKey(Path path, long size, long modifiedMillis, String sheet) {}

  private record Target(Path path, String sheet, boolean firstSheetFallback) {}

  public EmbeddedBackend(DataSourceDefinition dataSource, FileFormat format, int cacheEntries, long cacheTtlMillis) {
    super("embedded", dataSource);
    this.format = Objects.requireNonNull(format, "format");
    this.tables = new LruTtlCache<>(cacheEntries, cacheTtlMillis, 0);
  }

  public FileFormat format() { return format; }

  @Override
  public NamedDataset loadSource(SourceConfig cfg, String alias, int rowCap) {
    Target target = resolve(cfg.tableName());
    FileKey key = keyOf(target);
    NamedDataset cached = tables.get(key);

    NamedDataset table;
    if (cached != null) {
      table = rowCap > 0 ? cached.limit(rowCap) : cached;
    } else if (rowCap > 0) {
      table = read(target, rowCap, alias);
    } else {
      table = tables.getOrCompute(key, () -> read(target, 0, cfg.tableName()));
    }
    if (log.isDebugEnabled()) {
      log.debug("vista.embedded op=SOURCE ds={} file={} sheet={} rowCap={} cached={} rows={}",
          dataSource().id(), target.path(), target.sheet(), rowCap, cached != null, table.rowCount());
    }
    return project(table, cfg.columns(), alias);
  }

  @Override
  public NamedDataset runQuery(CompiledQuery query, String alias) {
    NamedDataset table = loadSource(new SourceConfig(dataSource().id(), query.logical().table()), query.logical().table(), 0);
    NamedDataset out = RowOperators.evaluate(query.logical(), table, alias);
    if (log.isDebugEnabled()) {
      log.debug("vista.embedded op=QUERY ds={} table={} rows={}", dataSource().id(), query.logical().table(), out.rowCount());
    }
    return out;
  }

  @Override
  public void close() {
    tables.clear();
  }

  private static NamedDataset project(NamedDataset table, List<String> columns, String alias) {
    if (columns.isEmpty()) return table.withAlias(alias);
    List<Column> cols = new ArrayList<>(columns.size());
    for (String c : columns) cols.add(table.requireColumn(c, "source columns"));
    List<Map<String, Object>> rows = new ArrayList<>(table.rowCount());
    for (Map<String, Object> r : table.rows()) {
      Map<String, Object> row = new LinkedHashMap<>(cols.size() * 2);
      for (Column c : cols) row.put(c.name(), r.get(c.name()));
      rows.add(row);
    }
    return new NamedDataset(alias, cols, rows);
  }

  private NamedDataset read(Target target, int rowCap, String alias) {
    try {
      RawTable raw = switch (format) {
        case CSV -> CsvTableReader.read(target.path(), CsvOptions.from(dataSource()), rowCap);
        case EXCEL -> ExcelTableReader.read(target.path(), target.sheet(), target.firstSheetFallback(), rowCap);
      };
      return TypeInference.toDataset(raw, alias);
    } catch (IOException e) {
      throw new DataSourceException("Cannot read " + target.path() + " for data source '" + dataSource().id() + "': "
          + e.getMessage(), e);
    }
  }

  private Target resolve(String tableName) {
    String file = dataSource().configString("file_path");
    String sheet = dataSource().configString("sheet_name");
    if (file != null) {
      Path p = Path.of(file);
      requireFile(p);
      if (format == FileFormat.CSV) return new Target(p, null, false);
      if (sheet != null) return new Target(p, sheet, false);
      // a table named after the file itself means "the first sheet"
      return new Target(p, tableName, stem(p).equals(tableName));
    }

    String dir = dataSource().configString("directory");
    if (dir == null) {
      throw new DataSourceException("Data source '" + dataSource().id()
          + "' needs connection_config.file_path or connection_config.directory");
    }
    for (String ext : format.extensions()) {
      Path p = Path.of(dir).resolve(tableName + ext);
      if (Files.isRegularFile(p)) return new Target(p, sheet, false);
    }
    throw new DataSourceException("File not found: " + Path.of(dir).resolve(tableName + format.extensions().get(0)));
  }

  private FileKey keyOf(Target t) {
    try {
      BasicFileAttributes a = Files.readAttributes(t.path(), BasicFileAttributes.class);
      return new FileKey(t.path().toAbsolutePath().normalize(), a.size(), a.lastModifiedTime().toMillis(),
          t.sheet() == null ? "" : t.sheet());
    } catch (IOException e) {
      throw new DataSourceException("Cannot stat " + t.path() + ": " + e.getMessage(), e);
    }
  }

  private static void requireFile(Path p) {
    if (!Files.isRegularFile(p)) throw new DataSourceException("File not found: " + p);
  }

  private static String stem(Path p) {
    String name = p.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? name : name.substring(0, dot);
  }
}
