package io.intellixity.vista.jdbc;

import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.NamedDataset;
import io.intellixity.vista.error.DataSourceException;
import io.intellixity.vista.error.SchemaException;
import io.intellixity.vista.jdbc.dialect.JdbcDialect;
import io.intellixity.vista.pipeline.config.SourceConfig;
import io.intellixity.vista.spi.backend.AbstractExecutionBackend;
import io.intellixity.vista.spi.query.CompiledQuery;
import io.intellixity.vista.spi.query.SqlFlavor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SQL backend. Source projection and row caps, and whole semantic queries, are pushed down to the
 * database as one statement each; the remaining step operations run on the loaded datasets.
 */
public final class JdbcBackend extends AbstractExecutionBackend {
  private static final Logger log = LoggerFactory.getLogger(JdbcBackend.class);

  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private final int queryTimeoutSeconds;

  public JdbcBackend(DataSourceDefinition dataSource, JdbcHandle handle, JdbcDialect dialect, int queryTimeoutSeconds) {
    super("jdbc", dataSource);
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.queryTimeoutSeconds = Math.max(0, queryTimeoutSeconds);
  }

  public JdbcDialect dialect() { return dialect; }

  @Override
  public SqlFlavor sqlFlavor() {
    return dialect;
  }

  @Override
  public NamedDataset loadSource(SourceConfig cfg, String alias, int rowCap) {
    SqlStatement ss = dialect.renderSourceSelect(cfg, handle.schema(), rowCap);
    JdbcColumns.ReadResult r = execute("SOURCE", ss, cfg.columns(), null);
    return new NamedDataset(alias, r.columns(), r.rows());
  }

  @Override
  public NamedDataset runQuery(CompiledQuery query, String alias) {
    List<ColumnType> declared = new ArrayList<>(query.resultColumns().size());
    for (Column c : query.resultColumns()) declared.add(c.type());
    JdbcColumns.ReadResult r = execute("QUERY", new SqlStatement(query.sql(), query.binds()), null,
        new Expected(query.resultColumnNames(), declared));
    return new NamedDataset(alias, r.columns(), r.rows());
  }

  private JdbcColumns.ReadResult execute(String op, SqlStatement named, List<String> requested, Expected expected) {
    SqlStatement ss = ParamSqlCompiler.compile(named);
    long start = System.nanoTime();
    debugSql(op, ss);
    Connection c = connect();
    try (c; PreparedStatement ps = c.prepareStatement(ss.sql())) {
      if (queryTimeoutSeconds > 0) ps.setQueryTimeout(queryTimeoutSeconds);
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        JdbcColumns.ReadResult out = (expected != null)
            ? JdbcColumns.read(rs, expected.names(), expected.types())
            : JdbcColumns.read(rs, JdbcColumns.matchRequested(requested, rs.getMetaData()), null);
        debugDone(op, out.rows().size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  private Connection connect() {
    try {
      return handle.client().getConnection();
    } catch (SQLException e) {
      throw new DataSourceException("Cannot connect to data source '" + dataSource().id() + "': " + e.getMessage(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    int idx = 1;
    for (Object v : ss.binds()) {
      if (v == null) ps.setNull(idx++, Types.NULL);
      else ps.setObject(idx++, v);
    }
  }

  /** Class 42 (syntax error or access rule violation) covers unknown tables and columns. */
  private RuntimeException translate(SQLException e) {
    String state = e.getSQLState();
    String msg = "Query failed on data source '" + dataSource().id() + "': " + e.getMessage();
    if (state != null && state.startsWith("42")) return new SchemaException(msg, e);
    return new DataSourceException(msg, e);
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("vista.jdbc op={} bindCount={} handleId={} schema={} sql={}",
        op, ss.binds().size(), handle.id(), handle.schema(), ss.sql());

    // bind summary only, never values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        log.trace("vista.jdbc bind index={} valueType={}", idx++, v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private static void debugDone(String op, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("vista.jdbc_done op={} durationMs={} rows={}", op, durationNanos / 1_000_000.0, rows);
  }

  private record Expected(List<String> names, List<ColumnType> types) {}
}
