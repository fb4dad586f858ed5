package io.intellixity.vista.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.vista.catalog.DataSourceDefinition;
import io.intellixity.vista.error.DataSourceException;
import io.intellixity.vista.spi.backend.ConnectionPools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One Hikari pool per data source id and JDBC url.\n
 *
 * The url is {@code jdbc_url} when configured, otherwise built from {@code host}, {@code port} and
 * {@code database} for the data source type.
 */
public final class HikariConnectionPools implements ConnectionPools, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HikariConnectionPools.class);

  private final VistaProperties.Pool settings;
  private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();

  public HikariConnectionPools(VistaProperties.Pool settings) {
    this.settings = settings;
  }

  @Override
  public DataSource pool(DataSourceDefinition ds) {
    String url = jdbcUrl(ds);
    String poolKey = ds.id() + "|" + url;
    return pools.computeIfAbsent(poolKey, k -> {
      HikariConfig hc = new HikariConfig();
      hc.setPoolName("vista-" + ds.id());
      hc.setJdbcUrl(url);
      hc.setUsername(ds.configString("username"));
      hc.setPassword(ds.configString("password"));
      hc.setMaximumPoolSize(settings.getMaximumPoolSize());
      hc.setConnectionTimeout(settings.getConnectionTimeout().toMillis());
      // pools start lazily so an unreachable database fails the run, not the lookup
      hc.setInitializationFailTimeout(-1);
      hc.setReadOnly(true);
      log.info("vista.pool create dataSourceId={} type={} poolName={}", ds.id(), ds.type(), hc.getPoolName());
      return new HikariDataSource(hc);
    });
  }

  static String jdbcUrl(DataSourceDefinition ds) {
    String explicit = ds.configString("jdbc_url");
    if (explicit != null) return explicit;

    String host = ds.configString("host");
    String database = ds.configString("database");
    if (host == null || database == null) {
      throw new DataSourceException("Data source '" + ds.id() + "' needs 'jdbc_url' or 'host' and 'database'");
    }
    String port = ds.configString("port");
    String type = ds.type().toLowerCase(Locale.ROOT);
    return switch (type) {
      case "postgresql", "postgres" -> "jdbc:postgresql://" + host + ":" + (port == null ? "5432" : port) + "/" + database;
      case "mysql" -> "jdbc:mysql://" + host + ":" + (port == null ? "3306" : port) + "/" + database;
      case "mariadb" -> "jdbc:mariadb://" + host + ":" + (port == null ? "3306" : port) + "/" + database;
      default -> throw new DataSourceException("Data source '" + ds.id() + "' of type '" + type + "' needs 'jdbc_url'");
    };
  }

  int size() {
    return pools.size();
  }

  @Override
  public void close() {
    for (HikariDataSource ds : pools.values()) ds.close();
    pools.clear();
  }
}
