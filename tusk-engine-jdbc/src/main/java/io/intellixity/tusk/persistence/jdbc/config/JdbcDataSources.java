package io.intellixity.tusk.persistence.jdbc.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.tusk.persistence.jdbc.JdbcHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Pooled {@link javax.sql.DataSource} construction from {@link JdbcSettings}. */
public final class JdbcDataSources {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataSources.class);

  public static final String POOL_NAME = "tusk";

  private JdbcDataSources() {}

  public static HikariConfig config(JdbcSettings settings) {
    Objects.requireNonNull(settings, "settings");
    HikariConfig hc = new HikariConfig();
    hc.setPoolName(POOL_NAME);
    hc.setJdbcUrl(settings.url());
    if (settings.username() != null) hc.setUsername(settings.username());
    if (settings.password() != null) hc.setPassword(settings.password());
    if (settings.schema() != null) hc.setSchema(settings.schema());
    hc.setMaximumPoolSize(settings.poolMaxSize());
    hc.setMinimumIdle(Math.min(settings.poolMinIdle(), settings.poolMaxSize()));
    hc.setConnectionTimeout(settings.connectionTimeoutMs());
    return hc;
  }

  /** Caller owns the returned pool and must close it. */
  public static HikariDataSource create(JdbcSettings settings) {
    HikariConfig hc = config(settings);
    log.info("tusk.jdbc pool=create name={} url={} maxSize={}", POOL_NAME, settings.url(), settings.poolMaxSize());
    return new HikariDataSource(hc);
  }

  public static JdbcHandle handle(JdbcSettings settings) {
    return new JdbcHandle("jdbc:" + settings.url(), create(settings), settings.schema());
  }
}
