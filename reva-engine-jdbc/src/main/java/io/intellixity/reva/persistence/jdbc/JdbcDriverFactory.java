package io.intellixity.reva.persistence.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.reva.persistence.connection.ConnectionOptions;
import io.intellixity.reva.persistence.connection.Driver;
import io.intellixity.reva.persistence.connection.DriverFactory;

/** Family {@code jdbc}: a HikariCP pool per connection, closed with the driver. */
public final class JdbcDriverFactory implements DriverFactory {
  public static final String FAMILY = "jdbc";
  static final int DEFAULT_MAX_POOL_SIZE = 10;

  @Override
  public String family() {
    return FAMILY;
  }

  @Override
  public Driver create(ConnectionOptions options) {
    if (options.url() == null || options.url().isBlank()) {
      throw new IllegalArgumentException("url is required for connection '" + options.name() + "'");
    }
    HikariDataSource ds = new HikariDataSource(hikariConfig(options));
    return new JdbcDriver(FAMILY + ":" + options.name(), ds, options.schema(), null, ds);
  }

  static HikariConfig hikariConfig(ConnectionOptions options) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(options.url());
    hc.setUsername(options.username());
    hc.setPassword(options.password());
    hc.setMaximumPoolSize(options.maxPoolSize() == null ? DEFAULT_MAX_POOL_SIZE : options.maxPoolSize());
    hc.setPoolName("reva-" + options.name());
    return hc;
  }
}
