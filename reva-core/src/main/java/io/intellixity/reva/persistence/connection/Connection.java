package io.intellixity.reva.persistence.connection;

import io.intellixity.reva.persistence.exec.RunnerProviderFactory;
import io.intellixity.reva.persistence.manager.ReactiveEntityManager;
import io.intellixity.reva.persistence.repository.RepositoryResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A named store: the {@link Driver} used to open runners plus the {@link RepositoryResolver} for its entities.\n
 *
 * Entity managers reference a connection but never close it; the application closes the connection (and with it
 * the driver) when it shuts down.\n
 */
public final class Connection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Connection.class);

  private final ConnectionOptions options;
  private final Driver driver;
  private final RepositoryResolver repositories;
  private final RunnerProviderFactory runnerProviders;
  private volatile boolean closed;

  public Connection(ConnectionOptions options, Driver driver, RepositoryResolver repositories) {
    this(options, driver, repositories, RunnerProviderFactory.DEFAULT);
  }

  public Connection(ConnectionOptions options,
                    Driver driver,
                    RepositoryResolver repositories,
                    RunnerProviderFactory runnerProviders) {
    this.options = Objects.requireNonNull(options, "options");
    this.driver = Objects.requireNonNull(driver, "driver");
    this.repositories = Objects.requireNonNull(repositories, "repositories");
    this.runnerProviders = Objects.requireNonNull(runnerProviders, "runnerProviders");
  }

  public String name() { return options.name(); }
  public ConnectionOptions options() { return options; }
  public Driver driver() { return driver; }
  public RepositoryResolver repositories() { return repositories; }
  public RunnerProviderFactory runnerProviders() { return runnerProviders; }
  public boolean isClosed() { return closed; }

  /** Manager using the connection mode configured in {@link ConnectionOptions#useSingleDatabaseConnection()}. */
  public ReactiveEntityManager createEntityManager() {
    return createEntityManager(options.useSingleDatabaseConnection());
  }

  public ReactiveEntityManager createEntityManager(boolean useSingleDatabaseConnection) {
    if (closed) throw new IllegalStateException("Connection '" + name() + "' is closed");
    return new ReactiveEntityManager(this, useSingleDatabaseConnection);
  }

  /**
   * Manager bound to one runner for its whole life. Callers must {@link ReactiveEntityManager#release()} it.
   */
  public ReactiveEntityManager createIsolatedEntityManager() {
    return createEntityManager(true);
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    log.debug("reva.connection close name={} driverId={}", name(), driver.id());
    driver.close();
  }
}
