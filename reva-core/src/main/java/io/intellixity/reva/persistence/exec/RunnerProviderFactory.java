package io.intellixity.reva.persistence.exec;

import io.intellixity.reva.persistence.connection.Driver;

/** Creates the {@link RunnerProvider} used by an entity manager for a given driver and connection mode. */
@FunctionalInterface
public interface RunnerProviderFactory {
  RunnerProviderFactory DEFAULT = DriverRunnerProvider::new;

  RunnerProvider create(Driver driver, boolean reuseRunner);
}
