package io.intellixity.reva.persistence.connection;

import io.intellixity.reva.persistence.repository.RepositoryResolver;
import io.intellixity.reva.persistence.util.RevaFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Opens {@link Connection}s from {@link ConnectionOptions} using discovered {@link DriverFactory}s. */
public final class Connections {
  private static final Logger log = LoggerFactory.getLogger(Connections.class);

  private Connections() {}

  public static Connection open(ConnectionOptions options, RepositoryResolver repositories) {
    return open(options, repositories, RevaFactoriesLoader.load(DriverFactory.class));
  }

  public static Connection open(ConnectionOptions options,
                                RepositoryResolver repositories,
                                List<? extends DriverFactory> factories) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(repositories, "repositories");
    Objects.requireNonNull(factories, "factories");

    List<DriverFactory> matching = factories.stream()
        .filter(f -> options.family().equals(f.family()))
        .collect(Collectors.toList());
    if (matching.isEmpty()) {
      String known = factories.stream().map(DriverFactory::family).collect(Collectors.joining(", "));
      throw new IllegalArgumentException("No DriverFactory for family '" + options.family() + "' (known: [" + known + "])");
    }
    if (matching.size() > 1) {
      String classes = matching.stream().map(f -> f.getClass().getName()).collect(Collectors.joining(", "));
      throw new IllegalStateException("Several DriverFactory implementations for family '" + options.family()
          + "': [" + classes + "]");
    }
    DriverFactory factory = matching.get(0);

    Driver driver = factory.create(options);
    if (driver == null) throw new IllegalStateException("DriverFactory returned null for " + options);
    log.debug("reva.connection open name={} family={} driverId={}", options.name(), options.family(), driver.id());
    return new Connection(options, driver, repositories);
  }
}
