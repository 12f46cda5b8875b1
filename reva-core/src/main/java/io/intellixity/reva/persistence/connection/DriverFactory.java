package io.intellixity.reva.persistence.connection;

/**
 * SPI for building {@link Driver}s from {@link ConnectionOptions}.\n
 *
 * Implementations are discovered through {@code META-INF/reva.factories}.\n
 */
public interface DriverFactory {
  /** Driver family served by this factory (matched against {@link ConnectionOptions#family()}). */
  String family();

  Driver create(ConnectionOptions options);
}
