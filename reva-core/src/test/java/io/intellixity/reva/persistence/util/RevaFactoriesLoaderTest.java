package io.intellixity.reva.persistence.util;

import io.intellixity.reva.persistence.connection.DriverFactory;
import io.intellixity.reva.persistence.connection.RecordingDriverFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RevaFactoriesLoaderTest {

  @Test
  void load_instantiatesEachListedClassOnce() {
    List<DriverFactory> factories = RevaFactoriesLoader.load(DriverFactory.class);
    assertEquals(1, factories.size());
    assertTrue(factories.get(0) instanceof RecordingDriverFactory);
  }

  @Test
  void load_unregisteredSpi_isEmpty() {
    assertTrue(RevaFactoriesLoader.load(Runnable.class).isEmpty());
  }
}
