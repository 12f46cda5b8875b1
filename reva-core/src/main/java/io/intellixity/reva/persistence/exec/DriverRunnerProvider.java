package io.intellixity.reva.persistence.exec;

import io.intellixity.reva.persistence.connection.Driver;
import io.intellixity.reva.persistence.task.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link RunnerProvider} backed by a {@link Driver}.\n
 *
 * Modes:\n
 * - transient ({@code reuseRunner=false}): each {@link #provide()} creates a new runner, {@link #release(Runner)}
 *   gives it back\n
 * - reused ({@code reuseRunner=true}): the first {@link #provide()} creates the runner and later calls return the
 *   same one; {@link #release(Runner)} keeps it open and {@link #releaseReused()} gives it back\n
 */
public final class DriverRunnerProvider implements RunnerProvider {
  private static final Logger log = LoggerFactory.getLogger(DriverRunnerProvider.class);

  private final Driver driver;
  private final boolean reuseRunner;
  private CompletableFuture<Runner> reused;
  private boolean disposed;

  public DriverRunnerProvider(Driver driver, boolean reuseRunner) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.reuseRunner = reuseRunner;
  }

  @Override
  public CompletionStage<Runner> provide() {
    if (!reuseRunner) return Stages.call(driver::createRunner);

    CompletableFuture<Runner> current;
    synchronized (this) {
      if (disposed) {
        return CompletableFuture.failedFuture(
            new IllegalStateException("Reused runner of driver " + driver.id() + " was already released"));
      }
      if (reused == null) {
        CompletableFuture<Runner> created = Stages.call(driver::createRunner).toCompletableFuture();
        reused = created;
        // A failed acquisition must not stick: the next provide() tries again.
        created.whenComplete((runner, error) -> {
          if (error != null) forget(created);
        });
        log.debug("reva.provider reused runner requested driverId={}", driver.id());
      }
      current = reused;
    }
    return current.minimalCompletionStage();
  }

  @Override
  public CompletionStage<Void> release(Runner runner) {
    Objects.requireNonNull(runner, "runner");
    // Every runner handed out in reuse mode is the reused one; it is given back by releaseReused().
    if (reuseRunner) return CompletableFuture.completedFuture(null);
    return Stages.call(runner::release);
  }

  @Override
  public CompletionStage<Void> releaseReused() {
    CompletableFuture<Runner> current;
    synchronized (this) {
      if (reuseRunner) disposed = true;
      current = reused;
      reused = null;
    }
    if (current == null) return CompletableFuture.completedFuture(null);

    // A runner that was never acquired has nothing to give back.
    return current
        .handle((runner, error) -> runner)
        .thenCompose(runner -> {
          if (runner == null || runner.isReleased()) return CompletableFuture.<Void>completedFuture(null);
          log.debug("reva.provider releasing reused runner driverId={} runnerId={}", driver.id(), runner.id());
          return Stages.call(runner::release);
        });
  }

  private synchronized void forget(CompletableFuture<Runner> failed) {
    if (reused == failed) reused = null;
  }
}
