package io.intellixity.reva.persistence.exec;

import java.util.concurrent.CompletionStage;

/**
 * Acquisition strategy for {@link Runner}s.\n
 *
 * Every successful {@link #provide()} must be matched by exactly one {@link #release(Runner)}, whatever the outcome
 * of the work done with the runner.\n
 */
public interface RunnerProvider {
  CompletionStage<Runner> provide();

  CompletionStage<Void> release(Runner runner);

  /**
   * Release the runner kept for reuse, if this provider keeps one.\n
   *
   * Providers that hand out a fresh runner per call have nothing to do here.\n
   */
  CompletionStage<Void> releaseReused();
}
