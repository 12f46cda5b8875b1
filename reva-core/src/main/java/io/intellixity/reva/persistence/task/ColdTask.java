package io.intellixity.reva.persistence.task;

import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Bridge from an asynchronous task to a cold, single-shot {@link Mono}.\n
 *
 * Contract:\n
 * - nothing runs until the Mono is subscribed\n
 * - every subscription invokes the task again; results are never cached or shared between subscribers\n
 * - the Mono emits at most one value then completes, or fails with the task's original error\n
 * - a synchronous throw from the task is delivered as the error signal\n
 * - cancelling a subscription does not cancel the task; it runs to completion (including any cleanup it does)\n
 */
public final class ColdTask {
  private ColdTask() {}

  public static <T> Mono<T> of(Supplier<? extends CompletionStage<T>> task) {
    Objects.requireNonNull(task, "task");
    return Mono.fromFuture(() -> Stages.unwrapped(Stages.call(task)), true);
  }
}
