package io.intellixity.reva.persistence.task;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link CompletionStage} combinators used by the resource-lifecycle code.\n
 *
 * All stages returned here settle with the original error, never with a {@link CompletionException} wrapper.\n
 */
public final class Stages {
  private Stages() {}

  /**
   * Invoke an asynchronous step, turning a synchronous throw (or a null stage) into a failed stage.
   */
  public static <T> CompletionStage<T> call(Supplier<? extends CompletionStage<T>> step) {
    Objects.requireNonNull(step, "step");
    try {
      CompletionStage<T> stage = step.get();
      if (stage == null) return CompletableFuture.failedFuture(new NullPointerException("step returned null stage"));
      return stage;
    } catch (Throwable t) {
      return CompletableFuture.failedFuture(unwrap(t));
    }
  }

  /**
   * Run {@code finalizer} once {@code stage} settled, whatever its outcome, and settle afterwards.\n
   *
   * - stage ok, finalizer ok: the stage's value\n
   * - stage ok, finalizer failed: the finalizer's error\n
   * - stage failed: the stage's error; a finalizer error is attached to it as suppressed\n
   */
  public static <T> CompletableFuture<T> guarantee(CompletionStage<T> stage,
                                                   Supplier<? extends CompletionStage<Void>> finalizer) {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(finalizer, "finalizer");
    CompletableFuture<T> out = new CompletableFuture<>();
    stage.whenComplete((value, error) -> {
      Throwable cause = (error == null) ? null : unwrap(error);
      call(finalizer).whenComplete((ignored, finalizerError) -> {
        Throwable fe = (finalizerError == null) ? null : unwrap(finalizerError);
        if (cause != null) {
          suppress(cause, fe);
          out.completeExceptionally(cause);
        } else if (fe != null) {
          out.completeExceptionally(fe);
        } else {
          out.complete(value);
        }
      });
    });
    return out;
  }

  /** On failure, continue with the stage produced by {@code recovery} for the (unwrapped) error. */
  public static <T> CompletableFuture<T> recoverWith(CompletionStage<T> stage,
                                                     Function<Throwable, ? extends CompletionStage<T>> recovery) {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(recovery, "recovery");
    CompletableFuture<T> out = new CompletableFuture<>();
    stage.whenComplete((value, error) -> {
      if (error == null) {
        out.complete(value);
        return;
      }
      Throwable cause = unwrap(error);
      Stages.<T>call(() -> recovery.apply(cause)).whenComplete((recovered, recoveryError) -> {
        if (recoveryError == null) out.complete(recovered);
        else out.completeExceptionally(unwrap(recoveryError));
      });
    });
    return out;
  }

  /** Copy of {@code stage} that settles with the unwrapped error. */
  public static <T> CompletableFuture<T> unwrapped(CompletionStage<T> stage) {
    Objects.requireNonNull(stage, "stage");
    CompletableFuture<T> out = new CompletableFuture<>();
    stage.whenComplete((value, error) -> {
      if (error == null) out.complete(value);
      else out.completeExceptionally(unwrap(error));
    });
    return out;
  }

  /** Strip {@link CompletionException}/{@link ExecutionException} wrappers. */
  public static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
      cur = cur.getCause();
    }
    return cur;
  }

  /** Attach {@code secondary} to {@code primary} unless they are the same throwable. */
  public static void suppress(Throwable primary, Throwable secondary) {
    if (primary == null || secondary == null || primary == secondary) return;
    primary.addSuppressed(secondary);
  }
}
