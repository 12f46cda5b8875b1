package io.intellixity.reva.persistence.manager;

import io.intellixity.reva.persistence.connection.Connection;
import io.intellixity.reva.persistence.exec.QueryResult;
import io.intellixity.reva.persistence.exec.Runner;
import io.intellixity.reva.persistence.exec.RunnerProvider;
import io.intellixity.reva.persistence.repository.EntitiesAndCount;
import io.intellixity.reva.persistence.repository.EntityTarget;
import io.intellixity.reva.persistence.repository.FindOptions;
import io.intellixity.reva.persistence.repository.Repository;
import io.intellixity.reva.persistence.repository.RepositoryResolver;
import io.intellixity.reva.persistence.task.ColdTask;
import io.intellixity.reva.persistence.task.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Entity manager that works with any entity: it finds the entity's repository and calls it, and it runs raw
 * queries and transactions on runners obtained from the connection's driver.\n
 *
 * Every operation returns a cold {@link Mono}: nothing happens until subscription, and each subscription runs the
 * operation again (a new runner acquisition for {@link #query(String)} and {@link #transaction(Supplier)}).
 * Results are never cached or shared between subscribers.\n
 *
 * Connection modes:\n
 * - per-call ({@code useSingleDatabaseConnection=false}): each query/transaction acquires and releases its own runner\n
 * - single ({@code useSingleDatabaseConnection=true}): one runner is opened on first use and reused until
 *   {@link #release()}; statements issued concurrently on such a manager share that runner and may interleave\n
 */
public final class ReactiveEntityManager {
  private static final Logger log = LoggerFactory.getLogger(ReactiveEntityManager.class);

  private final Connection connection;
  private final boolean useSingleDatabaseConnection;
  private volatile ManagerState state = ManagerState.ACTIVE;
  private RunnerProvider sharedRunnerProvider;

  public ReactiveEntityManager(Connection connection, boolean useSingleDatabaseConnection) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.useSingleDatabaseConnection = useSingleDatabaseConnection;
  }

  public Connection connection() { return connection; }
  public boolean useSingleDatabaseConnection() { return useSingleDatabaseConnection; }
  public ManagerState state() { return state; }
  public boolean isReleased() { return state == ManagerState.RELEASED; }

  // --- Repositories ---

  public boolean hasRepository(EntityTarget<?> target) {
    return repositories().has(target);
  }

  /** Resolve eagerly; throws {@link io.intellixity.reva.persistence.repository.RepositoryNotFoundException}. */
  public <T> Repository<T> getRepository(EntityTarget<T> target) {
    return repositories().resolve(Objects.requireNonNull(target, "target"));
  }

  public <T> Repository<T> getRepository(Class<T> type) {
    return getRepository(EntityTarget.of(type));
  }

  // --- Persist / remove ---

  /** Persist using the repository of the entity's runtime class. */
  public <T> Mono<T> persist(T entity) {
    return persist(EntityRequest.of(entity));
  }

  /** Persist using the repository of {@code target}, whatever the entity's runtime class is. */
  public <T> Mono<T> persist(EntityTarget<T> target, T entity) {
    return persist(EntityRequest.of(target, entity));
  }

  public <T> Mono<T> persist(EntityRequest<T> request) {
    Objects.requireNonNull(request, "request");
    return Mono.defer(() -> repositories().resolve(request.resolvedTarget()).persist(request.entity()));
  }

  public <T> Mono<T> remove(T entity) {
    return remove(EntityRequest.of(entity));
  }

  public <T> Mono<T> remove(EntityTarget<T> target, T entity) {
    return remove(EntityRequest.of(target, entity));
  }

  public <T> Mono<T> remove(EntityRequest<T> request) {
    Objects.requireNonNull(request, "request");
    return Mono.defer(() -> repositories().resolve(request.resolvedTarget()).remove(request.entity()));
  }

  // --- Finders ---
  // Positional rule: both conditions and options -> forward both; only one -> forward it alone; none -> no-arg call.

  public <T> Mono<List<T>> find(EntityTarget<T> target) {
    return find(target, null, null);
  }

  public <T> Mono<List<T>> find(EntityTarget<T> target, Map<String, ?> conditions) {
    return find(target, conditions, null);
  }

  public <T> Mono<List<T>> find(EntityTarget<T> target, FindOptions options) {
    return find(target, null, options);
  }

  public <T> Mono<List<T>> find(EntityTarget<T> target, Map<String, ?> conditions, FindOptions options) {
    Objects.requireNonNull(target, "target");
    return Mono.defer(() -> {
      Repository<T> repository = repositories().resolve(target);
      if (conditions != null && options != null) return repository.find(conditions, options);
      if (conditions != null) return repository.find(conditions);
      if (options != null) return repository.find(options);
      return repository.find();
    });
  }

  public <T> Mono<EntitiesAndCount<T>> findAndCount(EntityTarget<T> target) {
    return findAndCount(target, null, null);
  }

  public <T> Mono<EntitiesAndCount<T>> findAndCount(EntityTarget<T> target, Map<String, ?> conditions) {
    return findAndCount(target, conditions, null);
  }

  public <T> Mono<EntitiesAndCount<T>> findAndCount(EntityTarget<T> target, FindOptions options) {
    return findAndCount(target, null, options);
  }

  public <T> Mono<EntitiesAndCount<T>> findAndCount(EntityTarget<T> target,
                                                    Map<String, ?> conditions,
                                                    FindOptions options) {
    Objects.requireNonNull(target, "target");
    return Mono.defer(() -> {
      Repository<T> repository = repositories().resolve(target);
      if (conditions != null && options != null) return repository.findAndCount(conditions, options);
      if (conditions != null) return repository.findAndCount(conditions);
      if (options != null) return repository.findAndCount(options);
      return repository.findAndCount();
    });
  }

  public <T> Mono<T> findOne(EntityTarget<T> target) {
    return findOne(target, null, null);
  }

  public <T> Mono<T> findOne(EntityTarget<T> target, Map<String, ?> conditions) {
    return findOne(target, conditions, null);
  }

  public <T> Mono<T> findOne(EntityTarget<T> target, FindOptions options) {
    return findOne(target, null, options);
  }

  public <T> Mono<T> findOne(EntityTarget<T> target, Map<String, ?> conditions, FindOptions options) {
    Objects.requireNonNull(target, "target");
    return Mono.defer(() -> {
      Repository<T> repository = repositories().resolve(target);
      if (conditions != null && options != null) return repository.findOne(conditions, options);
      if (conditions != null) return repository.findOne(conditions);
      if (options != null) return repository.findOne(options);
      return repository.findOne();
    });
  }

  public <T> Mono<T> findOneById(EntityTarget<T> target, Object id) {
    return findOneById(target, id, null);
  }

  /** Forwards {@code (id, options)} as given; {@code options} may be null. */
  public <T> Mono<T> findOneById(EntityTarget<T> target, Object id, FindOptions options) {
    Objects.requireNonNull(target, "target");
    return Mono.defer(() -> repositories().resolve(target).findOneById(id, options));
  }

  // --- Raw queries and transactions ---

  /**
   * Execute a raw statement. Each subscription acquires a runner, executes, and releases the runner before the
   * result (or the execution error) is emitted.
   */
  public Mono<QueryResult> query(String sql) {
    Objects.requireNonNull(sql, "sql");
    return ColdTask.of(() -> {
      RunnerProvider provider = runnerProvider();
      return acquire(provider).thenCompose(runner ->
          Stages.guarantee(Stages.call(() -> runner.query(sql)), () -> provider.release(runner)));
    });
  }

  /**
   * Run {@code unitOfWork} inside a transaction.\n
   *
   * Per subscription: acquire a runner, begin, subscribe to the unit of work, then commit on success or roll back
   * on failure (of the unit of work or of the commit), then release the runner, then emit.\n
   *
   * - every attempt ends in commit or rollback; a failed begin or commit is rolled back\n
   * - the unit of work's own error is always the one emitted; a rollback failure is attached to it as suppressed\n
   * - an empty unit of work commits and completes empty\n
   *
   * The unit of work is only transactional for statements that run on the same runner, i.e. through this
   * manager in single-connection mode.\n
   */
  public <T> Mono<T> transaction(Supplier<? extends Mono<T>> unitOfWork) {
    Objects.requireNonNull(unitOfWork, "unitOfWork");
    return ColdTask.of(() -> {
      RunnerProvider provider = runnerProvider();
      return acquire(provider).thenCompose(runner ->
          Stages.guarantee(runInTransaction(runner, unitOfWork), () -> provider.release(runner)));
    });
  }

  /**
   * Dispose this manager: moves it to {@link ManagerState#RELEASED} and, in single-connection mode, releases the
   * shared runner. Releasing twice is a no-op. The connection itself stays open.
   */
  public Mono<Void> release() {
    return ColdTask.of(() -> {
      RunnerProvider shared;
      synchronized (this) {
        if (state == ManagerState.RELEASED) return CompletableFuture.<Void>completedFuture(null);
        state = ManagerState.RELEASED;
        shared = sharedRunnerProvider;
        sharedRunnerProvider = null;
      }
      log.debug("reva.manager released connection={} single={}", connection.name(), useSingleDatabaseConnection);
      if (shared == null) return CompletableFuture.<Void>completedFuture(null);
      return Stages.call(shared::releaseReused);
    });
  }

  /** A failed acquisition on a manager released meanwhile is reported as a released manager. */
  private CompletionStage<Runner> acquire(RunnerProvider provider) {
    return Stages.recoverWith(Stages.call(provider::provide), error -> {
      if (useSingleDatabaseConnection && isReleased()) {
        EntityManagerReleasedException released = new EntityManagerReleasedException(connection.name());
        released.addSuppressed(error);
        return CompletableFuture.<Runner>failedFuture(released);
      }
      return CompletableFuture.<Runner>failedFuture(error);
    });
  }

  private <T> CompletionStage<T> runInTransaction(Runner runner, Supplier<? extends Mono<T>> unitOfWork) {
    // begin is part of the attempt: a failed begin is rolled back too
    CompletionStage<T> attempt = Stages.call(runner::beginTransaction).thenCompose(begun -> {
      log.debug("reva.tx begin connection={} runnerId={}", connection.name(), runner.id());
      return Stages.call(() -> execute(unitOfWork));
    }).thenCompose(result -> Stages.call(runner::commitTransaction).thenApply(committed -> {
      log.debug("reva.tx commit connection={} runnerId={}", connection.name(), runner.id());
      return result;
    }));
    return Stages.recoverWith(attempt, error -> this.<T>rollback(runner, error));
  }

  private static <T> CompletableFuture<T> execute(Supplier<? extends Mono<T>> unitOfWork) {
    Mono<T> work = unitOfWork.get();
    if (work == null) throw new NullPointerException("unitOfWork returned null");
    return work.toFuture();
  }

  private <T> CompletionStage<T> rollback(Runner runner, Throwable cause) {
    CompletableFuture<T> failed = new CompletableFuture<>();
    Stages.call(runner::rollbackTransaction).whenComplete((ignored, rollbackError) -> {
      if (rollbackError == null) {
        log.debug("reva.tx rollback connection={} runnerId={} cause={}",
            connection.name(), runner.id(), cause.getClass().getSimpleName());
      } else {
        Throwable re = Stages.unwrap(rollbackError);
        log.warn("reva.tx rollback failed connection={} runnerId={}; surfacing original error {}",
            connection.name(), runner.id(), cause.toString(), re);
        Stages.suppress(cause, re);
      }
      failed.completeExceptionally(cause);
    });
    return failed;
  }

  /** Shared provider in single-connection mode (created on first use), else a fresh one per call. */
  private RunnerProvider runnerProvider() {
    if (!useSingleDatabaseConnection) {
      return connection.runnerProviders().create(connection.driver(), false);
    }
    synchronized (this) {
      if (state == ManagerState.RELEASED) throw new EntityManagerReleasedException(connection.name());
      if (sharedRunnerProvider == null) {
        sharedRunnerProvider = connection.runnerProviders().create(connection.driver(), true);
      }
      return sharedRunnerProvider;
    }
  }

  private RepositoryResolver repositories() {
    return connection.repositories();
  }
}
