package io.intellixity.reva.persistence.repository;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple registry-backed {@link RepositoryResolver}.\n
 *
 * Useful for tests, demos, and applications that wire repositories by hand.\n
 */
public final class InMemoryRepositoryResolver implements RepositoryResolver {
  private final Map<EntityTarget<?>, Repository<?>> repositories = new ConcurrentHashMap<>();

  public <T> InMemoryRepositoryResolver register(EntityTarget<T> target, Repository<T> repository) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(repository, "repository");
    Repository<?> previous = repositories.putIfAbsent(target, repository);
    if (previous != null && previous != repository) {
      throw new IllegalStateException("Repository already registered for target '" + target.name() + "'");
    }
    return this;
  }

  public <T> InMemoryRepositoryResolver register(Class<T> type, Repository<T> repository) {
    return register(EntityTarget.of(type), repository);
  }

  @Override
  public <T> Repository<T> resolve(EntityTarget<T> target) {
    Objects.requireNonNull(target, "target");
    @SuppressWarnings("unchecked")
    Repository<T> repository = (Repository<T>) repositories.get(target);
    if (repository == null) throw new RepositoryNotFoundException(target);
    return repository;
  }

  @Override
  public boolean has(EntityTarget<?> target) {
    return target != null && repositories.containsKey(target);
  }

  public Set<EntityTarget<?>> targets() {
    return Set.copyOf(repositories.keySet());
  }
}
