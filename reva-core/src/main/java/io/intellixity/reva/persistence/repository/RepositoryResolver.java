package io.intellixity.reva.persistence.repository;

/** Maps an {@link EntityTarget} to the {@link Repository} handling it. */
public interface RepositoryResolver {
  /**
   * @throws RepositoryNotFoundException when nothing is registered for {@code target}
   */
  <T> Repository<T> resolve(EntityTarget<T> target);

  boolean has(EntityTarget<?> target);
}
