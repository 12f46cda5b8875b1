package io.intellixity.reva.persistence.repository;

/**
 * Raised when no {@link Repository} is registered for an {@link EntityTarget}.
 */
public final class RepositoryNotFoundException extends RuntimeException {
  private final transient EntityTarget<?> target;

  public RepositoryNotFoundException(EntityTarget<?> target) {
    super("No repository registered for target '" + (target == null ? "null" : target.name()) + "'");
    this.target = target;
  }

  public EntityTarget<?> target() {
    return target;
  }
}
