package io.intellixity.reva.persistence.manager;

import io.intellixity.reva.persistence.repository.EntityTarget;

import java.util.Objects;

/**
 * Entity plus the target selecting its repository.\n
 *
 * @param target explicit target; null means "the entity's runtime class"\n
 * @param entity payload, owned by the caller\n
 */
public record EntityRequest<T>(EntityTarget<T> target, T entity) {
  public EntityRequest {
    Objects.requireNonNull(entity, "entity");
  }

  public static <T> EntityRequest<T> of(T entity) {
    return new EntityRequest<>(null, entity);
  }

  public static <T> EntityRequest<T> of(EntityTarget<T> target, T entity) {
    return new EntityRequest<>(Objects.requireNonNull(target, "target"), entity);
  }

  /** The explicit target, or the class-based target of the entity's runtime class. */
  public EntityTarget<T> resolvedTarget() {
    return (target != null) ? target : EntityTarget.ofEntity(entity);
  }
}
