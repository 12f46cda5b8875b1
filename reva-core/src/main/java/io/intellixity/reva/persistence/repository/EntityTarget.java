package io.intellixity.reva.persistence.repository;

import java.util.Objects;

/**
 * Typed registration key selecting the {@link Repository} that handles an entity type.\n
 *
 * @param name logical target name (the class name for class-based targets)\n
 * @param type entity Java type\n
 */
public record EntityTarget<T>(String name, Class<T> type) {
  public EntityTarget {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(type, "type");
  }

  public static <T> EntityTarget<T> of(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return new EntityTarget<>(type.getName(), type);
  }

  /** Name-based target, for several repositories over the same Java type. */
  public static <T> EntityTarget<T> named(String name, Class<T> type) {
    return new EntityTarget<>(name, type);
  }

  /** Class-based target for the runtime class of {@code entity}. */
  @SuppressWarnings("unchecked")
  public static <T> EntityTarget<T> ofEntity(T entity) {
    Objects.requireNonNull(entity, "entity");
    return of((Class<T>) entity.getClass());
  }
}
