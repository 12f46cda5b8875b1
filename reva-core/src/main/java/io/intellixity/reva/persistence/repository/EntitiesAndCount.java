package io.intellixity.reva.persistence.repository;

import java.util.List;

/**
 * Result of {@code findAndCount}: one page of entities and the total number of matches.\n
 */
public record EntitiesAndCount<T>(List<T> entities, long count) {
  public EntitiesAndCount {
    entities = (entities == null) ? List.of() : List.copyOf(entities);
    if (count < 0) throw new IllegalArgumentException("count must be >= 0");
  }
}
