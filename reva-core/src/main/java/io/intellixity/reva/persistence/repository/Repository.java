package io.intellixity.reva.persistence.repository;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Reactive per-entity repository.\n
 *
 * Conditions are property -> value maps; their interpretation (and that of {@link FindOptions}) belongs to the
 * implementation.\n
 */
public interface Repository<T> {
  /** Insert or update the entity; emits the persisted entity. */
  Mono<T> persist(T entity);

  Mono<T> remove(T entity);

  Mono<List<T>> find();

  Mono<List<T>> find(Map<String, ?> conditions);

  Mono<List<T>> find(FindOptions options);

  Mono<List<T>> find(Map<String, ?> conditions, FindOptions options);

  Mono<EntitiesAndCount<T>> findAndCount();

  Mono<EntitiesAndCount<T>> findAndCount(Map<String, ?> conditions);

  Mono<EntitiesAndCount<T>> findAndCount(FindOptions options);

  Mono<EntitiesAndCount<T>> findAndCount(Map<String, ?> conditions, FindOptions options);

  /** First match; empty when nothing matches. */
  Mono<T> findOne();

  Mono<T> findOne(Map<String, ?> conditions);

  Mono<T> findOne(FindOptions options);

  Mono<T> findOne(Map<String, ?> conditions, FindOptions options);

  /** @param options may be null */
  Mono<T> findOneById(Object id, FindOptions options);
}
