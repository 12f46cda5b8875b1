package io.intellixity.reva.persistence.manager;

/**
 * Lifecycle of a {@link ReactiveEntityManager}. Transitions are one-way: {@code ACTIVE -> RELEASED}.
 */
public enum ManagerState {
  ACTIVE,

  /** Disposed through {@link ReactiveEntityManager#release()}. */
  RELEASED
}
