package io.intellixity.reva.persistence.repository;

/** Sort direction used in {@link FindOptions#order()}. */
public enum Order {
  ASC,
  DESC
}
