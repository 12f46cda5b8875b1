package io.intellixity.reva.persistence.manager;

/**
 * Raised when a query or transaction is attempted on a released single-connection entity manager.
 */
public final class EntityManagerReleasedException extends RuntimeException {
  public EntityManagerReleasedException(String connectionName) {
    super("Entity manager for connection '" + connectionName + "' was already released; "
        + "it cannot be used to run queries or transactions");
  }
}
