package io.intellixity.reva.persistence.connection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings, typically read from a JSON config file by {@link ConnectionOptionsLoader}.\n
 *
 * @param name connection name (defaults to {@value #DEFAULT_NAME})\n
 * @param family driver family used to pick a {@link DriverFactory} (e.g. {@code jdbc})\n
 * @param url backend url (e.g. JDBC url)\n
 * @param username optional credentials\n
 * @param password optional credentials\n
 * @param schema optional schema/namespace applied to opened runners\n
 * @param maxPoolSize optional upper bound for the driver's pool\n
 * @param useSingleDatabaseConnection default mode for managers created by the connection\n
 */
public record ConnectionOptions(String name,
                                String family,
                                String url,
                                String username,
                                String password,
                                String schema,
                                Integer maxPoolSize,
                                boolean useSingleDatabaseConnection) {
  public static final String DEFAULT_NAME = "default";

  @JsonCreator
  public ConnectionOptions(@JsonProperty("name") String name,
                           @JsonProperty("family") String family,
                           @JsonProperty("url") String url,
                           @JsonProperty("username") String username,
                           @JsonProperty("password") String password,
                           @JsonProperty("schema") String schema,
                           @JsonProperty("maxPoolSize") Integer maxPoolSize,
                           @JsonProperty("useSingleDatabaseConnection") boolean useSingleDatabaseConnection) {
    if (family == null || family.isBlank()) throw new IllegalArgumentException("family is required");
    if (maxPoolSize != null && maxPoolSize < 1) throw new IllegalArgumentException("maxPoolSize must be >= 1");
    this.name = (name == null || name.isBlank()) ? DEFAULT_NAME : name.trim();
    this.family = family.trim();
    this.url = url;
    this.username = username;
    this.password = password;
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.maxPoolSize = maxPoolSize;
    this.useSingleDatabaseConnection = useSingleDatabaseConnection;
  }

  public static ConnectionOptions of(String family, String url) {
    return new ConnectionOptions(null, family, url, null, null, null, null, false);
  }

  public ConnectionOptions withName(String name) {
    return new ConnectionOptions(name, family, url, username, password, schema, maxPoolSize, useSingleDatabaseConnection);
  }

  public ConnectionOptions withCredentials(String username, String password) {
    return new ConnectionOptions(name, family, url, username, password, schema, maxPoolSize, useSingleDatabaseConnection);
  }

  public ConnectionOptions withSchema(String schema) {
    return new ConnectionOptions(name, family, url, username, password, schema, maxPoolSize, useSingleDatabaseConnection);
  }

  public ConnectionOptions withMaxPoolSize(Integer maxPoolSize) {
    return new ConnectionOptions(name, family, url, username, password, schema, maxPoolSize, useSingleDatabaseConnection);
  }

  public ConnectionOptions withSingleDatabaseConnection(boolean useSingleDatabaseConnection) {
    return new ConnectionOptions(name, family, url, username, password, schema, maxPoolSize, useSingleDatabaseConnection);
  }

  @Override
  public String toString() {
    // No credentials in logs.
    return "ConnectionOptions[name=" + name + ", family=" + family + ", url=" + url + ", schema=" + schema
        + ", maxPoolSize=" + maxPoolSize + ", useSingleDatabaseConnection=" + useSingleDatabaseConnection + "]";
  }
}
