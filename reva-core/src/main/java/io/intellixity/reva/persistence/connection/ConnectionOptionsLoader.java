package io.intellixity.reva.persistence.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads {@link ConnectionOptions} from a JSON document.\n
 *
 * The document is either a single options object or an array of them:\n
 *\n
 * <pre>\n
 * [\n
 *   { "name": "default", "family": "jdbc", "url": "jdbc:postgresql://db/app", "maxPoolSize": 10 },\n
 *   { "name": "reporting", "family": "jdbc", "url": "jdbc:postgresql://replica/app",\n
 *     "useSingleDatabaseConnection": true }\n
 * ]\n
 * </pre>\n
 *
 * Connection names must be unique within a document.\n
 */
public final class ConnectionOptionsLoader {
  public static final String DEFAULT_RESOURCE = "reva.json";

  private static final ObjectMapper JSON = new ObjectMapper();

  public List<ConnectionOptions> load(InputStream in) {
    Objects.requireNonNull(in, "in");
    JsonNode root;
    try {
      root = JSON.readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse connection options", e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) return List.of();

    List<ConnectionOptions> out = new ArrayList<>();
    if (root.isArray()) {
      for (JsonNode n : root) out.add(read(n));
    } else if (root.isObject()) {
      out.add(read(root));
    } else {
      throw new IllegalArgumentException("Connection options must be a JSON object or array, got " + root.getNodeType());
    }

    Set<String> names = new HashSet<>();
    for (ConnectionOptions o : out) {
      if (!names.add(o.name())) throw new IllegalArgumentException("Duplicate connection name: " + o.name());
    }
    return List.copyOf(out);
  }

  public List<ConnectionOptions> load(Path file) {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read connection options from " + file, e);
    }
  }

  /** Load from a classpath resource. */
  public List<ConnectionOptions> loadResource(String resource) {
    return loadResource(resource, Thread.currentThread().getContextClassLoader());
  }

  public List<ConnectionOptions> loadResource(String resource, ClassLoader cl) {
    Objects.requireNonNull(resource, "resource");
    if (cl == null) cl = ConnectionOptionsLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Connection options resource not found: " + resource);
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read connection options resource " + resource, e);
    }
  }

  /** Pick the options with the given name. */
  public static ConnectionOptions find(List<ConnectionOptions> options, String name) {
    Objects.requireNonNull(options, "options");
    String wanted = (name == null || name.isBlank()) ? ConnectionOptions.DEFAULT_NAME : name;
    for (ConnectionOptions o : options) {
      if (o.name().equals(wanted)) return o;
    }
    throw new IllegalArgumentException("Unknown connection name: " + wanted);
  }

  private static ConnectionOptions read(JsonNode node) {
    try {
      return JSON.treeToValue(node, ConnectionOptions.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid connection options: " + e.getOriginalMessage(), e);
    }
  }
}
