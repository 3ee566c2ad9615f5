package io.intellixity.relata.persistence.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads {@link RelataConfig} from YAML or JSON.
 * <pre>
 * hub: invoices
 * relations:
 *   - { from: customers, to: invoices, localKey: id, foreignKey: customer_id }
 * references:
 *   - { keyField: customer_id, entity: customers, idField: id, extraFields: { region: customer_region } }
 * </pre>
 */
public final class RelataConfigLoader {
  private static final ObjectMapper YAML = configure(new ObjectMapper(new YAMLFactory()));
  private static final ObjectMapper JSON = configure(new ObjectMapper());

  private RelataConfigLoader() {}

  public static RelataConfig load(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    ObjectMapper mapper = name.endsWith(".json") ? JSON : YAML;
    try (InputStream in = Files.newInputStream(path)) {
      return read(mapper, in, path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read relation config " + path, e);
    }
  }

  /** Loads a classpath resource; {@code .json} resources are read as JSON, anything else as YAML. */
  public static RelataConfig fromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = RelataConfigLoader.class.getClassLoader();
    InputStream in = cl.getResourceAsStream(resource);
    if (in == null) throw new IllegalArgumentException("Relation config not found on classpath: " + resource);
    ObjectMapper mapper = resource.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : YAML;
    try (in) {
      return read(mapper, in, resource);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read relation config " + resource, e);
    }
  }

  public static RelataConfig fromYaml(String yaml) {
    try {
      return YAML.readValue(yaml, RelataConfig.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid relation config: " + e.getOriginalMessage(), e);
    }
  }

  private static RelataConfig read(ObjectMapper mapper, InputStream in, String source) throws IOException {
    RelataConfig cfg = mapper.readValue(in, RelataConfig.class);
    if (cfg == null) throw new IllegalArgumentException("Empty relation config: " + source);
    return cfg;
  }

  private static ObjectMapper configure(ObjectMapper m) {
    return m.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
  }
}
