package ca.gc.cra.recon.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads engine settings from a YAML document into the flat key space used by {@link ConfigMerger}.
 *
 * <p>The document holds a {@code common} section and one optional section per collection
 * ({@code nmap}, {@code view}, {@code passive}); the collection section wins. Settings may be written flat or
 * grouped:</p>
 * <pre>
 * common:
 *   store:
 *     path: ./recon-db        # relative paths resolve against the YAML file
 *   metrics:
 *     exporter: none
 * passive:
 *   query:
 *     topnbr: 25
 *     limit: 1000
 * </pre>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Map<String, String> KEYS = Map.ofEntries(
      Map.entry("db", "db"),
      Map.entry("store.path", "db"),
      Map.entry("topnbr", "topnbr"),
      Map.entry("query.topnbr", "topnbr"),
      Map.entry("limit", "limit"),
      Map.entry("query.limit", "limit"),
      Map.entry("skip", "skip"),
      Map.entry("query.skip", "skip"),
      Map.entry("metricsExporter", "metricsExporter"),
      Map.entry("metrics.exporter", "metricsExporter"));

  private YamlConfigLoader() {}

  /**
   * Loads the settings that apply to {@code collection}.
   *
   * @param path location of the YAML configuration
   * @param collection collection whose section overrides {@code common}
   * @return engine settings keyed {@code db}, {@code topnbr}, {@code limit}, {@code skip} and
   *     {@code metricsExporter}; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document has an unknown section or key, or is not valid YAML
   */
  public static Optional<Map<String, String>> load(Path path, String collection) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(collection, "collection");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String wanted = collection.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(document, "root").entrySet()) {
      String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!COMMON.equals(name) && !EngineConfig.COLLECTIONS.contains(name)) {
        throw new IllegalArgumentException("Unknown configuration section: " + entry.getKey());
      }
      sections.put(name, entry.getValue());
    }

    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : new String[] {COMMON, wanted}) {
      Object section = sections.get(name);
      if (section != null) {
        Map<String, String> flat = new LinkedHashMap<>();
        flatten(asMap(section, name), "", flat);
        flat.forEach((key, value) -> settings.put(engineKey(name, key), value));
      }
    }
    String db = settings.get("db");
    if (db != null && !db.isBlank()) {
      settings.put("db", resolveStorePath(path, db));
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static String engineKey(String section, String key) {
    String mapped = KEYS.get(key);
    if (mapped == null) {
      throw new IllegalArgumentException("Unknown configuration key " + key + " in section " + section);
    }
    return mapped;
  }

  private static String resolveStorePath(Path configFile, String db) {
    try {
      Path store = Path.of(db);
      if (store.isAbsolute()) {
        return store.toString();
      }
      Path base = configFile.toAbsolutePath().getParent();
      return (base == null ? store : base.resolve(store)).normalize().toString();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("store path is not a valid path: " + db, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String composite = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
