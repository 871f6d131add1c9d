package ca.gc.cra.recon.config;

import ca.gc.cra.recon.validation.Numbers;
import ca.gc.cra.recon.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param collection collection the invocation targets
   * @param yaml optional YAML-derived settings for the collection
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String collection,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }
    merged.put("collection", collection);

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    Strings.requireOneOf("collection", effective.get("collection"), EngineConfig.COLLECTIONS);
    Strings.requireNonBlank("db", effective.get("db"));
    requireIntIfPresent(effective, "topnbr", 1, EngineConfig.MAX_TOP_N);
    requireIntIfPresent(effective, "limit", 0, Integer.MAX_VALUE);
    requireIntIfPresent(effective, "skip", 0, Integer.MAX_VALUE);
    String exporter = effective.get("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      Strings.requireOneOf("metricsExporter", exporter, EngineConfig.EXPORTERS);
    }
  }

  private static void requireIntIfPresent(Map<String, String> effective, String key, int min, int max) {
    String value = effective.get(key);
    if (value != null && !value.isBlank()) {
      Numbers.parseIntInRange(key, value, min, max);
    }
  }
}
