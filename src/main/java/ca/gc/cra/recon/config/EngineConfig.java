package ca.gc.cra.recon.config;

import ca.gc.cra.recon.validation.Numbers;
import ca.gc.cra.recon.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Typed engine settings resolved from defaults, YAML and CLI arguments.
 * <p><strong>Role:</strong> Input of {@link CompositionRoot}; one instance per CLI invocation.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param dbPath directory holding the collection files
 * @param collection {@code nmap}, {@code view} or {@code passive}
 * @param topN default number of entries returned by top-values queries
 * @param metricsExporter {@code otlp} or {@code none}
 * @param limit default maximum number of records read by a query, or {@code null} for all
 * @param skip default number of records skipped by a query, or {@code null} for none
 * @since 0.1.0
 */
public record EngineConfig(Path dbPath, String collection, int topN, String metricsExporter, Integer limit,
    Integer skip) {
  /** Collections the engine can open. */
  public static final Set<String> COLLECTIONS = Set.of("nmap", "view", "passive");
  /** Supported metrics exporters. */
  public static final Set<String> EXPORTERS = Set.of("otlp", "none");
  /** Upper bound accepted for {@code topnbr}. */
  public static final int MAX_TOP_N = 100_000;

  /**
   * Validates components.
   *
   * @throws IllegalArgumentException when a component is invalid
   */
  public EngineConfig {
    Objects.requireNonNull(dbPath, "dbPath");
    collection = Strings.requireOneOf("collection", collection, COLLECTIONS);
    Numbers.requireRange("topnbr", topN, 1, MAX_TOP_N);
    metricsExporter = Strings.requireOneOf("metricsExporter", metricsExporter, EXPORTERS);
    if (limit != null) {
      Numbers.requireRange("limit", limit, 0, Integer.MAX_VALUE);
    }
    if (skip != null) {
      Numbers.requireRange("skip", skip, 0, Integer.MAX_VALUE);
    }
  }

  /**
   * Creates a configuration without paging defaults.
   *
   * @param dbPath directory holding the collection files
   * @param collection collection name
   * @param topN default top-values bound
   * @param metricsExporter exporter name
   */
  public EngineConfig(Path dbPath, String collection, int topN, String metricsExporter) {
    this(dbPath, collection, topN, metricsExporter, null, null);
  }

  /**
   * Embedded defaults, in the flat key space shared with YAML and the CLI.
   *
   * @return unmodifiable defaults
   */
  public static Map<String, String> defaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("collection", "nmap");
    map.put("db", "recon-db");
    map.put("topnbr", "10");
    map.put("metricsExporter", "none");
    return Map.copyOf(map);
  }

  /**
   * Builds a configuration from an effective flat map.
   *
   * @param values merged settings
   * @return typed configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static EngineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> defaults = defaults();
    String db = Strings.requireNonBlank("db", values.getOrDefault("db", defaults.get("db")));
    Path dbPath;
    try {
      dbPath = Path.of(db);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("db is not a valid path: " + db, ex);
    }
    return new EngineConfig(
        dbPath,
        values.getOrDefault("collection", defaults.get("collection")),
        Numbers.parseIntInRange("topnbr", values.getOrDefault("topnbr", defaults.get("topnbr")), 1, MAX_TOP_N),
        values.getOrDefault("metricsExporter", defaults.get("metricsExporter")),
        optionalInt(values, "limit"),
        optionalInt(values, "skip"));
  }

  private static Integer optionalInt(Map<String, String> values, String key) {
    String value = values.get(key);
    if (value == null || value.isBlank()) {
      return null;
    }
    return Numbers.parseIntInRange(key, value, 0, Integer.MAX_VALUE);
  }
}
