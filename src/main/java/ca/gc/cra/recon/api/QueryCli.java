package ca.gc.cra.recon.api;

import ca.gc.cra.recon.application.query.ActiveQueryService;
import ca.gc.cra.recon.application.query.PassiveQueryService;
import ca.gc.cra.recon.application.query.QueryOptions;
import ca.gc.cra.recon.application.query.RecordQueryService;
import ca.gc.cra.recon.application.topvalues.TopValue;
import ca.gc.cra.recon.config.CompositionRoot;
import ca.gc.cra.recon.config.ConfigMerger;
import ca.gc.cra.recon.config.EngineConfig;
import ca.gc.cra.recon.config.YamlConfigLoader;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.infrastructure.store.JsonDocuments;
import ca.gc.cra.recon.logging.LoggingConfigurator;
import ca.gc.cra.recon.validation.Paths;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query, aggregation and load commands over one collection.
 *
 * @since 0.1.0
 */
public final class QueryCli {
  private static final Logger log = LoggerFactory.getLogger(QueryCli.class);
  private static final Set<String> SETTING_KEYS = Set.of("collection", "db", "topnbr", "metricsExporter",
      "limit", "skip");
  private static final String SUMMARY_USAGE =
      "usage: recon <get|count|distinct|top|load> [collection=nmap|view|passive] [db=DIR] "
          + "[config=FILE] [filters...] [options...]";
  private static final String HELP_TEXT = """
      recon query commands

      Usage:
        recon get      [filters] [fields=a,b] [sort=path[:asc|:desc],...] [limit=N] [skip=N]
        recon count    [filters]
        recon distinct field=PATH [filters]
        recon top      field=PSEUDO_FIELD [filters] [topnbr=N] [--weighted]
        recon load     file=NDJSON

      Settings:
        collection=nmap|view|passive  Collection to open (default nmap)
        db=DIR                        Database directory (default recon-db)
        config=FILE                   YAML file with a common section and one section per collection
        metricsExporter=otlp|none     Metrics exporter (default none)

      Filters (prefix the key with ! to negate):
        host=ADDR  net=CIDR  range=START-STOP  port=N[/proto]  service=NAME  product=NAME
        nmap, view: country=CC  asnum=N  category=NAME  script=NAME[:OUTPUT]
        passive:    recontype=TYPE  sensor=NAME  dns=NAME
        Text values accept /regex/flags.

      Flags:
        --weighted  Sum passive observation counts in top (default counts records)
        --verbose   Enable DEBUG logging
        --help      Show this message
      """;

  private QueryCli() {}

  /**
   * Runs a command.
   *
   * @param command one of {@code get}, {@code count}, {@code distinct}, {@code top}, {@code load}
   * @param input parsed arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String command, CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EngineConfig config;
    try {
      config = resolveConfig(kv);
    } catch (IOException ex) {
      log.error("Unable to read configuration file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    boolean weighted = input.hasFlag("--weighted") || Boolean.parseBoolean(kv.get("weighted"));
    try (CompositionRoot root = new CompositionRoot(config, "load".equals(command));
        RecordQueryService service = root.service()) {
      log.info("Running {} on collection {} in {}", command, config.collection(), config.dbPath());
      switch (command) {
        case "load":
          return load(service, kv);
        case "get":
          return get(service, kv, config);
        case "count":
          CliPrinter.println(Long.toString(service.count(CliFilters.build(service, kv))));
          return ExitCode.SUCCESS;
        case "distinct":
          return distinct(service, kv, config);
        case "top":
          return top(service, kv, config, weighted);
        default:
          log.error("Unknown command: {}", command);
          CliPrinter.println(SUMMARY_USAGE);
          return ExitCode.INVALID_ARGS;
      }
    } catch (IOException | UncheckedIOException ex) {
      log.error("{} failed on IO: {}", command, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("{} rejected: {}", command, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static EngineConfig resolveConfig(Map<String, String> kv) throws IOException {
    String collection = kv.getOrDefault("collection", EngineConfig.defaults().get("collection"));
    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = kv.get("config");
    if (configPath != null) {
      yaml = YamlConfigLoader.load(Path.of(configPath), collection);
      if (yaml.isEmpty()) {
        log.warn("Configuration file {} not found; using defaults", configPath);
      }
    }
    Map<String, String> cli = new LinkedHashMap<>();
    for (String key : SETTING_KEYS) {
      if (kv.containsKey(key)) {
        cli.put(key, kv.get(key));
      }
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        collection, yaml, cli, EngineConfig.defaults(), log::warn);
    return EngineConfig.fromMap(effective);
  }

  private static QueryOptions options(Map<String, String> kv, EngineConfig config) {
    return CliFilters.options(kv).withLimit(config.limit()).withSkip(config.skip());
  }

  private static ExitCode get(RecordQueryService service, Map<String, String> kv, EngineConfig config) {
    JsonDocuments json = new JsonDocuments();
    List<String> lines = new ArrayList<>();
    for (Map<String, Object> record : service.get(CliFilters.build(service, kv), options(kv, config))) {
      lines.add(json.toJson(record));
    }
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }

  private static ExitCode distinct(RecordQueryService service, Map<String, String> kv, EngineConfig config) {
    String field = requireField(kv);
    JsonDocuments json = new JsonDocuments();
    List<String> lines = new ArrayList<>();
    for (Object value : service.distinct(field, CliFilters.build(service, kv), options(kv, config))) {
      lines.add(json.toJson(value));
    }
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }

  private static ExitCode top(RecordQueryService service, Map<String, String> kv, EngineConfig config,
      boolean weighted) {
    String field = requireField(kv);
    Filter filter = CliFilters.build(service, kv);
    QueryOptions options = options(kv, config);
    List<TopValue> values;
    if (service instanceof PassiveQueryService passive) {
      values = passive.topValues(field, filter, !weighted, config.topN(), options);
    } else {
      if (weighted) {
        throw new IllegalArgumentException("--weighted only applies to the passive collection");
      }
      values = ((ActiveQueryService) service).topValues(field, filter, config.topN(), options);
    }
    JsonDocuments json = new JsonDocuments();
    List<String> lines = new ArrayList<>(values.size());
    for (TopValue value : values) {
      lines.add(json.toJson(value.toDocument()));
    }
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }

  private static ExitCode load(RecordQueryService service, Map<String, String> kv) throws IOException {
    String file = kv.get("file");
    if (file == null) {
      throw new IllegalArgumentException("load requires file=PATH");
    }
    Path input = Paths.validateReadableFile(Path.of(file));
    JsonDocuments json = new JsonDocuments();
    long loaded = 0;
    long lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        Map<String, Object> record;
        try {
          record = json.parseObject(line);
        } catch (IllegalArgumentException ex) {
          throw new IllegalArgumentException("line " + lineNumber + " of " + input + ": " + ex.getMessage(), ex);
        }
        loadOne(service, record);
        loaded++;
      }
    }
    log.info("Loaded {} records from {} into {}", loaded, input, service.collection());
    CliPrinter.println(Long.toString(loaded));
    return ExitCode.SUCCESS;
  }

  private static void loadOne(RecordQueryService service, Map<String, Object> record) {
    if (service instanceof PassiveQueryService passive) {
      Object timestamp = record.remove("timestamp");
      if (timestamp == null) {
        timestamp = record.containsKey("firstseen") ? record.get("firstseen") : System.currentTimeMillis() / 1000;
      }
      passive.insertOrUpdate(timestamp, record, null, record.get("lastseen"));
    } else {
      ((ActiveQueryService) service).storeOrMergeHost(record);
    }
  }

  private static String requireField(Map<String, String> kv) {
    String field = kv.get("field");
    if (field == null) {
      throw new IllegalArgumentException("field=NAME is required");
    }
    return field;
  }
}
