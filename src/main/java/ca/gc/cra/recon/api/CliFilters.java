package ca.gc.cra.recon.api;

import ca.gc.cra.recon.application.query.ActiveQueryService;
import ca.gc.cra.recon.application.query.PassiveQueryService;
import ca.gc.cra.recon.application.query.QueryOptions;
import ca.gc.cra.recon.application.query.RecordQueryService;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.filter.StringMatch;
import ca.gc.cra.recon.domain.record.SortKey;
import ca.gc.cra.recon.validation.Numbers;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps CLI {@code key=value} terms onto the search builders of a service.
 *
 * <p>Text values use {@code /pattern/flags} for regular expressions. Every filter term may be negated
 * with a leading {@code '!'} on its key. Terms are combined with a conjunction.</p>
 */
final class CliFilters {
  /** Keys that configure the invocation rather than filter records. */
  static final Set<String> OPTION_KEYS = Set.of(
      "collection", "db", "config", "topnbr", "metricsExporter",
      "field", "fields", "sort", "limit", "skip", "file", "weighted");

  private CliFilters() {}

  /**
   * Builds the conjunction of every filter term.
   *
   * @param service service whose builders interpret the terms
   * @param args parsed arguments; option keys are ignored
   * @return filter, {@link Filter#TRUE} when no term was given
   * @throws IllegalArgumentException for unknown keys, keys the collection does not support, or bad values
   */
  static Filter build(RecordQueryService service, Map<String, String> args) {
    List<Filter> terms = new ArrayList<>();
    for (Map.Entry<String, String> entry : args.entrySet()) {
      if (OPTION_KEYS.contains(entry.getKey())) {
        continue;
      }
      boolean neg = entry.getKey().startsWith("!");
      String key = neg ? entry.getKey().substring(1) : entry.getKey();
      terms.add(term(service, key.toLowerCase(Locale.ROOT), entry.getValue(), neg));
    }
    return Filters.and(terms);
  }

  /**
   * Reads projection, sort and paging options.
   *
   * @param args parsed arguments
   * @return query options
   * @throws IllegalArgumentException for malformed numbers or sort keys
   */
  static QueryOptions options(Map<String, String> args) {
    List<String> fields = args.containsKey("fields") ? csv(args.get("fields")) : null;
    List<SortKey> sort = new ArrayList<>();
    if (args.containsKey("sort")) {
      for (String spec : csv(args.get("sort"))) {
        sort.add(SortKey.parse(spec));
      }
    }
    Integer limit = args.containsKey("limit")
        ? Numbers.parseIntInRange("limit", args.get("limit"), 0, Integer.MAX_VALUE) : null;
    Integer skip = args.containsKey("skip")
        ? Numbers.parseIntInRange("skip", args.get("skip"), 0, Integer.MAX_VALUE) : null;
    return new QueryOptions(fields, sort, limit, skip);
  }

  static List<String> csv(String value) {
    List<String> items = new ArrayList<>();
    for (String item : value.split(",")) {
      if (!item.isBlank()) {
        items.add(item.trim());
      }
    }
    return items;
  }

  private static Filter term(RecordQueryService service, String key, String value, boolean neg) {
    switch (key) {
      case "host":
        return service.searchHost(value, neg);
      case "net":
        return service.searchNet(value, neg);
      case "range":
        return range(service, value, neg);
      case "port":
        return port(service, value, neg);
      case "service":
        return negate(service instanceof PassiveQueryService passive
            ? passive.searchService(StringMatch.parse(value), null, null)
            : active(service, key).searchService(StringMatch.parse(value)), neg);
      case "product":
        return negate(service instanceof PassiveQueryService passive
            ? passive.searchProduct(StringMatch.parse(value), null, null, null, null)
            : active(service, key).searchProduct(StringMatch.parse(value), null, null, null, null), neg);
      case "country":
        return active(service, key).searchCountry(value, neg);
      case "asnum":
        return active(service, key).searchAsNum(parseLong(key, value), neg);
      case "category":
        return active(service, key).searchCategory(StringMatch.parse(value), neg);
      case "script":
        return script(active(service, key), value, neg);
      case "recontype":
        return negate(passive(service, key).searchRecontype(StringMatch.parse(value)), neg);
      case "sensor":
        return passive(service, key).searchSensor(StringMatch.parse(value), neg);
      case "dns":
        return negate(passive(service, key).searchDns(StringMatch.parse(value), false, null, false), neg);
      default:
        throw new IllegalArgumentException("unknown filter: " + key);
    }
  }

  private static Filter range(RecordQueryService service, String value, boolean neg) {
    String[] bounds = value.split("-", 2);
    if (bounds.length != 2 || bounds[0].isBlank() || bounds[1].isBlank()) {
      throw new IllegalArgumentException("range must be START-STOP (was " + value + ")");
    }
    return service.searchRange(bounds[0].trim(), bounds[1].trim(), neg);
  }

  private static Filter port(RecordQueryService service, String value, boolean neg) {
    String[] parts = value.split("/", 2);
    int port = Numbers.parseIntInRange("port", parts[0], 0, 65535);
    String protocol = parts.length == 2 ? parts[1].trim().toLowerCase(Locale.ROOT) : "tcp";
    if (service instanceof PassiveQueryService passive) {
      return passive.searchPort(port, protocol, "open", neg);
    }
    return active(service, "port").searchPort(port, protocol, "open", neg);
  }

  private static Filter script(ActiveQueryService service, String value, boolean neg) {
    int colon = value.indexOf(':');
    if (colon < 0) {
      return service.searchScript(StringMatch.parse(value), null, neg);
    }
    return service.searchScript(StringMatch.parse(value.substring(0, colon)),
        StringMatch.parse(value.substring(colon + 1)), neg);
  }

  private static Filter negate(Filter filter, boolean neg) {
    return neg ? Filters.not(filter) : filter;
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value + ")", ex);
    }
  }

  private static ActiveQueryService active(RecordQueryService service, String key) {
    if (service instanceof ActiveQueryService active) {
      return active;
    }
    throw unsupported(service, key);
  }

  private static PassiveQueryService passive(RecordQueryService service, String key) {
    if (service instanceof PassiveQueryService passive) {
      return passive;
    }
    throw unsupported(service, key);
  }

  private static IllegalArgumentException unsupported(RecordQueryService service, String key) {
    return new IllegalArgumentException("filter " + key + " is not supported by collection "
        + service.collection() + "; supported: " + Arrays.asList("host", "net", "range", "port",
        "service", "product", service instanceof PassiveQueryService ? "recontype, sensor, dns"
            : "country, asnum, category, script"));
  }
}
