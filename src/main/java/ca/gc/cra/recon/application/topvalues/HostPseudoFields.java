package ca.gc.cra.recon.application.topvalues;

import ca.gc.cra.recon.application.query.ActiveQueryService;
import ca.gc.cra.recon.application.query.Ja3Criterion;
import ca.gc.cra.recon.domain.codec.AddressCodec;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.filter.StringMatch;
import ca.gc.cra.recon.domain.path.PathValueExtractor;
import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.path.Weighted;
import ca.gc.cra.recon.domain.record.Records;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Pseudo-fields understood by host top-values queries.
 * <p><strong>Why:</strong> Reports ask for "open ports", "products on port 443" or "JA3 server hashes" rather
 * than raw paths; each of those needs its own pre-filter, projection and per-record extraction.</p>
 * <p><strong>Role:</strong> Builds the {@link PseudoFieldRegistry} of an {@link ActiveQueryService}; pre-filters
 * are produced by the service's own search builders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map aliases ({@code asnum}, {@code smb.dnsdomain}, {@code enip.vendor}) to stored paths.</li>
 *   <li>Emit tuples (as lists) for composite dimensions such as {@code port} or {@code version}.</li>
 *   <li>Reject malformed numeric arguments with {@link IllegalArgumentException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The registry and the pseudo-fields it creates are immutable.</p>
 *
 * @implNote Extractors read records in external form: addresses are text and times are instants.
 * @since 0.1.0
 */
public final class HostPseudoFields {
  private static final List<String> CPE_FIELDS = List.of("type", "vendor", "product", "version");
  private static final List<String> IKE_TRANSFORM_KEYS = List.of(
      "Authentication", "Encryption", "GroupDesc", "Hash", "LifeDuration", "LifeType");
  private static final Map<String, String> ENIP_ALIASES = Map.of(
      "vendor", "Vendor",
      "product", "Product Name",
      "serial", "Serial Number",
      "devtype", "Device Type",
      "prodcode", "Product Code",
      "rev", "Revision",
      "ip", "Device IP");

  private final ActiveQueryService service;
  private final PathValueExtractor extractor = new PathValueExtractor(FieldSchema.HOSTS);

  private HostPseudoFields(ActiveQueryService service) {
    this.service = Objects.requireNonNull(service, "service");
  }

  /**
   * Builds the registry for a host service.
   *
   * @param service service whose search builders supply the pre-filters
   * @return registry; unmatched path-shaped names aggregate the stored path directly
   */
  public static PseudoFieldRegistry registry(ActiveQueryService service) {
    return new HostPseudoFields(service).build();
  }

  private PseudoFieldRegistry build() {
    return PseudoFieldRegistry.builder(this::direct)
        .register("category", m -> direct("categories"))
        .register("country", m -> country())
        .register("city", m -> city())
        .register("asnum", m -> direct("infos.as_num"))
        .register("as", m -> autonomousSystem())
        .register("net(?::(.*))?", m -> net(m.group(1)))
        .register("port", m -> port(p -> p.containsKey("state_state"), "ports.state_state"))
        .register("port:(open|closed|filtered)", m -> {
          String state = m.group(1);
          return port(p -> state.equals(p.get("state_state")), "ports.state_state");
        })
        .register("port:(.+)", m -> {
          String name = m.group(1);
          return port(p -> name.equals(p.get("service_name")), "ports.service_name");
        })
        .register("portlist:(.+)", m -> portList(m.group(1)))
        .register("countports:(.+)", m -> countPorts(m.group(1)))
        .register("service", m -> openPorts("ports.service_name", service.searchOpenPort(false),
            p -> true, "service_name"))
        .register("service:(.*)", m -> {
          int port = parsePort(m.group(1), m.group());
          return openPorts("ports.service_name", service.searchPort(port), onPort(port), "service_name");
        })
        .register("product", m -> openPorts("ports.service_product", service.searchOpenPort(false),
            p -> true, "service_name", "service_product"))
        .register("product:(\\d+)", m -> {
          int port = parsePort(m.group(1), m.group());
          return openPorts("ports.service_product", service.searchPort(port), onPort(port),
              "service_name", "service_product");
        })
        .register("product:(.+)", m -> {
          String name = m.group(1);
          return openPorts("ports.service_product", service.searchService(StringMatch.exact(name)),
              p -> name.equals(p.get("service_name")), "service_name", "service_product");
        })
        .register("version", m -> openPorts("ports.service_version", service.searchOpenPort(false),
            p -> true, "service_name", "service_product", "service_version"))
        .register("version:(\\d+)", m -> {
          int port = parsePort(m.group(1), m.group());
          return openPorts("ports.service_version", service.searchPort(port), onPort(port),
              "service_name", "service_product", "service_version");
        })
        .register("version:([^:]+):(.+)", m -> {
          String name = m.group(1);
          String product = m.group(2);
          return openPorts("ports.service_version",
              service.searchProduct(StringMatch.exact(product), null, StringMatch.exact(name), null, null),
              p -> name.equals(p.get("service_name")) && product.equals(p.get("service_product")),
              "service_name", "service_product", "service_version");
        })
        .register("version:(.+)", m -> {
          String name = m.group(1);
          return openPorts("ports.service_version", service.searchService(StringMatch.exact(name)),
              p -> name.equals(p.get("service_name")), "service_name", "service_product", "service_version");
        })
        .register("cpe(?:\\.([^:]*))?(?::(.*))?", m -> cpe(m.group(1), m.group(2)))
        .register("devicetype", m -> direct("ports.service_devicetype"))
        .register("devicetype:(.*)", m -> {
          int port = parsePort(m.group(1), m.group());
          return openPorts("ports.service_devicetype", service.searchPort(port), onPort(port),
              "service_devicetype");
        })
        .register("smb\\.(.+)", m -> smb(m.group(1)))
        .register("script", m -> direct("ports.scripts.id"))
        .register("script:(host|\\d+):(.+)", m -> scriptOutput(m.group(1), m.group(2)))
        .register("script:(.+)", m -> scriptOutput(null, m.group(1)))
        .register("domains", m -> direct("hostnames.domains"))
        .register("domains:(.*)", m -> domains(parseInt(m.group(1), m.group())))
        .register("cert\\.(issuer|subject)", m -> certificateName(m.group(1)))
        .register("cert\\.(.+)", m -> direct("ports.scripts.ssl-cert." + m.group(1)))
        .register("useragent(?::(.*))?", m -> userAgent(m.group(1)))
        .register("ja3-client(?:\\.([^:]+))?(?::(.*))?", m -> ja3Client(m.group(1), m.group(2)))
        .register("ja3-server(?:\\.([^:]+))?(?::([^:]*)(?::(.*))?)?",
            m -> ja3Server(m.group(1), m.group(2), m.group(3)))
        .register("sshkey\\.bits", m -> sshKeyBits())
        .register("sshkey\\.(.+)", m -> direct("ports.scripts.ssh-hostkey." + m.group(1),
            service.searchSshKey(null, null, null, null)))
        .register("ike\\.vendor_ids", m -> ikeVendorIds())
        .register("ike\\.transforms", m -> ikeTransforms())
        .register("ike\\.notification", m -> direct("ports.scripts.ike-info.notification_type"))
        .register("ike\\.(.+)", m -> direct("ports.scripts.ike-info." + m.group(1)))
        .register("httphdr", m -> httpHeaders())
        .register("httphdr\\.(.+)", m -> direct("ports.scripts.http-headers." + m.group(1)))
        .register("httphdr:(.+)", m -> httpHeader(m.group(1)))
        .register("modbus\\.(.+)", m -> direct("ports.scripts.modbus-discover." + m.group(1)))
        .register("s7\\.(.+)", m -> direct("ports.scripts.s7-info." + m.group(1)))
        .register("enip\\.(.+)", m -> direct("ports.scripts.enip-info."
            + ENIP_ALIASES.getOrDefault(m.group(1), m.group(1))))
        .register("mongo\\.dbs\\.(.+)", m -> direct("ports.scripts.mongodb-databases." + m.group(1)))
        .register("vulns\\.id", m -> direct("ports.scripts.vulns.id"))
        .register("vulns\\.(.+)", m -> vulns(m.group(1)))
        .register("file(?:\\.(.+))?", m -> file(null, m.group(1)))
        .register("file:([^.]+)(?:\\.(.+))?", m -> file(Arrays.asList(m.group(1).split(",")), m.group(2)))
        .register("screenwords", m -> direct("ports.screenwords"))
        .register("hop", m -> direct("traces.hops.ipaddr"))
        .register("hop([:>])(.*)", m -> hop(m.group(1), parseInt(m.group(2), m.group())))
        .build();
  }

  // Generic builders

  private PseudoField direct(String field) {
    return direct(field, service.searchFieldExists(field));
  }

  private PseudoField direct(String field, Filter preFilter) {
    return PseudoField.of(field, preFilter, List.of(field),
        rec -> extractor.values(rec, field).map(Weighted::one));
  }

  private static PseudoField of(String field, Filter preFilter, List<String> projection,
      Function<Map<String, Object>, Stream<?>> values) {
    return PseudoField.of(field, preFilter, projection, rec -> values.apply(rec).map(Weighted::one));
  }

  private static Stream<Map<String, Object>> ports(Map<String, Object> rec) {
    return Records.maps(rec, "ports").stream();
  }

  private static Stream<Map<String, Object>> scripts(Map<String, Object> rec) {
    return ports(rec).flatMap(port -> Records.maps(port, "scripts").stream());
  }

  private static Stream<Map<String, Object>> scriptEntries(Map<String, Object> rec, String key) {
    return scripts(rec).flatMap(script -> Records.maps(script, key).stream());
  }

  private static List<Object> tuple(Object... values) {
    return Arrays.asList(values);
  }

  private static List<Object> tuple(Map<String, Object> source, List<String> keys) {
    List<Object> values = new ArrayList<>(keys.size());
    for (String key : keys) {
      values.add(source.get(key));
    }
    return values;
  }

  private static Predicate<Map<String, Object>> onPort(int port) {
    return p -> Values.equal(p.get("port"), port);
  }

  private static int parseInt(String text, String name) {
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number in pseudo-field " + name, ex);
    }
  }

  private static int parsePort(String text, String name) {
    int port = parseInt(text, name);
    if (port < -1 || port > 65535) {
      throw new IllegalArgumentException("Port out of range in pseudo-field " + name);
    }
    return port;
  }

  // Geolocation and addresses

  private PseudoField country() {
    return of("infos.country_code", service.searchFieldExists("infos.country_code"),
        List.of("infos.country_code", "infos.country_name"),
        rec -> {
          Map<String, Object> infos = Records.child(rec, "infos");
          return Stream.of(tuple(infos.get("country_code"), infos.getOrDefault("country_name", "?")));
        });
  }

  private PseudoField city() {
    return of("infos.city",
        Filters.and(service.searchFieldExists("infos.country_code"), service.searchFieldExists("infos.city")),
        List.of("infos.country_code", "infos.city"),
        rec -> {
          Map<String, Object> infos = Records.child(rec, "infos");
          return Stream.of(tuple(infos.get("country_code"), infos.get("city")));
        });
  }

  private PseudoField autonomousSystem() {
    return of("infos.as_num", service.searchFieldExists("infos.as_num"),
        List.of("infos.as_num", "infos.as_name"),
        rec -> {
          Map<String, Object> infos = Records.child(rec, "infos");
          return Stream.of(tuple(infos.get("as_num"), infos.getOrDefault("as_name", "?")));
        });
  }

  private PseudoField net(String bitsText) {
    int bits = bitsText == null ? 24 : parseInt(bitsText, "net:" + bitsText);
    if (bits < 0 || bits > 32) {
      throw new IllegalArgumentException("IPv4 prefix length must be between 0 and 32 (was " + bits + ")");
    }
    return of("addr", service.searchIpv4(), List.of("addr"),
        rec -> Stream.of(AddressCodec.ipv4Network(AddressCodec.toInternal(rec.get("addr")), bits)));
  }

  // Ports and services

  private Filter withPortState() {
    return Filters.any("ports", Filters.exists("state_state"));
  }

  private PseudoField port(Predicate<Map<String, Object>> match, String matchField) {
    return of("ports.port", withPortState(), List.of("ports.port", "ports.protocol", matchField),
        rec -> ports(rec).filter(match).map(p -> tuple(p.getOrDefault("protocol", "?"), p.get("port"))));
  }

  private PseudoField portList(String state) {
    return PseudoField.of("ports.port", withPortState(),
        List.of("ports.port", "ports.protocol", "ports.state_state"),
        rec -> {
          List<List<Object>> open = new ArrayList<>();
          ports(rec).filter(p -> state.equals(p.get("state_state")))
              .forEach(p -> open.add(tuple(p.getOrDefault("protocol", "?"), p.get("port"))));
          open.sort(Values::compare);
          return Stream.of(Weighted.one(open));
        });
  }

  private PseudoField countPorts(String state) {
    return of("ports.state_state", withPortState(), List.of("ports.state_state"),
        rec -> Stream.of(ports(rec).filter(p -> state.equals(p.get("state_state"))).count()));
  }

  private PseudoField openPorts(String field, Filter preFilter, Predicate<Map<String, Object>> match,
      String... keys) {
    List<String> keyList = List.of(keys);
    List<String> projection = new ArrayList<>(List.of("ports.port", "ports.state_state"));
    for (String key : keyList) {
      projection.add("ports." + key);
    }
    return of(field, preFilter, projection,
        rec -> ports(rec)
            .filter(p -> "open".equals(p.get("state_state")) && match.test(p))
            .map(p -> keyList.size() == 1 ? p.get(keyList.get(0)) : tuple(p, keyList)));
  }

  private PseudoField cpe(String part, String criteria) {
    String field = "version";
    if (part != null && CPE_FIELDS.contains(part)) {
      field = part;
    } else if (part != null && part.matches("[1-4]")) {
      field = CPE_FIELDS.get(Integer.parseInt(part) - 1);
    }
    List<StringMatch> filters = new ArrayList<>();
    if (criteria != null) {
      for (String value : criteria.split(":", CPE_FIELDS.size())) {
        filters.add(StringMatch.parse(value));
      }
    }
    List<StringMatch> padded = new ArrayList<>(filters);
    while (padded.size() < CPE_FIELDS.size()) {
      padded.add(null);
    }
    Filter preFilter = service.searchCpe(padded.get(0), padded.get(1), padded.get(2), padded.get(3));
    List<String> keys = CPE_FIELDS.subList(0, CPE_FIELDS.indexOf(field) + 1);
    return of("cpes." + field, preFilter, List.of("cpes"),
        rec -> Records.maps(rec, "cpes").stream()
            .filter(cpe -> {
              for (int i = 0; i < filters.size(); i++) {
                if (!textMatches(filters.get(i), cpe.get(CPE_FIELDS.get(i)))) {
                  return false;
                }
              }
              return true;
            })
            .map(cpe -> tuple(cpe, keys)));
  }

  private static boolean textMatches(StringMatch match, Object value) {
    if (match instanceof StringMatch.Regex) {
      return match.test(value == null ? "" : value);
    }
    return match.test(value);
  }

  // Scripts

  private PseudoField smb(String sub) {
    String key = switch (sub) {
      case "dnsdomain" -> "domain_dns";
      case "forest" -> "forest_dns";
      default -> sub;
    };
    return direct("ports.scripts.smb-os-discovery." + key, service.searchScript("smb-os-discovery"));
  }

  private PseudoField scriptOutput(String port, String scriptId) {
    Filter preFilter = service.searchScript(scriptId);
    Predicate<Map<String, Object>> onPort = p -> true;
    if (port != null) {
      int number = "host".equals(port) ? -1 : parsePort(port, "script:" + port + ":" + scriptId);
      preFilter = Filters.and(preFilter,
          number == -1 ? service.searchHostLevelPort(false) : service.searchPort(number));
      onPort = onPort(number);
    }
    Predicate<Map<String, Object>> portMatch = onPort;
    return of("ports.scripts.output", preFilter, List.of("ports.port", "ports.scripts.id", "ports.scripts.output"),
        rec -> ports(rec).filter(portMatch)
            .flatMap(p -> Records.maps(p, "scripts").stream())
            .filter(script -> scriptId.equals(script.get("id")))
            .map(script -> script.get("output")));
  }

  private PseudoField domains(int level) {
    int dots = level - 1;
    return of("hostnames.domains", service.searchFieldExists("hostnames.domains"), List.of("hostnames.domains"),
        rec -> extractor.values(rec, "hostnames.domains")
            .filter(dom -> dom instanceof String text && text.chars().filter(c -> c == '.').count() == dots));
  }

  private PseudoField certificateName(String which) {
    String field = "ports.scripts.ssl-cert." + which;
    return of(field, service.searchFieldExists(field), List.of(field),
        rec -> extractor.values(rec, field)
            .filter(Map.class::isInstance)
            .map(value -> {
              List<List<Object>> items = new ArrayList<>();
              ((Map<?, ?>) value).forEach((k, v) -> items.add(tuple(k, v)));
              items.sort(Values::compare);
              return items;
            }))
        .withOutput(HostPseudoFields::itemsToMap);
  }

  private static Object itemsToMap(Object items) {
    Map<Object, Object> map = new LinkedHashMap<>();
    for (Object item : (List<?>) items) {
      List<?> pair = (List<?>) item;
      map.put(pair.get(0), pair.get(1));
    }
    return map;
  }

  private PseudoField userAgent(String criterion) {
    String field = "ports.scripts.http-user-agent";
    if (criterion == null) {
      return direct(field, service.searchUserAgent(null, false));
    }
    StringMatch match = StringMatch.parse(criterion);
    return of(field, service.searchUserAgent(match, false), List.of(field),
        rec -> extractor.values(rec, field).filter(match::test));
  }

  private PseudoField ja3Client(String sub, String criterion) {
    String subfield = sub == null ? "md5" : sub;
    StringMatch value = criterion == null ? null : StringMatch.parse(criterion);
    Ja3Criterion ja3 = value == null ? null : Ja3Criterion.of(value);
    return of("ports.scripts.ssl-ja3-client." + subfield, service.searchJa3Client(value),
        List.of("ports.scripts.ssl-ja3-client"),
        rec -> scriptEntries(rec, "ssl-ja3-client")
            .filter(entry -> ja3 == null || ja3.test(entry.get(ja3.key())))
            .map(entry -> entry.get(subfield)));
  }

  private PseudoField ja3Server(String sub, String serverCriterion, String clientCriterion) {
    String subfield = sub == null ? "md5" : sub;
    StringMatch server = serverCriterion == null || serverCriterion.isEmpty()
        ? null : StringMatch.parse(serverCriterion);
    StringMatch client = clientCriterion == null || clientCriterion.isEmpty()
        ? null : StringMatch.parse(clientCriterion);
    Ja3Criterion serverJa3 = server == null ? null : Ja3Criterion.of(server);
    Ja3Criterion clientJa3 = client == null ? null : Ja3Criterion.of(client);
    return of("ports.scripts.ssl-ja3-server." + subfield, service.searchJa3Server(server, client),
        List.of("ports.scripts.ssl-ja3-server"),
        rec -> scriptEntries(rec, "ssl-ja3-server")
            .filter(entry -> serverJa3 == null || serverJa3.test(entry.get(serverJa3.key())))
            .filter(entry -> clientJa3 == null
                || clientJa3.test(Records.child(entry, "client").get(clientJa3.key())))
            .map(entry -> tuple(entry.get(subfield), Records.child(entry, "client").get(subfield))));
  }

  private PseudoField sshKeyBits() {
    return of("ports.scripts.ssh-hostkey.bits", service.searchSshKey(null, null, null, null),
        List.of("ports.scripts.ssh-hostkey"),
        rec -> scriptEntries(rec, "ssh-hostkey").map(key -> tuple(key.get("type"), key.get("bits"))));
  }

  private PseudoField ikeVendorIds() {
    return of("ports.scripts.ike-info.vendor_ids", service.searchScript("ike-info"),
        List.of("ports.scripts.ike-info.vendor_ids"),
        rec -> scripts(rec)
            .flatMap(script -> Records.maps(Records.child(script, "ike-info"), "vendor_ids").stream())
            .map(vid -> tuple(vid.get("value"), vid.get("name"))));
  }

  private PseudoField ikeTransforms() {
    return of("ports.scripts.ike-info.transforms", service.searchScript("ike-info"),
        List.of("ports.scripts.ike-info.transforms"),
        rec -> scripts(rec)
            .flatMap(script -> Records.maps(Records.child(script, "ike-info"), "transforms").stream())
            .map(xfrm -> tuple(xfrm, IKE_TRANSFORM_KEYS)));
  }

  private PseudoField httpHeaders() {
    return of("ports.scripts.http-headers", service.searchScript("http-headers"),
        List.of("ports.scripts.http-headers"),
        rec -> scriptEntries(rec, "http-headers").map(hdr -> tuple(hdr.get("name"), hdr.get("value"))));
  }

  private PseudoField httpHeader(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return of("ports.scripts.http-headers.value",
        service.searchHttpHeader(StringMatch.exact(lower), null),
        List.of("ports.scripts.http-headers"),
        rec -> scriptEntries(rec, "http-headers")
            .filter(hdr -> lower.equals(String.valueOf(hdr.getOrDefault("name", "")).toLowerCase(Locale.ROOT)))
            .map(hdr -> hdr.get("value")));
  }

  private PseudoField vulns(String sub) {
    String field = "ports.scripts.vulns." + sub;
    return of(field, service.searchFieldExists(field), List.of(field, "ports.scripts.vulns.id"),
        rec -> scriptEntries(rec, "vulns").map(vuln -> tuple(vuln.get("id"), vuln.get(sub))));
  }

  private PseudoField file(List<String> scripts, String sub) {
    String fieldName = sub == null || sub.isEmpty() ? "filename" : sub;
    return of("ports.scripts.ls.volumes.files." + fieldName, service.searchFile(null, scripts),
        List.of("ports.scripts.id", "ports.scripts.ls"),
        rec -> scripts(rec)
            .filter(script -> scripts == null || scripts.contains(script.get("id")))
            .flatMap(script -> Records.maps(Records.child(script, "ls"), "volumes").stream())
            .flatMap(volume -> Records.maps(volume, "files").stream())
            .map(file -> file.get(fieldName)));
  }

  // Traces

  private PseudoField hop(String comparison, int ttl) {
    Predicate<Object> ttlMatch = ":".equals(comparison)
        ? value -> Values.equal(value, ttl)
        : value -> Values.compare(value, ttl) > 0;
    return of("traces.hops.ipaddr", service.searchFieldExists("traces.hops.ipaddr"),
        List.of("traces.hops.ipaddr", "traces.hops.ttl"),
        rec -> Records.maps(rec, "traces").stream()
            .flatMap(trace -> Records.maps(trace, "hops").stream())
            .filter(hop -> ttlMatch.test(hop.getOrDefault("ttl", 0L)))
            .map(hop -> hop.get("ipaddr")));
  }
}
