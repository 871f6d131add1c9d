package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.DocumentStorePort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.application.topvalues.HostPseudoFields;
import ca.gc.cra.recon.application.topvalues.PseudoFieldRegistry;
import ca.gc.cra.recon.application.topvalues.TopValue;
import ca.gc.cra.recon.domain.codec.AddressCodec;
import ca.gc.cra.recon.domain.codec.DecodingException;
import ca.gc.cra.recon.domain.codec.TimestampCodec;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.filter.StringMatch;
import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.record.Records;
import ca.gc.cra.recon.domain.schema.CountryAliases;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import ca.gc.cra.recon.domain.schema.ScriptAliases;
import ca.gc.cra.recon.logging.Logs;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Query service for host scan results.
 * <p><strong>Why:</strong> Hosts keep addresses and timestamps in internal form and nest ports, scripts and
 * traces several levels deep; this service hides both behind external records and domain searches.</p>
 * <p><strong>Role:</strong> Base of the scan ({@link ScanResultService}) and view ({@link ViewService})
 * collections, which differ in how hosts are stored or merged.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Convert addresses and time bounds between external and internal form.</li>
 *   <li>Build host, port, service, script, trace, OS, CPE and geolocation searches.</li>
 *   <li>Aggregate top values through {@link HostPseudoFields}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> See {@link RecordQueryService}.</p>
 * <p><strong>Observability:</strong> Logs stored hosts at DEBUG and malformed addresses at WARN.</p>
 *
 * @since 0.1.0
 */
public abstract class ActiveQueryService extends RecordQueryService {
  private static final Logger log = LoggerFactory.getLogger(ActiveQueryService.class);

  private static final List<String> NETWORK_DEVICE_TYPES = List.of(
      "bridge", "broadband router", "firewall", "hub", "load balancer", "proxy server", "router", "switch",
      "WAP");
  private static final List<String> PHONE_DEVICE_TYPES = List.of(
      "PBX", "phone", "telecom-misc", "VoIP adapter", "VoIP phone");
  private static final String INTERSIL_VULNERABLE_VERSIONS =
      "^0\\.9(3([^0-9]|$)|4\\.([0-9]|0[0-9]|1[0-1])([^0-9]|$))";

  private final PseudoFieldRegistry pseudoFields;

  protected ActiveQueryService(String collection, Supplier<? extends DocumentStorePort> storeFactory,
      MetricsPort metrics, ClockPort clock) {
    super(collection, FieldSchema.HOSTS, storeFactory, metrics, clock);
    this.pseudoFields = HostPseudoFields.registry(this);
  }

  /**
   * Stores a host, or merges it into an existing one where the collection supports merging.
   *
   * @param host host record in external form
   */
  public abstract void storeOrMergeHost(Map<String, Object> host);

  /**
   * Stores a host record.
   *
   * <p>Addresses become internal integers, {@code starttime}/{@code endtime} become epoch seconds, a
   * single {@code scanid} becomes a one-element list, and a random identity is assigned when
   * {@code _id} is missing.</p>
   *
   * @param host host record in external form; left untouched
   * @return identity of the stored record
   */
  public Object storeHost(Map<String, Object> host) {
    Objects.requireNonNull(host, "host");
    Map<String, Object> rec = Records.deepCopy(host);
    if (rec.containsKey("scanid") && !(rec.get("scanid") instanceof List<?>)) {
      rec.put("scanid", new ArrayList<>(Arrays.asList(rec.get("scanid"))));
    }
    if (rec.containsKey("addr")) {
      rec.put("addr", internalOrRaw(rec.get("addr"), "addr"));
    }
    for (Map<String, Object> port : Records.maps(rec, "ports")) {
      if (port.containsKey("state_reason_ip")) {
        port.put("state_reason_ip", internalOrRaw(port.get("state_reason_ip"), "state_reason_ip"));
      }
    }
    for (Map<String, Object> trace : Records.maps(rec, "traces")) {
      for (Map<String, Object> hop : Records.maps(trace, "hops")) {
        if (hop.containsKey("ipaddr")) {
          hop.put("ipaddr", internalOrRaw(hop.get("ipaddr"), "hops.ipaddr"));
        }
      }
    }
    for (String field : List.of("starttime", "endtime")) {
      if (rec.get(field) != null) {
        rec.put(field, TimestampCodec.toEpoch(rec.get(field)));
      }
    }
    if (rec.get(Records.ID) == null) {
      rec.put(Records.ID, UUID.randomUUID().toString());
    }
    Object id = store().insert(rec);
    log.debug("Host stored: {} in {}", id, collection);
    return id;
  }

  private static Object internalOrRaw(Object address, String field) {
    if (address == null) {
      return null;
    }
    try {
      return AddressCodec.toInternal(address);
    } catch (DecodingException ex) {
      log.warn("Keeping unparsable {} value {} as is: {}", field, Logs.truncate(String.valueOf(address)),
          ex.getMessage());
      return address;
    }
  }

  @Override
  protected Map<String, Object> toExternal(Map<String, Object> stored) {
    if (stored.get("addr") instanceof Number addr) {
      stored.put("addr", AddressCodec.toText(addr));
    }
    for (Map<String, Object> port : Records.maps(stored, "ports")) {
      if (port.get("state_reason_ip") instanceof Number ip) {
        port.put("state_reason_ip", AddressCodec.toText(ip));
      }
    }
    for (Map<String, Object> trace : Records.maps(stored, "traces")) {
      for (Map<String, Object> hop : Records.maps(trace, "hops")) {
        if (hop.get("ipaddr") instanceof Number ip) {
          hop.put("ipaddr", AddressCodec.toText(ip));
        }
      }
    }
    for (String field : List.of("starttime", "endtime")) {
      if (stored.get(field) instanceof Number epoch) {
        stored.put(field, TimestampCodec.toInstant(epoch));
      }
    }
    return stored;
  }

  /**
   * Removes a host.
   *
   * @param recordOrId record as returned by {@link #get(Filter)} or its identity
   */
  public void remove(Object recordOrId) {
    store().remove(Filters.eq(Records.ID, idOf(recordOrId)));
  }

  protected static Object idOf(Object recordOrId) {
    if (recordOrId instanceof Map<?, ?> record) {
      return record.get(Records.ID);
    }
    return recordOrId;
  }

  /**
   * Returns the scan identities a host references.
   *
   * @param host host record
   * @return scan identities, empty when none
   */
  public static List<Object> getScanIds(Map<String, Object> host) {
    return Records.list(host, "scanid");
  }

  /**
   * Ranks the values of a host pseudo-field.
   *
   * @param field pseudo-field name, e.g. {@code port:open}, {@code cpe.product:a:apache} or a stored path
   * @param filter caller filter, {@code null} for all hosts
   * @param topN maximum entries, {@code null} for all
   * @param options sort and paging applied to hosts before extraction
   * @return ranked values
   * @throws IllegalArgumentException when the pseudo-field is unknown or malformed
   */
  public List<TopValue> topValues(String field, Filter filter, Integer topN, QueryOptions options) {
    return topValues(pseudoFields.resolve(field), filter, topN, options);
  }

  public List<TopValue> topValues(String field, Filter filter, Integer topN) {
    return topValues(field, filter, topN, QueryOptions.DEFAULT);
  }

  public PseudoFieldRegistry pseudoFields() {
    return pseudoFields;
  }

  /**
   * Lists the distinct real ports (the host-level {@code -1} entry excluded) of matching hosts.
   *
   * @param filter caller filter
   * @param yieldAll {@code true} to skip sorting
   * @param useService include the service name
   * @param useProduct include the product (requires {@code useService})
   * @param useVersion include the version (requires {@code useProduct})
   * @return tuples {@code [port, service, product, version]} truncated to the requested depth
   */
  public List<List<Object>> featuresPortList(Filter filter, boolean yieldAll, boolean useService,
      boolean useProduct, boolean useVersion) {
    Filter flt = Filters.and(filter == null ? Filter.TRUE : filter, searchFieldExists("ports.port"));
    List<String> fields = new ArrayList<>(List.of("ports.port"));
    List<String> keys = new ArrayList<>(List.of("port"));
    if (useService) {
      fields.add("ports.service_name");
      keys.add("service_name");
      if (useProduct) {
        fields.add("ports.service_product");
        keys.add("service_product");
        if (useVersion) {
          fields.add("ports.service_version");
          keys.add("service_version");
        }
      }
    }
    Set<List<Object>> features = new LinkedHashSet<>();
    for (Map<String, Object> host : get(flt, QueryOptions.DEFAULT.withFields(fields))) {
      for (Map<String, Object> port : Records.maps(host, "ports")) {
        if (Values.equal(port.get("port"), -1)) {
          continue;
        }
        List<Object> feature = new ArrayList<>(keys.size());
        for (String key : keys) {
          feature.add(Values.normalize(port.get(key)));
        }
        features.add(feature);
      }
    }
    List<List<Object>> result = new ArrayList<>(features);
    if (!yieldAll) {
      result.sort(Values::compare);
    }
    return result;
  }

  /**
   * Counts hosts per geographic coordinates.
   *
   * @param filter caller filter
   * @return one entry per distinct coordinates pair, in first-seen order
   */
  public List<TopValue> getLocations(Filter filter) {
    Map<Object, long[]> counts = new LinkedHashMap<>();
    Map<Object, Object> firstSeen = new LinkedHashMap<>();
    for (Map<String, Object> host : get(filter)) {
      Object coordinates = Records.child(host, "infos").get("coordinates");
      if (coordinates == null || coordinates instanceof List<?> list && list.isEmpty()) {
        continue;
      }
      Object key = Values.normalize(coordinates);
      firstSeen.putIfAbsent(key, key);
      counts.computeIfAbsent(key, k -> new long[1])[0]++;
    }
    List<TopValue> result = new ArrayList<>(counts.size());
    counts.forEach((key, count) -> result.add(new TopValue(firstSeen.get(key), count[0])));
    return result;
  }

  /**
   * Lists addresses with their port states.
   *
   * @param filter caller filter
   * @param limit maximum hosts, or {@code null}
   * @param skip hosts to skip, or {@code null}
   * @return hosts having ports, and the number of ports over all listed hosts
   */
  public Listing getIpsPorts(Filter filter, Integer limit, Integer skip) {
    List<Map<String, Object>> hosts = get(filter, QueryOptions.DEFAULT.withLimit(limit).withSkip(skip));
    long count = 0;
    List<Map<String, Object>> records = new ArrayList<>();
    for (Map<String, Object> host : hosts) {
      List<Map<String, Object>> ports = Records.maps(host, "ports");
      count += Records.list(host, "ports").size();
      if (ports.isEmpty()) {
        continue;
      }
      List<Object> summary = new ArrayList<>();
      for (Map<String, Object> port : ports) {
        if (port.containsKey("state_state")) {
          Map<String, Object> entry = new LinkedHashMap<>();
          entry.put("state_state", port.get("state_state"));
          entry.put("port", port.get("port"));
          summary.add(entry);
        }
      }
      Map<String, Object> record = new LinkedHashMap<>();
      record.put("addr", host.get("addr"));
      record.put("ports", summary);
      records.add(record);
    }
    return new Listing(records, count);
  }

  /**
   * Lists addresses only.
   *
   * @param filter caller filter
   * @param limit maximum hosts, or {@code null}
   * @param skip hosts to skip, or {@code null}
   * @return one {@code {addr}} document per host, and the number of hosts
   */
  public Listing getIps(Filter filter, Integer limit, Integer skip) {
    List<Map<String, Object>> hosts = get(filter, QueryOptions.DEFAULT.withLimit(limit).withSkip(skip));
    List<Map<String, Object>> records = new ArrayList<>(hosts.size());
    for (Map<String, Object> host : hosts) {
      Map<String, Object> record = new LinkedHashMap<>();
      record.put("addr", host.get("addr"));
      records.add(record);
    }
    return new Listing(records, hosts.size());
  }

  /**
   * Lists addresses with their open port count.
   *
   * @param filter caller filter
   * @param limit maximum hosts, or {@code null}
   * @param skip hosts to skip, or {@code null}
   * @return hosts carrying {@code openports.count}, and the number of hosts read
   */
  public Listing getOpenPortCount(Filter filter, Integer limit, Integer skip) {
    List<Map<String, Object>> hosts = get(filter, QueryOptions.DEFAULT.withLimit(limit).withSkip(skip));
    List<Map<String, Object>> records = new ArrayList<>();
    for (Map<String, Object> host : hosts) {
      Object count = Records.child(host, "openports").get("count");
      if (count == null) {
        continue;
      }
      Map<String, Object> record = new LinkedHashMap<>();
      record.put("addr", host.get("addr"));
      record.put("starttime", host.get("starttime"));
      record.put("openports", new LinkedHashMap<>(Map.of("count", count)));
      records.add(record);
    }
    return new Listing(records, hosts.size());
  }

  // Hostnames, categories, geolocation

  public Filter searchDomain(StringMatch name, boolean neg) {
    Filter res = Filters.any("hostnames", Filters.textInArray("domains", name, false));
    return neg ? Filters.not(res) : res;
  }

  public Filter searchHostname(StringMatch name, boolean neg) {
    Filter res = Filters.any("hostnames", Filters.text("name", name));
    return neg ? Filters.not(res) : res;
  }

  public Filter searchCategory(StringMatch category, boolean neg) {
    return Filters.textInArray("categories", category, neg);
  }

  /**
   * Filters on a country code; aliases such as {@code EU} expand to several codes.
   *
   * @param country ISO code or alias
   * @param neg {@code true} to exclude the country instead
   * @return filter
   */
  public Filter searchCountry(String country, boolean neg) {
    List<String> codes = CountryAliases.expand(country);
    if (codes.size() == 1) {
      return neg ? Filters.ne("infos.country_code", codes.get(0)) : Filters.eq("infos.country_code", codes.get(0));
    }
    return searchCountries(codes, neg);
  }

  public Filter searchCountries(Collection<String> countries, boolean neg) {
    Filter res = Filters.oneOf("infos.country_code", CountryAliases.expand(countries));
    return neg ? Filters.not(res) : res;
  }

  public Filter searchCity(StringMatch city, boolean neg) {
    return Filters.text("infos.city", city, neg);
  }

  public Filter searchHasLocation(boolean neg) {
    Filter res = Filters.exists("infos.coordinates");
    return neg ? Filters.not(res) : res;
  }

  public Filter searchAsNum(long asNum, boolean neg) {
    return neg ? Filters.ne("infos.as_num", asNum) : Filters.eq("infos.as_num", asNum);
  }

  public Filter searchAsNums(Collection<? extends Number> asNums, boolean neg) {
    List<Long> values = new ArrayList<>(asNums.size());
    for (Number asNum : asNums) {
      values.add(asNum.longValue());
    }
    Filter res = Filters.oneOf("infos.as_num", values);
    return neg ? Filters.not(res) : res;
  }

  public Filter searchAsName(StringMatch asName, boolean neg) {
    return Filters.text("infos.as_name", asName, neg);
  }

  public Filter searchSource(StringMatch source, boolean neg) {
    return Filters.text("source", source, neg);
  }

  // Ports and services

  public Filter searchPort(int port) {
    return searchPort(port, "tcp", "open", false);
  }

  /**
   * Hosts with a given port in a given state.
   *
   * <p>The negation holds for hosts that have the port in another state, hosts whose ports all differ from
   * it, and hosts without any port list.</p>
   *
   * @param port port number
   * @param protocol protocol, e.g. {@code tcp}
   * @param state port state, e.g. {@code open}
   * @param neg {@code true} to exclude matching hosts instead
   * @return filter
   */
  public Filter searchPort(int port, String protocol, String state, boolean neg) {
    Filter portMatch = Filters.and(Filters.eq("port", port), Filters.eq("protocol", protocol));
    if (neg) {
      return Filters.or(
          Filters.any("ports", Filters.and(portMatch, Filters.ne("state_state", state))),
          Filters.all("ports", Filters.not(portMatch)),
          Filters.not(Filters.exists("ports")));
    }
    return Filters.any("ports", Filters.and(portMatch, Filters.eq("state_state", state)));
  }

  /**
   * Hosts with (or, negated, with a real port besides) the host-level {@code -1} pseudo-port.
   *
   * @param neg {@code true} to look for real ports instead
   * @return filter
   */
  public Filter searchHostLevelPort(boolean neg) {
    return Filters.any("ports", neg ? Filters.gt("port", 0) : Filters.eq("port", -1));
  }

  public Filter searchPortsOther(Collection<Integer> ports, String protocol, String state) {
    return Filters.any("ports", Filters.and(
        Filters.eq("protocol", protocol),
        Filters.eq("state_state", state),
        Filters.not(Filters.oneOf("port", ports))));
  }

  /**
   * Hosts with all listed ports (or, negated, with none of them).
   *
   * @param ports port numbers
   * @param protocol protocol
   * @param state state
   * @param neg {@code true} to require none of the ports
   * @return filter
   */
  public Filter searchPorts(Collection<Integer> ports, String protocol, String state, boolean neg) {
    List<Filter> res = new ArrayList<>(ports.size());
    for (int port : ports) {
      res.add(searchPort(port, protocol, state, false));
    }
    return neg ? Filters.not(Filters.or(res)) : Filters.and(res);
  }

  /**
   * Hosts whose open port count lies in {@code [min, max]}.
   *
   * @param min lower bound or {@code null}
   * @param max upper bound or {@code null}
   * @param neg {@code true} to exclude the interval instead
   * @return filter
   * @throws IllegalArgumentException when both bounds are {@code null}
   */
  public Filter searchCountOpenPorts(Integer min, Integer max, boolean neg) {
    if (min == null && max == null) {
      throw new IllegalArgumentException("searchCountOpenPorts needs a minimum or a maximum");
    }
    String path = "openports.count";
    if (Objects.equals(min, max)) {
      return neg ? Filters.ne(path, min) : Filters.eq(path, min);
    }
    List<Filter> res = new ArrayList<>(2);
    if (min != null) {
      res.add(neg ? Filters.lt(path, min) : Filters.gte(path, min));
    }
    if (max != null) {
      res.add(neg ? Filters.gt(path, max) : Filters.lte(path, max));
    }
    return neg ? Filters.or(res) : Filters.and(res);
  }

  public Filter searchOpenPort(boolean neg) {
    Filter res = Filters.any("ports", Filters.eq("state_state", "open"));
    return neg ? Filters.not(res) : res;
  }

  public Filter searchService(StringMatch service) {
    return searchService(service, null, null);
  }

  public Filter searchService(StringMatch service, Integer port, String protocol) {
    List<Filter> res = new ArrayList<>(List.of(Filters.text("service_name", service)));
    if (port != null) {
      res.add(Filters.eq("port", port));
    }
    if (protocol != null) {
      res.add(Filters.eq("protocol", protocol));
    }
    return Filters.any("ports", Filters.and(res));
  }

  /**
   * Ports running a product.
   *
   * @param product product criterion
   * @param version version criterion or {@code null}
   * @param service service criterion or {@code null}
   * @param port port number or {@code null}
   * @param protocol protocol or {@code null}
   * @return filter
   */
  public Filter searchProduct(StringMatch product, StringMatch version, StringMatch service, Integer port,
      String protocol) {
    List<Filter> res = new ArrayList<>(List.of(Filters.text("service_product", product)));
    if (version != null) {
      res.add(Filters.text("service_version", version));
    }
    if (service != null) {
      res.add(Filters.text("service_name", service));
    }
    if (port != null) {
      res.add(Filters.eq("port", port));
    }
    if (protocol != null) {
      res.add(Filters.eq("protocol", protocol));
    }
    return Filters.any("ports", Filters.and(res));
  }

  public Filter searchSvcHostname(StringMatch hostname) {
    return Filters.any("ports", Filters.text("service_hostname", hostname));
  }

  public Filter searchWebmin() {
    return Filters.any("ports", Filters.and(
        Filters.eq("service_name", "http"),
        Filters.eq("service_product", "MiniServ"),
        Filters.ne("service_extrainfo", "Webmin httpd")));
  }

  public Filter searchX11() {
    return Filters.any("ports", Filters.and(
        Filters.eq("service_name", "X11"),
        Filters.ne("service_extrainfo", "access denied")));
  }

  public Filter searchVsftpdBackdoor() {
    return Filters.any("ports", Filters.and(
        Filters.eq("protocol", "tcp"),
        Filters.eq("state_state", "open"),
        Filters.eq("service_product", "vsftpd"),
        Filters.eq("service_version", "2.3.4")));
  }

  public Filter searchVulnIntersil() {
    return Filters.any("ports", Filters.and(
        Filters.eq("protocol", "tcp"),
        Filters.eq("state_state", "open"),
        Filters.eq("service_product", "Boa HTTPd"),
        Filters.matches("service_version", INTERSIL_VULNERABLE_VERSIONS)));
  }

  public Filter searchDeviceType(StringMatch deviceType) {
    return Filters.any("ports", Filters.text("service_devicetype", deviceType));
  }

  public Filter searchDeviceTypes(Collection<String> deviceTypes) {
    return Filters.any("ports", Filters.oneOf("service_devicetype", deviceTypes));
  }

  public Filter searchNetDev() {
    return searchDeviceTypes(NETWORK_DEVICE_TYPES);
  }

  public Filter searchPhoneDev() {
    return searchDeviceTypes(PHONE_DEVICE_TYPES);
  }

  public Filter searchLdapAnon() {
    return Filters.any("ports", Filters.eq("service_extrainfo", "Anonymous bind OK"));
  }

  // Scripts

  public Filter searchScript(String name) {
    return searchScript(StringMatch.exact(name), null, false);
  }

  /**
   * Hosts with a script result matching an id and/or output; with neither, hosts with any script.
   *
   * @param name script id criterion or {@code null}
   * @param output output criterion or {@code null}
   * @param neg {@code true} to exclude matching hosts instead
   * @return filter
   */
  public Filter searchScript(StringMatch name, StringMatch output, boolean neg) {
    return scriptFilter(name, output, List.of(), neg);
  }

  /**
   * Hosts with a script whose structured output holds the given values.
   *
   * <p>Keys are dotted paths inside the script payload. A {@link StringMatch} value matches text (a
   * regular expression also searches every element of array fields); any other value must be equal to,
   * or a member of, the stored value.</p>
   *
   * @param name literal script id
   * @param output output criterion or {@code null}
   * @param values criteria per payload path
   * @param neg {@code true} to exclude matching hosts instead
   * @return filter
   * @throws IllegalArgumentException when {@code name} is not a literal
   */
  public Filter searchScriptValues(StringMatch name, StringMatch output, Map<String, ?> values, boolean neg) {
    String key = ScriptAliases.tableKey(literalName(name));
    boolean listKey = schema.isList("ports.scripts." + key);
    List<Filter> criteria = new ArrayList<>();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      String field = entry.getKey();
      String path = listKey ? field : key + "." + field;
      boolean listField = schema.isList("ports.scripts." + key + "." + field);
      Object value = entry.getValue();
      Filter condition;
      if (value instanceof StringMatch.Regex regex) {
        condition = Filters.matches(path, regex.pattern());
      } else {
        Object literal = value instanceof StringMatch.Exact exact ? exact.value() : value;
        condition = listField ? Filters.contains(path, literal) : Filters.eq(path, literal);
      }
      criteria.add(listKey ? Filters.any(key, condition) : condition);
    }
    return scriptFilter(name, output, criteria, neg);
  }

  /**
   * Hosts with a script whose whole structured output (or one of its elements) matches {@code value}.
   *
   * @param name literal script id
   * @param output output criterion or {@code null}
   * @param value payload criterion
   * @param neg {@code true} to exclude matching hosts instead
   * @return filter
   * @throws IllegalArgumentException when {@code name} is not a literal
   */
  public Filter searchScriptValue(StringMatch name, StringMatch output, StringMatch value, boolean neg) {
    String key = ScriptAliases.tableKey(literalName(name));
    Filter criterion = schema.isList("ports.scripts." + key)
        ? Filters.textInArray(key, value, false)
        : Filters.text(key, value);
    return scriptFilter(name, output, List.of(criterion), neg);
  }

  private static String literalName(StringMatch name) {
    if (!(name instanceof StringMatch.Exact exact)) {
      throw new IllegalArgumentException("searchScript needs a literal script name when values are given");
    }
    return exact.value();
  }

  private Filter scriptFilter(StringMatch name, StringMatch output, List<Filter> criteria, boolean neg) {
    List<Filter> res = new ArrayList<>();
    if (name != null) {
      res.add(Filters.text("id", name));
    }
    if (output != null) {
      res.add(Filters.text("output", output));
    }
    res.addAll(criteria);
    Filter flt = res.isEmpty()
        ? Filters.any("ports", Filters.exists("scripts"))
        : Filters.any("ports", Filters.any("scripts", Filters.and(res)));
    return neg ? Filters.not(flt) : flt;
  }

  /**
   * Files listed by {@code ls}-style scripts.
   *
   * @param fileName file name criterion, or {@code null} for any file
   * @param scripts script ids to restrict to, or {@code null}
   * @return filter
   */
  public Filter searchFile(StringMatch fileName, Collection<String> scripts) {
    Filter name = fileName == null ? Filters.exists("filename") : Filters.text("filename", fileName);
    Filter volumes = Filters.any("ls.volumes", Filters.any("files", name));
    if (scripts == null) {
      return Filters.any("ports", Filters.any("scripts", volumes));
    }
    Filter ids = scripts.size() == 1
        ? Filters.eq("id", scripts.iterator().next())
        : Filters.oneOf("id", scripts);
    return Filters.any("ports", Filters.any("scripts", Filters.and(ids, volumes)));
  }

  public Filter searchHttpTitle(StringMatch title) {
    return Filters.any("ports", Filters.any("scripts", Filters.and(
        Filters.oneOf("id", List.of("http-title", "html-title")),
        Filters.text("output", title))));
  }

  /**
   * Vulnerabilities reported by scripts.
   *
   * @param vulnId identifier criterion or {@code null}
   * @param status status criterion or {@code null}
   * @return filter; with no criteria, hosts with any vulnerability id
   */
  public Filter searchVuln(StringMatch vulnId, StringMatch status) {
    List<Filter> res = new ArrayList<>();
    if (status != null) {
      res.add(Filters.text("vulns.status", status));
    }
    if (vulnId != null) {
      res.add(Filters.text("vulns.id", vulnId));
    }
    Filter criteria = res.isEmpty() ? Filters.exists("vulns.id") : Filters.and(res);
    return Filters.any("ports", Filters.any("scripts", criteria));
  }

  public Filter searchJa3Client(StringMatch valueOrHash) {
    if (valueOrHash == null) {
      return searchScript("ssl-ja3-client");
    }
    Ja3Criterion criterion = Ja3Criterion.of(valueOrHash);
    return searchScriptValues(StringMatch.exact("ssl-ja3-client"), null,
        Map.of(criterion.key(), criterion.value()), false);
  }

  /**
   * Servers answering JA3 clients.
   *
   * @param valueOrHash server fingerprint criterion or {@code null}
   * @param clientValueOrHash client fingerprint criterion or {@code null}
   * @return filter
   */
  public Filter searchJa3Server(StringMatch valueOrHash, StringMatch clientValueOrHash) {
    if (valueOrHash == null && clientValueOrHash == null) {
      return searchScript("ssl-ja3-server");
    }
    Map<String, Object> values = new LinkedHashMap<>();
    if (valueOrHash != null) {
      Ja3Criterion criterion = Ja3Criterion.of(valueOrHash);
      values.put(criterion.key(), criterion.value());
    }
    if (clientValueOrHash != null) {
      Ja3Criterion criterion = Ja3Criterion.of(clientValueOrHash);
      values.put("client." + criterion.key(), criterion.value());
    }
    return searchScriptValues(StringMatch.exact("ssl-ja3-server"), null, values, false);
  }

  public Filter searchSshKey(String keyType) {
    return searchSshKey(null, null, keyType, null);
  }

  /**
   * SSH host keys.
   *
   * @param fingerprint fingerprint criterion (literal colons are ignored) or {@code null}
   * @param key base64 key criterion or {@code null}
   * @param keyType key type without the {@code ssh-} prefix, e.g. {@code rsa}, or {@code null}
   * @param bits key size or {@code null}
   * @return filter
   */
  public Filter searchSshKey(StringMatch fingerprint, StringMatch key, String keyType, Integer bits) {
    Map<String, Object> values = new LinkedHashMap<>();
    if (fingerprint != null) {
      values.put("fingerprint", fingerprint instanceof StringMatch.Exact exact
          ? StringMatch.exact(exact.value().replace(":", "").toLowerCase(Locale.ROOT))
          : fingerprint);
    }
    if (key != null) {
      values.put("key", key);
    }
    if (keyType != null) {
      values.put("type", "ssh-" + keyType);
    }
    if (bits != null) {
      values.put("bits", bits);
    }
    if (values.isEmpty()) {
      return searchScript("ssh-hostkey");
    }
    return searchScriptValues(StringMatch.exact("ssh-hostkey"), null, values, false);
  }

  public Filter searchUserAgent(StringMatch userAgent, boolean neg) {
    if (userAgent == null) {
      return searchScript(StringMatch.exact("http-user-agent"), null, neg);
    }
    return searchScriptValue(StringMatch.exact("http-user-agent"), null, userAgent, neg);
  }

  /**
   * HTTP response headers.
   *
   * @param name header name criterion or {@code null}
   * @param value header value criterion or {@code null}
   * @return filter
   */
  public Filter searchHttpHeader(StringMatch name, StringMatch value) {
    Map<String, Object> values = new LinkedHashMap<>();
    if (name != null) {
      values.put("name", name);
    }
    if (value != null) {
      values.put("value", value);
    }
    if (values.isEmpty()) {
      return searchScript("http-headers");
    }
    return searchScriptValues(StringMatch.exact("http-headers"), null, values, false);
  }

  public Filter searchCert(String keyType) {
    if (keyType == null) {
      return searchScript("ssl-cert");
    }
    return searchScriptValues(StringMatch.exact("ssl-cert"), null, Map.of("pubkey.type", keyType), false);
  }

  // OS, time, traces, CPE

  public Filter searchOs(StringMatch text) {
    return Filters.any("os.osclass", Filters.or(
        Filters.text("vendor", text),
        Filters.text("osfamily", text),
        Filters.text("osclass", text)));
  }

  /**
   * Hosts whose scan ended at most {@code delta} ago.
   *
   * @param delta age
   * @param neg {@code true} for older hosts instead
   * @return filter
   */
  public Filter searchTimeAgo(Duration delta, boolean neg) {
    Number threshold = TimestampCodec.toEpoch(Instant.ofEpochMilli(clock.nowMillis()).minus(delta));
    return neg ? Filters.lt("endtime", threshold) : Filters.gte("endtime", threshold);
  }

  /**
   * Hosts whose scan window overlaps {@code [start, stop]}.
   *
   * @param start range start (any accepted timestamp form)
   * @param stop range end
   * @param neg {@code true} for hosts outside the range instead
   * @return filter
   */
  public Filter searchTimeRange(Object start, Object stop, boolean neg) {
    Number from = TimestampCodec.toEpoch(start);
    Number to = TimestampCodec.toEpoch(stop);
    if (neg) {
      return Filters.or(Filters.lt("endtime", from), Filters.gt("starttime", to));
    }
    return Filters.and(Filters.gte("endtime", from), Filters.lte("starttime", to));
  }

  /**
   * Traceroute hops.
   *
   * @param hop hop address, textual or internal
   * @param ttl required TTL or {@code null}
   * @param neg {@code true} to exclude matching hosts instead
   * @return filter
   */
  public Filter searchHop(Object hop, Integer ttl, boolean neg) {
    List<Filter> res = new ArrayList<>(List.of(Filters.eq("ipaddr", AddressCodec.toInternal(hop))));
    if (ttl != null) {
      res.add(Filters.eq("ttl", ttl));
    }
    Filter flt = Filters.any("traces", Filters.any("hops", Filters.and(res)));
    return neg ? Filters.not(flt) : flt;
  }

  public Filter searchHopDomain(StringMatch domain, boolean neg) {
    Filter flt = Filters.any("traces", Filters.any("hops", Filters.textInArray("domains", domain, false)));
    return neg ? Filters.not(flt) : flt;
  }

  public Filter searchHopName(StringMatch name, boolean neg) {
    Filter flt = Filters.any("traces", Filters.any("hops", Filters.text("host", name)));
    return neg ? Filters.not(flt) : flt;
  }

  /**
   * CPE entries; with no criteria, hosts with any CPE.
   *
   * @param type part criterion ({@code a}, {@code o} or {@code h}) or {@code null}
   * @param vendor vendor criterion or {@code null}
   * @param product product criterion or {@code null}
   * @param version version criterion or {@code null}
   * @return filter
   */
  public Filter searchCpe(StringMatch type, StringMatch vendor, StringMatch product, StringMatch version) {
    List<Filter> res = new ArrayList<>();
    if (type != null) {
      res.add(Filters.text("type", type));
    }
    if (vendor != null) {
      res.add(Filters.text("vendor", vendor));
    }
    if (product != null) {
      res.add(Filters.text("product", product));
    }
    if (version != null) {
      res.add(Filters.text("version", version));
    }
    if (res.isEmpty()) {
      return Filters.exists("cpes");
    }
    return Filters.any("cpes", Filters.and(res));
  }
}
