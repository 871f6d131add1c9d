package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.DocumentStorePort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.application.topvalues.PassivePseudoFields;
import ca.gc.cra.recon.application.topvalues.PseudoFieldRegistry;
import ca.gc.cra.recon.application.topvalues.TopValue;
import ca.gc.cra.recon.domain.codec.AddressCodec;
import ca.gc.cra.recon.domain.codec.BinaryCodec;
import ca.gc.cra.recon.domain.codec.DecodingException;
import ca.gc.cra.recon.domain.codec.TimestampCodec;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.filter.StringMatch;
import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.record.Records;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Query service for passive observations (DNS answers, certificates, banners, JA3
 * fingerprints, HTTP headers).
 * <p><strong>Why:</strong> Passive records are deduplicated sightings with a count and a seen window; their
 * searches test flat fields and the derived {@code infos} block instead of nested ports.</p>
 * <p><strong>Role:</strong> Application service over the {@code passive} collection; delegates sighting
 * folding to {@link PassiveMergeEngine}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Convert addresses, seen timestamps and binary certificate values between external and stored
 *   form.</li>
 *   <li>Build the passive searches, rejecting protocols, states and negations passive data cannot
 *   answer.</li>
 *   <li>Rank values by distinct records or by summed {@code count}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> See {@link RecordQueryService}.</p>
 *
 * @since 0.1.0
 */
public class PassiveQueryService extends RecordQueryService {
  private static final Logger log = LoggerFactory.getLogger(PassiveQueryService.class);
  private static final List<String> SEEN_FIELDS = List.of("firstseen", "lastseen");
  private static final List<String> HTTP_HEADER_TYPES = List.of("HTTP_CLIENT_HEADER", "HTTP_CLIENT_HEADER_SERVER");
  private static final List<String> AUTHORIZATION_SOURCES = List.of("AUTHORIZATION", "PROXY-AUTHORIZATION");
  private static final Pattern BASIC_AUTH = Pattern.compile("^Basic", Pattern.CASE_INSENSITIVE);
  private static final Pattern JA3_SOURCE = Pattern.compile("^ja3-");

  private final PassiveMergeEngine mergeEngine;
  private final PseudoFieldRegistry distinctFields;
  private final PseudoFieldRegistry weightedFields;

  /**
   * Creates the service.
   *
   * @param storeFactory opens the passive collection
   * @param metrics metrics sink, {@code null} for none
   * @param clock time source, {@code null} for the system clock
   */
  public PassiveQueryService(Supplier<? extends DocumentStorePort> storeFactory, MetricsPort metrics,
      ClockPort clock) {
    super("passive", FieldSchema.PASSIVE, storeFactory, metrics, clock);
    this.mergeEngine = new PassiveMergeEngine(this::store, PassiveQueryService::toInternal, this.metrics);
    this.distinctFields = PassivePseudoFields.registry(this, true);
    this.weightedFields = PassivePseudoFields.registry(this, false);
  }

  /**
   * Converts an external passive record to its stored form.
   *
   * @param record external record; left untouched
   * @return stored form without {@code _id}
   */
  public static Map<String, Object> toInternal(Map<String, Object> record) {
    Map<String, Object> rec = Records.deepCopy(record);
    if (rec.get("addr") != null) {
      try {
        rec.put("addr", AddressCodec.toInternal(rec.get("addr")));
      } catch (DecodingException ex) {
        log.warn("Keeping unparsable passive addr {}: {}", rec.get("addr"), ex.getMessage());
      }
    }
    for (String field : SEEN_FIELDS) {
      if (rec.get(field) != null) {
        rec.put(field, TimestampCodec.toEpoch(rec.get(field)));
      }
    }
    if (isCertificate(rec) && rec.get("value") instanceof byte[] der) {
      rec.put("value", BinaryCodec.encode(der));
    }
    rec.remove(Records.ID);
    return rec;
  }

  private static boolean isCertificate(Map<String, Object> rec) {
    return "SSL_SERVER".equals(rec.get("recontype")) && "cert".equals(rec.get("source"));
  }

  @Override
  protected Map<String, Object> toExternal(Map<String, Object> stored) {
    if (stored.get("addr") instanceof Number addr) {
      stored.put("addr", AddressCodec.toText(addr));
    }
    for (String field : SEEN_FIELDS) {
      if (stored.get(field) instanceof Number epoch) {
        stored.put(field, TimestampCodec.toInstant(epoch));
      }
    }
    if (isCertificate(stored) && stored.get("value") instanceof String encoded) {
      stored.put("value", BinaryCodec.decode(encoded));
    }
    return stored;
  }

  public Map<String, Object> getOne(Filter filter) {
    return getOne(filter, QueryOptions.DEFAULT);
  }

  /**
   * Stores an observation without deduplication.
   *
   * @param record observation in external form
   * @param infoResolver computes extra fields, or {@code null}
   * @return identity of the stored record
   */
  public Object insert(Map<String, Object> record, InfoResolver infoResolver) {
    Objects.requireNonNull(record, "record");
    Map<String, Object> spec = Records.deepCopy(record);
    if (infoResolver != null) {
      spec.putAll(infoResolver.resolve(spec));
    }
    Object id = store().insert(toInternal(spec));
    log.debug("Passive record stored: {}", id);
    return id;
  }

  /**
   * Records a sighting, folding it into an identical stored observation when there is one.
   *
   * @param timestamp time of the sighting
   * @param record observation in external form; {@code null} is ignored
   * @param infoResolver computes {@code infos} for new records, or {@code null}
   * @param lastseen end of the sighting window, or {@code null} when equal to {@code timestamp}
   * @return what happened
   */
  public PassiveMergeEngine.Outcome insertOrUpdate(Object timestamp, Map<String, Object> record,
      InfoResolver infoResolver, Object lastseen) {
    return mergeEngine.insertOrUpdate(timestamp, record, infoResolver, lastseen);
  }

  public PassiveMergeEngine.Outcome insertOrUpdate(Object timestamp, Map<String, Object> record) {
    return insertOrUpdate(timestamp, record, null, null);
  }

  /**
   * Removes one record by identity, or every record matching a filter.
   *
   * @param idOrFilter identity or {@link Filter}
   * @return number of removed records
   */
  public int remove(Object idOrFilter) {
    if (idOrFilter instanceof Filter filter) {
      return store().remove(filter);
    }
    return store().removeById(List.of(idOrFilter));
  }

  /**
   * Ranks the values of a passive field.
   *
   * @param field stored path or {@code net[:bits]}
   * @param filter caller filter
   * @param distinct {@code true} to count records, {@code false} to sum their {@code count}
   * @param topN maximum entries, {@code null} for all
   * @param options sort and paging applied before extraction
   * @return ranked values
   */
  public List<TopValue> topValues(String field, Filter filter, boolean distinct, Integer topN,
      QueryOptions options) {
    PseudoFieldRegistry registry = distinct ? distinctFields : weightedFields;
    return topValues(registry.resolve(field), filter, topN, options);
  }

  public List<TopValue> topValues(String field, Filter filter, Integer topN) {
    return topValues(field, filter, true, topN, QueryOptions.DEFAULT);
  }

  /**
   * Lists the distinct ports (optionally with service details) of matching observations.
   *
   * @param filter caller filter
   * @param yieldAll {@code true} to skip sorting
   * @param useService include {@code infos.service_name}
   * @param useProduct include {@code infos.service_product} (requires {@code useService})
   * @param useVersion include {@code infos.service_version} (requires {@code useProduct})
   * @return feature tuples
   */
  public List<List<Object>> featuresPortList(Filter filter, boolean yieldAll, boolean useService,
      boolean useProduct, boolean useVersion) {
    Filter flt = Filters.and(filter == null ? Filter.TRUE : filter, searchFieldExists("port"));
    List<String> infoKeys = new ArrayList<>();
    if (useService) {
      infoKeys.add("service_name");
      if (useProduct) {
        infoKeys.add("service_product");
        if (useVersion) {
          infoKeys.add("service_version");
        }
      }
    }
    List<String> fields = new ArrayList<>(List.of("port"));
    for (String key : infoKeys) {
      fields.add("infos." + key);
    }
    Set<List<Object>> features = new LinkedHashSet<>();
    for (Map<String, Object> rec : get(flt, QueryOptions.DEFAULT.withFields(fields))) {
      List<Object> feature = new ArrayList<>();
      feature.add(Values.normalize(rec.get("port")));
      Map<String, Object> infos = Records.child(rec, "infos");
      for (String key : infoKeys) {
        feature.add(infos.get(key));
      }
      features.add(feature);
    }
    List<List<Object>> result = new ArrayList<>(features);
    if (!yieldAll) {
      result.sort(Values::compare);
    }
    return result;
  }

  // Passive searches

  public Filter searchRecontype(StringMatch recontype) {
    return Filters.text("recontype", recontype);
  }

  public Filter searchSensor(StringMatch sensor, boolean neg) {
    return Filters.text("sensor", sensor, neg);
  }

  /**
   * Observations on a TCP port.
   *
   * @param port port number
   * @param protocol must be {@code tcp}
   * @param state must be {@code open}
   * @param neg {@code true} for other ports
   * @return filter
   * @throws IllegalArgumentException for any other protocol or state
   */
  public Filter searchPort(int port, String protocol, String state, boolean neg) {
    requireTcp(protocol);
    if (!"open".equals(state)) {
      throw new IllegalArgumentException("Only open ports can be found in passive");
    }
    return neg ? Filters.ne("port", port) : Filters.eq("port", port);
  }

  public Filter searchPort(int port) {
    return searchPort(port, "tcp", "open", false);
  }

  private static void requireTcp(String protocol) {
    if (protocol != null && !"tcp".equals(protocol)) {
      throw new IllegalArgumentException("Protocols other than TCP are not supported in passive");
    }
  }

  public Filter searchService(StringMatch service, Integer port, String protocol) {
    requireTcp(protocol);
    List<Filter> res = new ArrayList<>(List.of(Filters.text("infos.service_name", service)));
    if (port != null) {
      res.add(Filters.eq("port", port));
    }
    return Filters.and(res);
  }

  /**
   * Observations of a product.
   *
   * @param product product criterion
   * @param version version criterion or {@code null}
   * @param service service criterion or {@code null}
   * @param port port or {@code null}
   * @param protocol {@code tcp} or {@code null}
   * @return filter
   */
  public Filter searchProduct(StringMatch product, StringMatch version, StringMatch service, Integer port,
      String protocol) {
    requireTcp(protocol);
    List<Filter> res = new ArrayList<>(List.of(Filters.text("infos.service_product", product)));
    if (version != null) {
      res.add(Filters.text("infos.service_version", version));
    }
    if (service != null) {
      res.add(Filters.text("infos.service_name", service));
    }
    if (port != null) {
      res.add(Filters.eq("port", port));
    }
    return Filters.and(res);
  }

  public Filter searchSvcHostname(StringMatch hostname) {
    return Filters.text("infos.service_hostname", hostname);
  }

  /**
   * MAC address observations.
   *
   * @param mac address criterion or {@code null}
   * @param neg with a criterion, MAC records not matching it; without one, records that are not MAC
   *     observations
   * @return filter
   */
  public Filter searchMac(StringMatch mac, boolean neg) {
    if (mac == null) {
      return neg ? Filters.ne("recontype", "MAC_ADDRESS") : Filters.eq("recontype", "MAC_ADDRESS");
    }
    return Filters.and(Filters.eq("recontype", "MAC_ADDRESS"), Filters.text("value", mac, neg));
  }

  /**
   * User-Agent headers sent by clients.
   *
   * @param userAgent criterion or {@code null}
   * @param neg unsupported; must be {@code false}
   * @return filter
   * @throws IllegalArgumentException when {@code neg} is {@code true}
   */
  public Filter searchUserAgent(StringMatch userAgent, boolean neg) {
    if (neg) {
      throw new IllegalArgumentException("Negated user-agent searches are not supported in passive");
    }
    Filter res = Filters.and(Filters.eq("recontype", "HTTP_CLIENT_HEADER"), Filters.eq("source", "USER-AGENT"));
    return userAgent == null ? res : Filters.and(res, Filters.text("value", userAgent));
  }

  /**
   * DNS answers.
   *
   * @param name name criterion or {@code null}
   * @param reverse {@code true} to test the answer target instead of the queried name
   * @param dnsType record type such as {@code A} or {@code MX}, or {@code null}
   * @param subdomains {@code true} to match any parent domain of the name
   * @return filter
   */
  public Filter searchDns(StringMatch name, boolean reverse, String dnsType, boolean subdomains) {
    List<Filter> res = new ArrayList<>(List.of(Filters.eq("recontype", "DNS_ANSWER")));
    if (name != null) {
      String path = dnsPath(reverse, subdomains);
      res.add(subdomains ? Filters.textInArray(path, name, false) : Filters.text(path, name));
    }
    addDnsType(res, dnsType);
    return Filters.and(res);
  }

  /**
   * DNS answers for any of several literal names.
   *
   * @param names literal names
   * @param reverse {@code true} to test the answer target
   * @param dnsType record type or {@code null}
   * @param subdomains {@code true} to match parent domains
   * @return filter
   */
  public Filter searchDnsNames(Collection<String> names, boolean reverse, String dnsType, boolean subdomains) {
    List<Filter> res = new ArrayList<>(List.of(Filters.eq("recontype", "DNS_ANSWER")));
    res.add(Filters.oneOf(dnsPath(reverse, subdomains), List.copyOf(names)));
    addDnsType(res, dnsType);
    return Filters.and(res);
  }

  private static String dnsPath(boolean reverse, boolean subdomains) {
    if (subdomains) {
      return reverse ? "infos.domaintarget" : "infos.domain";
    }
    return reverse ? "targetval" : "value";
  }

  private static void addDnsType(List<Filter> res, String dnsType) {
    if (dnsType != null) {
      res.add(Filters.matches("source", "^" + Pattern.quote(dnsType.toUpperCase(Locale.ROOT)) + "-"));
    }
  }

  public Filter searchCert(String keyType) {
    Filter res = Filters.and(Filters.eq("recontype", "SSL_SERVER"), Filters.eq("source", "cert"));
    if (keyType == null) {
      return res;
    }
    return Filters.and(res, Filters.eq("infos.pubkeyalgo", keyType + "Encryption"));
  }

  private static Filter ja3Value(Ja3Criterion criterion) {
    String path = "md5".equals(criterion.key()) ? "value" : "infos." + criterion.key();
    return Filters.text(path, criterion.value());
  }

  public Filter searchJa3Client(StringMatch valueOrHash) {
    Filter res = Filters.and(Filters.eq("recontype", "SSL_CLIENT"), Filters.eq("source", "ja3"));
    return valueOrHash == null ? res : Filters.and(res, ja3Value(Ja3Criterion.of(valueOrHash)));
  }

  /**
   * JA3 server fingerprints, optionally restricted to the client that elicited them.
   *
   * @param valueOrHash server criterion or {@code null}
   * @param clientValueOrHash client criterion or {@code null}
   * @return filter
   */
  public Filter searchJa3Server(StringMatch valueOrHash, StringMatch clientValueOrHash) {
    List<Filter> res = new ArrayList<>(List.of(Filters.eq("recontype", "SSL_SERVER")));
    if (valueOrHash != null) {
      res.add(ja3Value(Ja3Criterion.of(valueOrHash)));
    }
    if (clientValueOrHash == null) {
      res.add(Filters.matches("source", JA3_SOURCE));
      return Filters.and(res);
    }
    Ja3Criterion client = Ja3Criterion.of(clientValueOrHash);
    if ("md5".equals(client.key())) {
      res.add(Filters.eq("source", "ja3-" + ((StringMatch.Exact) client.value()).value()));
      return Filters.and(res);
    }
    res.add(Filters.matches("source", JA3_SOURCE));
    res.add(Filters.text("infos.client." + client.key(), client.value()));
    return Filters.and(res);
  }

  public Filter searchSshKey(String keyType) {
    Filter res = Filters.and(Filters.eq("recontype", "SSH_SERVER_HOSTKEY"), Filters.eq("source", "SSHv2"));
    return keyType == null ? res : Filters.and(res, Filters.eq("infos.algo", "ssh-" + keyType));
  }

  /**
   * Certificates by subject, optionally by issuer too.
   *
   * @param subject subject criterion
   * @param issuer issuer criterion or {@code null}
   * @return filter
   */
  public Filter searchCertSubject(StringMatch subject, StringMatch issuer) {
    Filter res = Filters.and(searchCert(null), Filters.text("infos.subject_text", subject));
    return issuer == null ? res : Filters.and(res, Filters.text("infos.issuer_text", issuer));
  }

  public Filter searchCertIssuer(StringMatch issuer) {
    return Filters.and(searchCert(null), Filters.text("infos.issuer_text", issuer));
  }

  public Filter searchBasicAuth() {
    return Filters.and(searchHttpAuth(), Filters.matches("value", BASIC_AUTH));
  }

  public Filter searchHttpAuth() {
    return Filters.and(
        Filters.oneOf("recontype", HTTP_HEADER_TYPES),
        Filters.oneOf("source", AUTHORIZATION_SOURCES));
  }

  public Filter searchFtpAuth() {
    return Filters.oneOf("recontype", List.of("FTP_CLIENT", "FTP_SERVER"));
  }

  public Filter searchPopAuth() {
    return Filters.oneOf("recontype", List.of("POP_CLIENT", "POP_SERVER"));
  }

  public Filter searchTcpSrvBanner(StringMatch banner) {
    return Filters.and(Filters.eq("recontype", "TCP_SERVER_BANNER"), Filters.text("value", banner));
  }

  /**
   * Records first (or last) seen at most {@code delta} ago.
   *
   * @param delta age
   * @param neg {@code true} for older records
   * @param newRecords {@code true} to test {@code firstseen}, {@code false} for {@code lastseen}
   * @return filter
   */
  public Filter searchTimeAgo(Duration delta, boolean neg, boolean newRecords) {
    Number threshold = TimestampCodec.toEpoch(Instant.ofEpochMilli(clock.nowMillis()).minus(delta));
    String path = newRecords ? "firstseen" : "lastseen";
    return neg ? Filters.lt(path, threshold) : Filters.gte(path, threshold);
  }

  /**
   * Records first (or last) seen strictly after a timestamp.
   *
   * @param timestamp bound, any accepted timestamp form
   * @param neg {@code true} for records seen at or before it
   * @param newRecords {@code true} to test {@code firstseen}, {@code false} for {@code lastseen}
   * @return filter
   */
  public Filter searchNewer(Object timestamp, boolean neg, boolean newRecords) {
    Number bound = TimestampCodec.toEpoch(timestamp);
    String path = newRecords ? "firstseen" : "lastseen";
    return neg ? Filters.lte(path, bound) : Filters.gt(path, bound);
  }
}
