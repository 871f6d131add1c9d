package ca.gc.cra.recon.application.query;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.application.topvalues.TopValue;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.StringMatch;
import ca.gc.cra.recon.domain.record.DuplicateKeyException;
import ca.gc.cra.recon.domain.record.SortKey;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import ca.gc.cra.recon.infrastructure.store.InMemoryDocumentStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScanResultServiceTest {
  private InMemoryDocumentStore hosts;
  private InMemoryDocumentStore scans;
  private ScanResultService service;

  @BeforeEach
  void setUp() {
    hosts = new InMemoryDocumentStore(FieldSchema.HOSTS);
    scans = new InMemoryDocumentStore(FieldSchema.SCANS);
    service = new ScanResultService(() -> hosts, () -> scans, MetricsPort.NO_OP, ClockPort.SYSTEM);
  }

  private void storeSampleHosts() {
    service.storeHost(Map.of(
        "_id", "h1",
        "addr", "192.0.2.10",
        "scanid", "s1",
        "starttime", "2020-01-01T00:00:00Z",
        "infos", Map.of("as_num", 15169, "as_name", "GOOGLE"),
        "ports", List.of(
            Map.of("protocol", "tcp", "port", 80, "state_state", "open", "service_name", "http"),
            Map.of("protocol", "tcp", "port", 22, "state_state", "closed"))));
    service.storeHost(Map.of(
        "_id", "h2",
        "addr", "192.0.2.77",
        "scanid", List.of("s1", "s2"),
        "infos", Map.of("as_num", 8075),
        "ports", List.of(Map.of("protocol", "tcp", "port", 443, "state_state", "open"))));
    service.storeHost(Map.of(
        "_id", "h3",
        "addr", "198.51.100.5",
        "scanid", "s2",
        "infos", Map.of("as_num", 15169)));
  }

  private static Set<Object> ids(List<Map<String, Object>> records) {
    return records.stream().map(r -> r.get("_id")).collect(Collectors.toSet());
  }

  @Test
  void findsHostsByPortState() {
    storeSampleHosts();

    assertEquals(Set.of("h1"), ids(service.get(service.searchPort(80))));
    assertTrue(service.get(service.searchPort(80, "tcp", "closed", false)).isEmpty());
    assertEquals(Set.of("h1"), ids(service.get(service.searchPort(22, "tcp", "closed", false))));
    assertEquals(Set.of("h2", "h3"), ids(service.get(service.searchPort(80, "tcp", "open", true))));
  }

  @Test
  void storedHostsComeBackInExternalForm() {
    storeSampleHosts();

    Map<String, Object> host = service.getOne(service.searchHost("192.0.2.10", false),
        QueryOptions.DEFAULT);
    assertEquals("192.0.2.10", host.get("addr"));
    assertEquals(Instant.parse("2020-01-01T00:00:00Z"), host.get("starttime"));
    assertEquals(List.of("s1"), host.get("scanid"));
  }

  @Test
  void hostWithoutIdentityGetsOne() {
    Object id = service.storeHost(Map.of("addr", "10.0.0.1"));
    assertNotNull(id);
    assertEquals(1, service.count(null));
  }

  @Test
  void distinctAsNumbersAreNormalized() {
    storeSampleHosts();
    assertEquals(List.of(15169L, 8075L), List.copyOf(service.distinct("infos.as_num")));
  }

  @Test
  void filtersByNetworkAndAsName() {
    storeSampleHosts();
    assertEquals(Set.of("h1", "h2"), ids(service.get(service.searchNet("192.0.2.0/24", false))));
    assertEquals(Set.of("h3"), ids(service.get(service.searchNet("192.0.2.0/24", true))));
    assertEquals(Set.of("h1"), ids(service.get(service.searchAsName(StringMatch.parse("/^goo/i"), false))));
    assertEquals(2, service.count(service.searchAsNum(15169, false)));
  }

  @Test
  void sortsAndPages() {
    storeSampleHosts();
    QueryOptions options = QueryOptions.DEFAULT.withSort(List.of(SortKey.desc("addr"))).withLimit(2);
    List<Map<String, Object>> page = service.get(Filter.TRUE, options);
    assertEquals(List.of("h3", "h2"), page.stream().map(r -> r.get("_id")).collect(Collectors.toList()));
    assertEquals(List.of("h1"), service.get(Filter.TRUE, options.withSkip(2))
        .stream().map(r -> r.get("_id")).collect(Collectors.toList()));
  }

  @Test
  void largestLimitAfterSkipReturnsRemainder() {
    storeSampleHosts();
    QueryOptions options = QueryOptions.DEFAULT.withSort(List.of(SortKey.asc("addr")))
        .withLimit(Integer.MAX_VALUE).withSkip(1);
    assertEquals(List.of("h2", "h3"), service.get(Filter.TRUE, options)
        .stream().map(r -> r.get("_id")).collect(Collectors.toList()));
    assertTrue(service.get(Filter.TRUE, options.withSkip(Integer.MAX_VALUE)).isEmpty());
  }

  @Test
  void topValuesOfPseudoFields() {
    storeSampleHosts();

    List<TopValue> open = service.topValues("port:open", null, 10);
    assertEquals(2, open.size());
    assertEquals(List.of("tcp", 80), open.get(0).value());
    assertEquals(List.of("tcp", 443), open.get(1).value());

    List<TopValue> nets = service.topValues("net", null, 10);
    assertEquals(new TopValue("192.0.2.0/24", 2), nets.get(0));
    assertEquals(new TopValue("198.51.100.0/24", 1), nets.get(1));

    List<TopValue> asNums = service.topValues("asnum", null, 1);
    assertEquals(1, asNums.size());
    assertEquals(2, asNums.get(0).count());
  }

  @Test
  void rejectsUnknownPseudoFields() {
    assertThrows(IllegalArgumentException.class, () -> service.topValues("no:such", null, 10));
    assertThrows(IllegalArgumentException.class, () -> service.topValues("net:abc", null, 10));
    assertThrows(IllegalArgumentException.class, () -> service.topValues("net:33", null, 10));
  }

  @Test
  void duplicateScanLeavesOriginalIntact() {
    service.storeScanDoc(Map.of("_id", "s1", "args", "nmap -sS"));

    assertThrows(DuplicateKeyException.class,
        () -> service.storeScanDoc(Map.of("_id", "s1", "args", "nmap -sU")));
    assertEquals("nmap -sS", service.getScan("s1").get("args"));
    assertTrue(service.isScanPresent("s1"));
    assertNull(service.getScan("missing"));
  }

  @Test
  void removingHostsDropsUnreferencedScans() {
    storeSampleHosts();
    service.storeScanDoc(Map.of("_id", "s1"));
    service.storeScanDoc(Map.of("_id", "s2"));

    service.remove("h1");
    assertTrue(service.isScanPresent("s1"));

    service.remove(service.getOne(service.searchObjectId("h2", false), QueryOptions.DEFAULT));
    assertFalse(service.isScanPresent("s1"));
    assertTrue(service.isScanPresent("s2"));
    assertEquals(1, service.count(null));
  }

  @Test
  void initEmptiesBothCollections() {
    storeSampleHosts();
    service.storeScanDoc(Map.of("_id", "s1"));
    service.init();
    assertEquals(0, hosts.size());
    assertEquals(0, scans.size());
  }
}
