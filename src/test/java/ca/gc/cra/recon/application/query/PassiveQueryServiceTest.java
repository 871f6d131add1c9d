package ca.gc.cra.recon.application.query;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.application.topvalues.TopValue;
import ca.gc.cra.recon.domain.filter.StringMatch;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import ca.gc.cra.recon.infrastructure.store.InMemoryDocumentStore;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PassiveQueryServiceTest {
  private InMemoryDocumentStore store;
  private PassiveQueryService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryDocumentStore(FieldSchema.PASSIVE);
    service = new PassiveQueryService(() -> store, MetricsPort.NO_OP, null);
  }

  private static Map<String, Object> banner(String addr, String sensor) {
    return Map.of("addr", addr, "sensor", sensor, "recontype", "OPEN_PORT", "port", 443,
        "source", "TCP", "value", "open");
  }

  @Test
  void repeatedSightingsFoldIntoOneRecord() {
    Map<String, Object> record = banner("192.0.2.1", "s1");

    assertEquals(PassiveMergeEngine.Outcome.CREATED, service.insertOrUpdate(10, record));
    assertEquals(PassiveMergeEngine.Outcome.FOLDED, service.insertOrUpdate(5, record));
    assertEquals(PassiveMergeEngine.Outcome.FOLDED, service.insertOrUpdate(20, record));

    assertEquals(1, store.size());
    Map<String, Object> merged = service.getOne(service.searchHost("192.0.2.1", false));
    assertEquals(3L, ((Number) merged.get("count")).longValue());
    assertEquals(Instant.ofEpochSecond(5), merged.get("firstseen"));
    assertEquals(Instant.ofEpochSecond(20), merged.get("lastseen"));
    assertEquals("192.0.2.1", merged.get("addr"));
  }

  @Test
  void differentObservationsStaySeparate() {
    service.insertOrUpdate(10, banner("192.0.2.1", "s1"));
    service.insertOrUpdate(10, banner("192.0.2.1", "s2"));
    assertEquals(2, service.count(null));
    assertEquals(1, service.count(service.searchSensor(StringMatch.exact("s2"), false)));
  }

  @Test
  void nullRecordIsSkipped() {
    assertEquals(PassiveMergeEngine.Outcome.SKIPPED, service.insertOrUpdate(10, null));
    assertEquals(0, store.size());
  }

  @Test
  void weightedTopValuesSumCounts() {
    Map<String, Object> busy = banner("192.0.2.1", "s1");
    service.insertOrUpdate(1, busy);
    service.insertOrUpdate(2, busy);
    service.insertOrUpdate(3, busy);
    service.insertOrUpdate(1, banner("192.0.2.2", "s2"));
    service.insertOrUpdate(1, banner("192.0.2.3", "s2"));

    List<TopValue> distinct = service.topValues("sensor", null, true, 10, QueryOptions.DEFAULT);
    assertEquals(new TopValue("s2", 2), distinct.get(0));
    assertEquals(new TopValue("s1", 1), distinct.get(1));

    List<TopValue> weighted = service.topValues("sensor", null, false, 10, QueryOptions.DEFAULT);
    assertEquals(new TopValue("s1", 3), weighted.get(0));
    assertEquals(new TopValue("s2", 2), weighted.get(1));

    List<TopValue> nets = service.topValues("net:16", null, true, 10, QueryOptions.DEFAULT);
    assertEquals(List.of(new TopValue("192.0.0.0/16", 3)), nets);
  }

  @Test
  void certificatesAreStoredAsTextAndReturnedAsBytes() {
    byte[] der = "not really DER".getBytes(StandardCharsets.US_ASCII);
    service.insert(Map.of("addr", "192.0.2.9", "recontype", "SSL_SERVER", "source", "cert", "value", der), null);

    assertTrue(store.search(service.searchFieldExists("value")).get(0).get("value") instanceof String);
    assertArrayEquals(der, (byte[]) service.getOne(service.searchRecontype(StringMatch.exact("SSL_SERVER")))
        .get("value"));
  }

  @Test
  void rejectsUnsupportedSearches() {
    assertThrows(IllegalArgumentException.class, () -> service.searchPort(53, "udp", "open", false));
    assertThrows(IllegalArgumentException.class, () -> service.searchPort(22, "tcp", "closed", false));
    assertThrows(IllegalArgumentException.class, () -> service.searchUserAgent(StringMatch.exact("curl"), true));
    assertThrows(IllegalArgumentException.class,
        () -> service.insertOrUpdate(1, Map.of("value", "x", "count", "many")));
  }

  @Test
  void removesByIdentityOrFilter() {
    service.insertOrUpdate(1, banner("192.0.2.1", "s1"));
    service.insertOrUpdate(1, banner("192.0.2.2", "s2"));
    assertEquals(1, service.remove(service.searchSensor(StringMatch.exact("s1"), false)));
    Object id = service.getOne(null).get("_id");
    assertEquals(1, service.remove(id));
    assertEquals(0, service.count(null));
  }
}
