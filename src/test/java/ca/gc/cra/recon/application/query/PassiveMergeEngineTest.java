package ca.gc.cra.recon.application.query;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import ca.gc.cra.recon.infrastructure.store.InMemoryDocumentStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PassiveMergeEngineTest {

  @Test
  void foldKeepsWidestWindow() {
    Map<String, Object> doc = new HashMap<>(Map.of("count", 2L, "firstseen", 10L, "lastseen", 10L));
    PassiveMergeEngine.fold(3, 5L, 8L).accept(doc);
    assertEquals(5L, doc.get("count"));
    assertEquals(5L, doc.get("firstseen"));
    assertEquals(10L, doc.get("lastseen"));
  }

  @Test
  void countsOutcomesAndResolvesInfosOnCreation() {
    InMemoryDocumentStore store = new InMemoryDocumentStore(FieldSchema.PASSIVE);
    List<String> keys = new ArrayList<>();
    PassiveMergeEngine engine = new PassiveMergeEngine(() -> store, PassiveQueryService::toInternal,
        new MetricsPort() {
          @Override
          public void increment(String key) {
            keys.add(key);
          }

          @Override
          public void observe(String key, long value) {
            keys.add(key);
          }
        });
    int[] resolved = {0};
    InfoResolver resolver = record -> {
      resolved[0]++;
      return Map.of("infos", Map.of("domain", List.of("example.com")));
    };
    Map<String, Object> record = Map.of("recontype", "DNS_ANSWER", "value", "www.example.com", "count", 4);

    engine.insertOrUpdate(100, record, resolver, 150);
    engine.insertOrUpdate(200, record, resolver, null);

    assertEquals(List.of("recon.passive.merge.created", "recon.passive.merge.folded"), keys);
    assertEquals(1, resolved[0]);
    Map<String, Object> stored = store.search(Filter.TRUE).get(0);
    assertEquals(8L, stored.get("count"));
    assertEquals(100L, stored.get("firstseen"));
    assertEquals(200L, stored.get("lastseen"));
    assertEquals(Map.of("domain", List.of("example.com")), stored.get("infos"));
  }
}
