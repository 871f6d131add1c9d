package ca.gc.cra.recon.infrastructure.store;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.record.DuplicateKeyException;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryDocumentStoreTest {
  private final InMemoryDocumentStore store = new InMemoryDocumentStore(FieldSchema.PASSIVE);

  @Test
  void insertAllocatesIdsAndRejectsDuplicates() {
    Object first = store.insert(Map.of("value", "a"));
    Object second = store.insert(Map.of("value", "b"));
    assertNotEquals(first, second);

    store.insert(Map.of("_id", "x", "value", "c"));
    DuplicateKeyException ex = assertThrows(DuplicateKeyException.class,
        () -> store.insert(Map.of("_id", "x", "value", "d")));
    assertEquals("x", ex.id());
    assertEquals(1, store.count(Filters.eq("value", "c")));
    assertEquals(0, store.count(Filters.eq("value", "d")));
  }

  @Test
  void searchReturnsCopies() {
    store.insert(new HashMap<>(Map.of("_id", 1, "value", "a")));
    Map<String, Object> found = store.search(Filter.TRUE).get(0);
    found.put("value", "changed");
    assertEquals("a", store.search(Filter.TRUE).get(0).get("value"));
  }

  @Test
  void updateAndUpsert() {
    store.insert(Map.of("_id", 1, "value", "a", "count", 1));
    assertEquals(1, store.update(doc -> doc.put("count", 5), List.of(1L)));
    assertEquals(5, store.search(Filters.eq("_id", 1)).get(0).get("count"));

    assertEquals(List.of(1L), store.upsert(Map.of("value", "a", "sensor", "s"), Filters.eq("value", "a")));
    assertEquals("s", store.search(Filters.eq("_id", 1)).get(0).get("sensor"));
    assertEquals(1, store.size());

    store.upsert(Map.of("value", "z"), Filters.eq("value", "z"));
    assertEquals(2, store.size());
  }

  @Test
  void removeAndPurge() {
    store.insert(Map.of("value", "a"));
    store.insert(Map.of("value", "b"));
    store.insert(Map.of("value", "c"));
    assertEquals(1, store.remove(Filters.eq("value", "a")));
    Object id = store.search(Filters.eq("value", "b")).get(0).get("_id");
    assertEquals(1, store.removeById(List.of(id, "missing")));
    store.purge();
    assertEquals(0, store.size());
  }

  @Test
  void closedStoreRefusesWork() {
    store.close();
    assertThrows(IllegalStateException.class, () -> store.search(Filter.TRUE));
  }
}
