package ca.gc.cra.recon.application.query;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.application.port.HostMergePort;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import ca.gc.cra.recon.infrastructure.store.InMemoryDocumentStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ViewServiceTest {

  @Test
  void storesHostsTheMergerDeclines() {
    InMemoryDocumentStore store = new InMemoryDocumentStore(FieldSchema.HOSTS);
    List<Object> offered = new ArrayList<>();
    HostMergePort merger = host -> {
      offered.add(host.get("addr"));
      return "10.0.0.2".equals(host.get("addr"));
    };
    ViewService views = new ViewService(() -> store, merger, null, null);

    views.storeOrMergeHost(Map.of("addr", "10.0.0.1"));
    views.storeOrMergeHost(Map.of("addr", "10.0.0.2"));

    assertEquals(List.of("10.0.0.1", "10.0.0.2"), offered);
    assertEquals(1, views.count(null));
    assertEquals("views", views.collection());
  }

  @Test
  void unparsableAddressIsKept() {
    InMemoryDocumentStore store = new InMemoryDocumentStore(FieldSchema.HOSTS);
    ViewService views = new ViewService(() -> store, HostMergePort.NEVER, null, null);
    views.storeOrMergeHost(Map.of("_id", 1, "addr", "not-an-address"));
    assertEquals("not-an-address", views.get(null).get(0).get("addr"));
  }
}
