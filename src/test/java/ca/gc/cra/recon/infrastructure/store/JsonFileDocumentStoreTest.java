package ca.gc.cra.recon.infrastructure.store;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.domain.codec.AddressCodec;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileDocumentStoreTest {
  @TempDir
  Path tempDir;

  @Test
  void persistsAcrossReopen() {
    JsonFileDocumentStore store = new JsonFileDocumentStore(tempDir, FieldSchema.HOSTS);
    store.insert(Map.of("_id", "h1", "addr", AddressCodec.toInternal("192.0.2.1"),
        "ports", List.of(Map.of("port", 80, "protocol", "tcp"))));
    store.close();
    assertTrue(Files.isRegularFile(tempDir.resolve("hosts.json")));

    JsonFileDocumentStore reopened = new JsonFileDocumentStore(tempDir, FieldSchema.HOSTS);
    assertEquals(1, reopened.size());
    Map<String, Object> host = reopened.search(Filters.eq("_id", "h1")).get(0);
    assertEquals("192.0.2.1", AddressCodec.toText(host.get("addr")));
    assertEquals(1, reopened.count(Filters.any("ports", Filters.eq("port", 80))));
  }

  @Test
  void namedCollectionsUseTheirOwnFile() {
    new JsonFileDocumentStore(tempDir, "views", FieldSchema.HOSTS).insert(Map.of("addr", "x"));
    assertTrue(Files.isRegularFile(tempDir.resolve("views.json")));
    assertEquals(0, new JsonFileDocumentStore(tempDir, FieldSchema.HOSTS).size());
  }

  @Test
  void allocatedIdsContinueAfterReload() {
    JsonFileDocumentStore store = new JsonFileDocumentStore(tempDir, FieldSchema.PASSIVE);
    Object first = store.insert(Map.of("value", "a"));
    JsonFileDocumentStore reopened = new JsonFileDocumentStore(tempDir, FieldSchema.PASSIVE);
    Object second = reopened.insert(Map.of("value", "b"));
    assertNotEquals(first, second);
    assertEquals(2, reopened.count(Filter.TRUE));
  }

  @Test
  void rejectsMalformedFile() throws Exception {
    Files.writeString(tempDir.resolve("scans.json"), "{\"not\": \"an array\"}", StandardCharsets.UTF_8);
    assertThrows(UncheckedIOException.class, () -> new JsonFileDocumentStore(tempDir, FieldSchema.SCANS));
  }

  @Test
  void failedWriteLeavesCollectionUnchanged() throws Exception {
    JsonFileDocumentStore store = new JsonFileDocumentStore(tempDir, FieldSchema.HOSTS);
    store.insert(Map.of("_id", "h1", "addr", "a", "ports", List.of(Map.of("port", 80))));
    Path blocker = Files.createDirectory(tempDir.resolve("hosts.json.tmp"));
    Files.writeString(blocker.resolve("keep"), "x", StandardCharsets.UTF_8);

    assertThrows(UncheckedIOException.class, () -> store.insert(Map.of("_id", "h2")));
    assertThrows(UncheckedIOException.class, () -> store.removeById(List.of("h1")));
    assertThrows(UncheckedIOException.class,
        () -> store.update(doc -> doc.put("addr", "b"), List.of("h1")));
    assertThrows(UncheckedIOException.class, store::purge);
    assertEquals(1, store.size());
    Map<String, Object> host = store.search(Filter.TRUE).get(0);
    assertEquals("h1", host.get("_id"));
    assertEquals("a", host.get("addr"));

    Files.delete(blocker.resolve("keep"));
    Files.delete(blocker);
    store.insert(Map.of("_id", "h3"));
    JsonFileDocumentStore reopened = new JsonFileDocumentStore(tempDir, FieldSchema.HOSTS);
    Set<Object> ids = reopened.search(Filter.TRUE).stream().map(d -> d.get("_id")).collect(Collectors.toSet());
    assertEquals(Set.of("h1", "h3"), ids);
  }
}
