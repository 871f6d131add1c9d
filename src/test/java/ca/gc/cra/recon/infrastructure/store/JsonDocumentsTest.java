package ca.gc.cra.recon.infrastructure.store;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonDocumentsTest {
  private final JsonDocuments json = new JsonDocuments();

  @Test
  void parsesNumbersIntoExactTypes() {
    Map<String, Object> doc = json.parseObject(
        "{\"port\":80,\"big\":340282366920938463463374607431768211455,\"ts\":1.25,\"tags\":[\"a\",null]}");
    assertEquals(80L, doc.get("port"));
    assertEquals(new BigInteger("340282366920938463463374607431768211455"), doc.get("big"));
    assertEquals(new BigDecimal("1.25"), doc.get("ts"));
    assertEquals(Arrays.asList("a", null), doc.get("tags"));
  }

  @Test
  void rendersCompactJson() {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("_id", List.of("tcp", 80));
    doc.put("seen", Instant.ofEpochSecond(5));
    doc.put("count", 2L);
    assertEquals("{\"_id\":[\"tcp\",80],\"seen\":\"1970-01-01T00:00:05Z\",\"count\":2}", json.toJson(doc));
  }

  @Test
  void rejectsInvalidPayloads() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
  }
}
