package ca.gc.cra.recon.domain.record;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordProjectorTest {

  @Test
  void keepsRequestedSubtreesAndIdentity() {
    Map<String, Object> host = Map.of(
        "_id", "h1",
        "addr", "10.0.0.1",
        "infos", Map.of("as_num", 15169, "country_code", "US"),
        "ports", List.of(
            Map.of("port", 80, "protocol", "tcp"),
            Map.of("port", 22, "protocol", "tcp", "service_name", "ssh")));

    Map<String, Object> projected = RecordProjector
        .of(FieldSchema.HOSTS, List.of("infos.as_num", "ports.port", "missing"))
        .project(host);

    assertEquals(Map.of(
        "_id", "h1",
        "infos", Map.of("as_num", 15169),
        "ports", List.of(Map.of("port", 80), Map.of("port", 22))), projected);
  }

  @Test
  void leavesSourceUntouched() {
    Map<String, Object> host = Records.deepCopy(Map.of("_id", 1, "infos", Map.of("as_num", 1)));
    Map<String, Object> projected = RecordProjector.of(FieldSchema.HOSTS, List.of("infos")).project(host);
    Records.child(projected, "infos").put("as_num", 2);
    assertEquals(1, Records.child(host, "infos").get("as_num"));
  }
}
