package ca.gc.cra.recon.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

  @Test
  void defaultsProduceValidConfig() {
    EngineConfig config = EngineConfig.fromMap(EngineConfig.defaults());
    assertEquals(Path.of("recon-db"), config.dbPath());
    assertEquals("nmap", config.collection());
    assertEquals(10, config.topN());
    assertEquals("none", config.metricsExporter());
    assertNull(config.limit());
    assertNull(config.skip());
  }

  @Test
  void readsPagingDefaults() {
    EngineConfig config = EngineConfig.fromMap(Map.of("limit", "50", "skip", "10"));
    assertEquals(50, config.limit());
    assertEquals(10, config.skip());
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(Map.of("limit", "-1")));
  }

  @Test
  void normalizesCase() {
    EngineConfig config = EngineConfig.fromMap(Map.of("collection", "Passive", "metricsExporter", "OTLP"));
    assertEquals("passive", config.collection());
    assertEquals("otlp", config.metricsExporter());
  }

  @Test
  void rejectsOutOfRangeTopN() {
    assertThrows(IllegalArgumentException.class,
        () -> new EngineConfig(Path.of("db"), "nmap", EngineConfig.MAX_TOP_N + 1, "none"));
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(Map.of("topnbr", "ten")));
  }
}
