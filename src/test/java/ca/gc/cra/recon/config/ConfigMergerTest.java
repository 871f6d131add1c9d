package ca.gc.cra.recon.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliWinsOverYamlOverDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "view",
        Optional.of(Map.of("db", "/yaml", "topnbr", "20")),
        Map.of("topnbr", "30"),
        EngineConfig.defaults(),
        warnings::add);

    assertEquals("/yaml", effective.get("db"));
    assertEquals("30", effective.get("topnbr"));
    assertEquals("view", effective.get("collection"));
    assertEquals("none", effective.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: topnbr"), warnings);
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "nmap", Optional.empty(), Map.of("topnbr", "0"), EngineConfig.defaults(), null));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "nmap", Optional.empty(), Map.of("limit", "-1"), EngineConfig.defaults(), null));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "nmap", Optional.of(Map.of("metricsExporter", "prometheus")), Map.of(), EngineConfig.defaults(), null));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "mongo", Optional.empty(), Map.of(), EngineConfig.defaults(), null));
  }
}
