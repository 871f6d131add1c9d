package ca.gc.cra.recon.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir
  Path tempDir;

  @Test
  void collectionSectionOverridesCommon() throws Exception {
    Path yaml = tempDir.resolve("recon.yaml");
    Files.writeString(yaml, String.join("\n",
        "common:",
        "  db: /var/lib/recon",
        "  topnbr: 10",
        "passive:",
        "  topnbr: 25",
        "  query:",
        "    limit: 100",
        "nmap:",
        "  topnbr: 5"));

    Optional<Map<String, String>> loaded = YamlConfigLoader.load(yaml, "PASSIVE");

    assertTrue(loaded.isPresent());
    assertEquals(Map.of("db", "/var/lib/recon", "topnbr", "25", "limit", "100"), loaded.get());
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "nmap").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");
    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "nmap"));
  }

  @Test
  void rejectsArraysAndScalarsAtRoot() throws Exception {
    Path arrays = Files.writeString(tempDir.resolve("arrays.yaml"), "common:\n  db: [a, b]\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "nmap"));

    Path scalar = Files.writeString(tempDir.resolve("scalar.yaml"), "just text\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "nmap"));

    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "common: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "nmap"));
  }

  @Test
  void groupedKeysMapToEngineSettings() throws Exception {
    Path yaml = tempDir.resolve("grouped.yaml");
    Files.writeString(yaml, String.join("\n",
        "common:",
        "  store:",
        "    path: data/recon",
        "  metrics:",
        "    exporter: otlp",
        "view:",
        "  query:",
        "    skip: 5"));

    Map<String, String> loaded = YamlConfigLoader.load(yaml, "view").orElseThrow();

    assertEquals(tempDir.toAbsolutePath().resolve("data/recon").normalize().toString(), loaded.get("db"));
    assertEquals("otlp", loaded.get("metricsExporter"));
    assertEquals("5", loaded.get("skip"));
  }

  @Test
  void rejectsUnknownKeysAndSections() throws Exception {
    Path key = Files.writeString(tempDir.resolve("key.yaml"), "common:\n  iface: eth0\n");
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(key, "nmap"));
    assertTrue(ex.getMessage().contains("iface"));

    Path section = Files.writeString(tempDir.resolve("section.yaml"), "capture:\n  db: x\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(section, "nmap"));
  }
}
