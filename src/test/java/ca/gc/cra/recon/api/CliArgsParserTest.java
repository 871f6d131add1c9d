package ca.gc.cra.recon.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"net=10.0.0.0/8", "!port=22", "sort=addr:desc"});
    assertEquals("10.0.0.0/8", map.get("net"));
    assertEquals("22", map.get("!port"));
    assertEquals("addr:desc", map.get("sort"));
  }

  @Test
  void valueKeepsLaterEqualsSigns() {
    assertEquals("/a=b/", CliArgsParser.toMap(new String[] {"script=/a=b/"}).get("script"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9key=v"}));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"port=1", "port=2"}));
    assertEquals("argument given twice: port", ex.getMessage());
  }
}
