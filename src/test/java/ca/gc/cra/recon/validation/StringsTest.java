package ca.gc.cra.recon.validation;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("hosts", Strings.requireNonBlank("collection", "  hosts "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("collection", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("collection", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("collection", null));
  }

  @Test
  void requireIdentifierRestrictsCharacters() {
    assertEquals("scan-01.v2", Strings.requireIdentifier("id", "scan-01.v2"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("id", "scan 01"));
  }

  @Test
  void requireOneOfLowerCases() {
    assertEquals("view", Strings.requireOneOf("collection", "VIEW", Set.of("nmap", "view")));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireOneOf("collection", "mongo", Set.of("nmap")));
    assertTrue(ex.getMessage().startsWith("collection must be one of"), ex.getMessage());
  }
}
