package ca.gc.cra.recon.domain.path;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {

  @Test
  void numbersCompareAcrossBoxedTypes() {
    assertTrue(Values.equal(1, 1L));
    assertTrue(Values.equal(new BigDecimal("2.0"), 2));
    assertTrue(Values.equal(List.of(1, Map.of("a", 2)), List.of(1L, Map.of("a", 2L))));
    assertFalse(Values.equal(1, "1"));
  }

  @Test
  void nullSortsFirstAndKindsAreOrdered() {
    assertTrue(Values.compare(null, 0) < 0);
    assertTrue(Values.compare(5, "a") < 0);
    assertTrue(Values.compare("z", true) < 0);
    assertTrue(Values.compare(false, List.of()) < 0);
    assertTrue(Values.compare(List.of(1), List.of(1, 0)) < 0);
  }

  @Test
  void comparableOnlyWithinOneKind() {
    assertTrue(Values.comparable(1, 2.5d));
    assertFalse(Values.comparable(1, "2"));
    assertFalse(Values.comparable(null, 1));
  }

  @Test
  void normalizeUnifiesIntegralNumbers() {
    assertEquals(15169L, Values.normalize(15169));
    assertEquals(15169L, Values.normalize(new BigDecimal("15169.00")));
    assertEquals(List.of(1L, 2L), Values.normalize(List.of(1, 2)));
  }
}
