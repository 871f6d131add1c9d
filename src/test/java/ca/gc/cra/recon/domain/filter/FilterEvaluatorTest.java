package ca.gc.cra.recon.domain.filter;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FilterEvaluatorTest {
  private final FilterEvaluator evaluator = new FilterEvaluator(FieldSchema.HOSTS);

  private static Map<String, Object> host() {
    return Map.of(
        "addr", "10.0.0.1",
        "categories", List.of("lab", "dmz"),
        "infos", Map.of("as_num", 15169, "as_name", "GOOGLE"),
        "ports", List.of(
            Map.of("port", 80, "protocol", "tcp", "state_state", "open"),
            Map.of("port", 22, "protocol", "tcp", "state_state", "closed")));
  }

  @Test
  void leavesMatchAnyFlattenedValue() {
    assertTrue(evaluator.test(Filters.eq("ports.port", 22L), host()));
    assertTrue(evaluator.test(Filters.eq("categories", "dmz"), host()));
    assertFalse(evaluator.test(Filters.eq("ports.port", 443), host()));
    assertTrue(evaluator.test(Filters.gt("infos.as_num", 15000), host()));
    assertFalse(evaluator.test(Filters.lt("infos.as_num", "z"), host()));
  }

  @Test
  void elementConditionsBindToOneElement() {
    Filter openSsh = Filters.any("ports", Filters.and(Filters.eq("port", 22), Filters.eq("state_state", "open")));
    Filter openHttp = Filters.any("ports", Filters.and(Filters.eq("port", 80), Filters.eq("state_state", "open")));
    assertFalse(evaluator.test(openSsh, host()));
    assertTrue(evaluator.test(openHttp, host()));
    assertFalse(evaluator.test(Filters.all("ports", Filters.eq("state_state", "open")), host()));
    assertTrue(evaluator.test(Filters.all("ports", Filters.eq("protocol", "tcp")), host()));
    assertTrue(evaluator.test(Filters.all("ports", Filters.eq("protocol", "udp")), Map.of("ports", List.of())));
  }

  @Test
  void existsChecksKeyPresence() {
    assertTrue(evaluator.test(Filters.exists("infos.as_name"), host()));
    assertFalse(evaluator.test(Filters.exists("infos.country_code"), host()));
    assertTrue(evaluator.test(Filters.exists(FieldSchema.HOSTS, "ports.state_state"), host()));
    assertFalse(evaluator.test(Filters.exists(FieldSchema.HOSTS, "ports.scripts.id"), host()));
  }

  @Test
  void regexSearchesAnywhereInText() {
    assertTrue(evaluator.test(Filters.matches("infos.as_name", "OOG"), host()));
    assertTrue(evaluator.test(Filters.text("infos.as_name", StringMatch.parse("/^goo/i")), host()));
    assertFalse(evaluator.test(Filters.matches("infos.as_num", "151"), host()));
  }

  @Test
  void combinatorsFoldConstants() {
    Filter leaf = Filters.eq("addr", "10.0.0.1");
    assertSame(Filter.TRUE, Filters.and());
    assertSame(Filter.FALSE, Filters.or());
    assertSame(leaf, Filters.and(Filter.TRUE, leaf));
    assertSame(Filter.FALSE, Filters.and(leaf, Filter.FALSE));
    assertSame(leaf, Filters.not(Filters.not(leaf)));
    assertTrue(evaluator.test(Filters.or(Filters.eq("addr", "x"), leaf), host()));
    assertFalse(evaluator.test(Filters.not(leaf), host()));
  }

  @Test
  void unknownComparisonOperatorIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Filters.compare("ports.port", "=~", 1));
  }
}
