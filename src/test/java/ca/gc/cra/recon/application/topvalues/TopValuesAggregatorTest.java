package ca.gc.cra.recon.application.topvalues;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.domain.path.Weighted;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class TopValuesAggregatorTest {
  private final TopValuesAggregator aggregator = new TopValuesAggregator();

  private static Stream<Weighted> ones(Object... values) {
    return Stream.of(values).map(Weighted::one);
  }

  @Test
  void ranksByDescendingCountWithinBound() {
    List<TopValue> top = aggregator.rank(ones("a", "b", "b", "c", "c", "c", "d"), UnaryOperator.identity(), 2);
    assertEquals(List.of(new TopValue("c", 3), new TopValue("b", 2)), top);
  }

  @Test
  void tiesKeepFirstSeenOrder() {
    List<TopValue> top = aggregator.rank(ones("x", "y", "z", "y", "x"), UnaryOperator.identity(), null);
    assertEquals(List.of(new TopValue("x", 2), new TopValue("y", 2), new TopValue("z", 1)), top);
    for (int i = 1; i < top.size(); i++) {
      assertTrue(top.get(i - 1).count() >= top.get(i).count());
    }
  }

  @Test
  void equalNumbersShareOneBucket() {
    List<TopValue> top = aggregator.rank(Stream.of(new Weighted(80, 2), new Weighted(80L, 3)),
        UnaryOperator.identity(), 10);
    assertEquals(List.of(new TopValue(80, 5)), top);
  }

  @Test
  void outputTransformationAppliesToRankedValues() {
    List<TopValue> top = aggregator.rank(ones("a"), v -> "<" + v + ">", 10);
    assertEquals("<a>", top.get(0).value());
    assertEquals(Map.of("_id", "<a>", "count", 1L), top.get(0).toDocument());
  }

  @Test
  void rejectsNegativeBound() {
    assertThrows(IllegalArgumentException.class, () -> aggregator.rank(ones(), UnaryOperator.identity(), -1));
    assertTrue(aggregator.rank(ones("a"), UnaryOperator.identity(), 0).isEmpty());
  }
}
