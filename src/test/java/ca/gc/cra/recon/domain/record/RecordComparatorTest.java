package ca.gc.cra.recon.domain.record;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class RecordComparatorTest {

  private static Map<String, Object> rec(String id, Object port, Object name) {
    Map<String, Object> record = new HashMap<>();
    record.put("_id", id);
    if (port != null) {
      record.put("port", port);
    }
    record.put("infos", name == null ? Map.of() : Map.of("name", name));
    return record;
  }

  private static List<Object> ids(List<Map<String, Object>> records) {
    return records.stream().map(r -> r.get("_id")).collect(Collectors.toList());
  }

  @Test
  void missingKeysSortFirstAscendingAndLastDescending() {
    List<Map<String, Object>> records = new ArrayList<>(List.of(
        rec("a", 443, null), rec("b", null, null), rec("c", 22L, null)));
    records.sort(new RecordComparator(List.of(SortKey.asc("port"))));
    assertEquals(List.of("b", "c", "a"), ids(records));
    records.sort(new RecordComparator(List.of(SortKey.desc("port"))));
    assertEquals(List.of("a", "c", "b"), ids(records));
  }

  @Test
  void tiesKeepInsertionOrder() {
    List<Map<String, Object>> records = new ArrayList<>(List.of(
        rec("first", 80, "x"), rec("second", 80, "x"), rec("third", 80, "a")));
    records.sort(new RecordComparator(List.of(SortKey.asc("port"), SortKey.desc("infos.name"))));
    assertEquals(List.of("first", "second", "third"), ids(records));
  }

  @Test
  void parsesDirections() {
    assertEquals(SortKey.desc("port"), SortKey.parse("port:-1"));
    assertEquals(SortKey.asc("infos.name"), SortKey.parse("infos.name"));
    assertEquals(SortKey.desc("port"), SortKey.parse("port:DESC"));
    assertThrows(IllegalArgumentException.class, () -> SortKey.parse("port:sideways"));
  }
}
