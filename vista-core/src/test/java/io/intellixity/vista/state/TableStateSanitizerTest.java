package io.intellixity.vista.state;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TableStateSanitizerTest {

  @Test
  void missingSourceUsesDefaults() {
    Sanitized<TableState> s = TableStateSanitizer.sanitize(null);
    assertEquals(TableState.DEFAULT, s.value());
    assertFalse(s.sourceOk());
    assertTrue(s.warnings().isEmpty());
  }

  @Test
  void nonObjectSourceUsesDefaultsWithWarning() {
    Sanitized<TableState> s = TableStateSanitizer.sanitize("[]");
    assertEquals(TableState.DEFAULT, s.value());
    assertFalse(s.sourceOk());
    assertEquals(1, s.warnings().size());
  }

  @Test
  void keepsValidParts() {
    Map<String, Object> raw = Map.of(
        "sort", Map.of("control_guid", "c1", "direction", "desc"),
        "filters", Map.of("c1", "  ap ", "c2", "   ", "c3", 42),
        "group", Map.of("enabled", true, "by", "c2", "sum_control_guid", "c3"));
    Sanitized<TableState> s = TableStateSanitizer.sanitize(raw);

    assertTrue(s.sourceOk());
    assertEquals(SortField.desc("c1"), s.value().sort());
    assertEquals(Map.of("c1", "ap", "c3", "42"), s.value().filters());
    assertEquals(new GroupSpec(true, "c2", "c3"), s.value().group());
    assertTrue(s.warnings().isEmpty());
  }

  @Test
  void malformedPartsFallBackIndividually() {
    Map<String, Object> sort = new HashMap<>();
    sort.put("control_guid", 7);
    sort.put("direction", "sideways");
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("sort", sort);
    raw.put("filters", List.of("x"));
    raw.put("group", Map.of("enabled", "yes", "by", "c1"));

    Sanitized<TableState> s = TableStateSanitizer.sanitize(raw);
    assertEquals(SortField.NONE, s.value().sort());
    assertTrue(s.value().filters().isEmpty());
    assertEquals(new GroupSpec(false, "c1", null), s.value().group());
    assertEquals(4, s.warnings().size());
  }

  @Test
  void sourceFormIsStable() {
    Map<String, Object> src = TableState.DEFAULT.toSource();
    Map<String, Object> sort = new LinkedHashMap<>();
    sort.put("control_guid", null);
    sort.put("direction", null);
    Map<String, Object> group = new LinkedHashMap<>();
    group.put("enabled", false);
    group.put("by", null);
    group.put("sum_control_guid", null);
    assertEquals(sort, src.get("sort"));
    assertEquals(Map.of(), src.get("filters"));
    assertEquals(group, src.get("group"));

    assertEquals(TableState.DEFAULT, TableStateSanitizer.sanitize(src).value());
  }

  @Test
  void stateKeyIsLowerCasedWithDefaultEditType() {
    assertEquals("v1::sys_persons::view", new ViewStateKey("V1", "SYS_Persons", null).serialize());
    assertEquals("v1::t::edit", new ViewStateKey("v1", "t", " Edit ").serialize());
  }
}
