package io.intellixity.vista.engine;

import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.model.ViewDefinition;
import io.intellixity.vista.model.ViewDefinitionParser;
import io.intellixity.vista.state.SortDirection;
import io.intellixity.vista.state.SortField;
import io.intellixity.vista.state.TableState;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ViewStateResolverTest {

  private static ViewDefinition view(Map<String, Object> root) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("ROOT", root);
    doc.put("S", Map.of("c-amount", Map.of("gruppe", "P", "feld", "AMOUNT")));
    return ViewDefinitionParser.parse("v", "v", doc);
  }

  @Test
  void defaultSortFillsInWhenNoSortIsActive() {
    ViewDefinition def = view(Map.of("TABLE", "t", "DEFAULT_SORT_COLUMN", "amount", "DEFAULT_SORT_REVERSE", true));
    TableState out = ViewStateResolver.applyViewPolicy(def, TableState.DEFAULT);
    assertEquals(new SortField("c-amount", SortDirection.DESC), out.sort());

    TableState user = TableState.DEFAULT.withSort(SortField.asc("other"));
    assertEquals(SortField.asc("other"), ViewStateResolver.applyViewPolicy(def, user).sort());
  }

  @Test
  void defaultSortStillAppliesWhenUserSortIsDisallowed() {
    ViewDefinition def = view(Map.of("TABLE", "t", "ALLOW_SORT", false, "DEFAULT_SORT_COLUMN", "c-amount"));
    TableState out = ViewStateResolver.applyViewPolicy(def, TableState.DEFAULT.withSort(SortField.desc("x")));
    assertEquals(SortField.asc("c-amount"), out.sort());
  }

  @Test
  void unknownDefaultSortColumnIsIgnored() {
    ViewDefinition def = view(Map.of("TABLE", "t", "DEFAULT_SORT_COLUMN", "missing"));
    assertFalse(ViewStateResolver.applyViewPolicy(def, TableState.DEFAULT).sort().isActive());
  }

  @Test
  void tableOverrides() {
    TableOverridePolicy policy = new TableOverridePolicy("sys_");
    assertEquals("t", policy.resolve(view(Map.of("TABLE", "t")), null));
    assertEquals("t", policy.resolve(view(Map.of("TABLE", "t")), "T"));
    assertEquals("other", policy.resolve(view(Map.of("TABLE", "t", "ALLOW_TABLE_OVERRIDE", true)), "other"));
    assertEquals("sys_b", policy.resolve(view(Map.of("TABLE", "sys_a")), "sys_b"));
    assertThrows(InvalidViewInputException.class, () -> policy.resolve(view(Map.of("TABLE", "sys_a")), "plain"));
    assertThrows(InvalidViewInputException.class, () -> policy.resolve(view(Map.of()), null));
    assertThrows(InvalidViewInputException.class, () -> policy.resolve(view(Map.of("TABLE", "bad-name")), null));
  }

  @Test
  void nonObjectOverridesAreRejected() {
    assertThrows(InvalidViewInputException.class, () -> ViewStateResolver.requireObject("x", "controlsSource"));
    ViewStateResolver.requireObject(null, "controlsSource");
    ViewStateResolver.requireObject(Map.of(), "controlsSource");
  }
}
