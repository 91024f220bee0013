package io.intellixity.vista.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes a raw table state document. Never throws: every malformed part falls back to its default and
 * leaves a warning.
 */
public final class TableStateSanitizer {
  private TableStateSanitizer() {}

  public static Sanitized<TableState> sanitize(Object raw) {
    List<String> warnings = new ArrayList<>();
    if (raw == null) return new Sanitized<>(TableState.DEFAULT, warnings, false);
    if (!(raw instanceof Map<?, ?> src)) {
      warnings.add("table state is not an object; using defaults");
      return new Sanitized<>(TableState.DEFAULT, warnings, false);
    }
    SortField sort = sort(src.get("sort"), warnings);
    Map<String, String> filters = filters(src.get("filters"), warnings);
    GroupSpec group = group(src.get("group"), warnings);
    return new Sanitized<>(new TableState(sort, filters, group), warnings, true);
  }

  private static SortField sort(Object raw, List<String> warnings) {
    if (raw == null) return SortField.NONE;
    if (!(raw instanceof Map<?, ?> m)) {
      warnings.add("sort is not an object; ignored");
      return SortField.NONE;
    }
    String controlId = null;
    Object cg = m.get("control_guid");
    if (cg instanceof String s) controlId = s;
    else if (cg != null) warnings.add("sort.control_guid is not a string; ignored");

    SortDirection direction = SortDirection.fromWire(m.get("direction"));
    if (direction == null) {
      warnings.add("sort.direction must be asc, desc or null; ignored");
      direction = SortDirection.NONE;
    }
    return new SortField(controlId, direction);
  }

  private static Map<String, String> filters(Object raw, List<String> warnings) {
    if (raw == null) return Map.of();
    if (!(raw instanceof Map<?, ?> m)) {
      warnings.add("filters is not an object; ignored");
      return Map.of();
    }
    Map<String, String> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      if (!(e.getKey() instanceof String key)) continue;
      Object v = e.getValue();
      if (v == null) continue;
      if (v instanceof Map<?, ?> || v instanceof List<?>) {
        warnings.add("filter '" + key + "' is not a scalar; ignored");
        continue;
      }
      String needle = String.valueOf(v).trim();
      if (!needle.isEmpty()) out.put(key, needle);
    }
    return out;
  }

  private static GroupSpec group(Object raw, List<String> warnings) {
    if (raw == null) return GroupSpec.DISABLED;
    if (!(raw instanceof Map<?, ?> m)) {
      warnings.add("group is not an object; ignored");
      return GroupSpec.DISABLED;
    }
    boolean enabled = false;
    Object en = m.get("enabled");
    if (en instanceof Boolean b) enabled = b;
    else if (en != null) warnings.add("group.enabled is not a boolean; ignored");

    return new GroupSpec(enabled, optionalString(m.get("by"), "group.by", warnings),
        optionalString(m.get("sum_control_guid"), "group.sum_control_guid", warnings));
  }

  private static String optionalString(Object raw, String name, List<String> warnings) {
    if (raw == null || raw instanceof String) return (String) raw;
    warnings.add(name + " is not a string; ignored");
    return null;
  }
}
