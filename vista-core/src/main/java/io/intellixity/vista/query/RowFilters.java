package io.intellixity.vista.query;

import io.intellixity.vista.model.Control;
import io.intellixity.vista.temporal.ProjectedRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Case-insensitive substring filters, AND-combined. Filters on unknown controls are skipped. */
public final class RowFilters {
  private RowFilters() {}

  public static List<ProjectedRow> apply(List<ProjectedRow> rows,
                                         Map<String, String> filters,
                                         Map<String, Control> controls) {
    if (filters == null || filters.isEmpty()) return rows;

    Map<Control, String> active = new LinkedHashMap<>();
    for (var f : filters.entrySet()) {
      Control c = controls.get(f.getKey());
      String needle = f.getValue() == null ? "" : f.getValue().trim();
      if (c == null || needle.isEmpty()) continue;
      active.put(c, needle.toLowerCase(Locale.ROOT));
    }
    if (active.isEmpty()) return rows;

    List<ProjectedRow> out = new ArrayList<>();
    for (ProjectedRow r : rows) {
      if (matchesAll(r, active)) out.add(r);
    }
    return out;
  }

  private static boolean matchesAll(ProjectedRow row, Map<Control, String> active) {
    for (var e : active.entrySet()) {
      Object raw = e.getKey().isBound() ? row.value(e.getKey().fieldKey()) : null;
      String hay = raw == null ? "" : String.valueOf(raw);
      if (!hay.toLowerCase(Locale.ROOT).contains(e.getValue())) return false;
    }
    return true;
  }
}
