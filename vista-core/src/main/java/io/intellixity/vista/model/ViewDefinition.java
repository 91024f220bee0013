package io.intellixity.vista.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stored view: root table, view-level policy flags and the ordered list of declared controls.
 *
 * @param root the raw ROOT section, returned unchanged to clients
 */
public record ViewDefinition(
    String id,
    String name,
    String rootTable,
    String defaultSortColumn,
    boolean defaultSortReverse,
    boolean allowFilter,
    boolean allowSort,
    boolean allowTableOverride,
    List<Control> controls,
    Map<String, Object> root
) {
  public ViewDefinition {
    Objects.requireNonNull(id, "id");
    name = name == null ? "" : name;
    rootTable = rootTable == null ? "" : rootTable.trim();
    defaultSortColumn = defaultSortColumn == null || defaultSortColumn.isBlank() ? null : defaultSortColumn.trim();
    controls = controls == null ? List.of() : List.copyOf(controls);
    root = root == null ? Map.of() : root;
  }

  /** Controls by id, in definition order. */
  public Map<String, Control> controlsById() {
    Map<String, Control> out = new LinkedHashMap<>();
    for (Control c : controls) out.putIfAbsent(c.id(), c);
    return out;
  }

  public Control control(String id) {
    if (id == null) return null;
    for (Control c : controls) if (c.id().equals(id)) return c;
    return null;
  }
}
