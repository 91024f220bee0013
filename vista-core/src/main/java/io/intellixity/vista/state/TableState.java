package io.intellixity.vista.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-user sort, filter and group state of a view table.
 *
 * @param filters control id -> trimmed, non-empty substring needle
 */
public record TableState(SortField sort, Map<String, String> filters, GroupSpec group) {
  public static final TableState DEFAULT = new TableState(SortField.NONE, Map.of(), GroupSpec.DISABLED);

  public TableState {
    sort = sort == null ? SortField.NONE : sort;
    filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    group = group == null ? GroupSpec.DISABLED : group;
  }

  public TableState withSort(SortField sort) { return new TableState(sort, filters, group); }
  public TableState withFilters(Map<String, String> filters) { return new TableState(sort, filters, group); }
  public TableState withGroup(GroupSpec group) { return new TableState(sort, filters, group); }

  /** Persisted / wire form. Keys and nulls are always present so the shape is stable. */
  public Map<String, Object> toSource() {
    Map<String, Object> sortOut = new LinkedHashMap<>();
    sortOut.put("control_guid", sort.controlId());
    sortOut.put("direction", sort.direction().wire());

    Map<String, Object> groupOut = new LinkedHashMap<>();
    groupOut.put("enabled", group.enabled());
    groupOut.put("by", group.by());
    groupOut.put("sum_control_guid", group.sumBy());

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("sort", sortOut);
    out.put("filters", new LinkedHashMap<>(filters));
    out.put("group", groupOut);
    return out;
  }
}
