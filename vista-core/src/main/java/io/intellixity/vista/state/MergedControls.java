package io.intellixity.vista.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of merging a view's controls with a user's overrides.
 *
 * @param effective controls by display order, ties in definition order; orphans included
 * @param source normalized persisted form: control id -> user keys
 * @param forceOneVisible true when no control was visible and one was switched on
 */
public record MergedControls(
    List<EffectiveControl> effective,
    Map<String, Map<String, Object>> source,
    int originCount,
    int sourceCount,
    boolean forceOneVisible,
    List<String> warnings
) {
  public MergedControls {
    effective = List.copyOf(effective);
    source = source == null ? Map.of() : source;
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public List<EffectiveControl> visible() {
    List<EffectiveControl> out = new ArrayList<>();
    for (EffectiveControl c : effective) if (c.visible()) out.add(c);
    return out;
  }

  public EffectiveControl byId(String id) {
    if (id == null) return null;
    for (EffectiveControl c : effective) if (c.id().equals(id)) return c;
    return null;
  }

  public List<Map<String, Object>> effectiveWire() {
    List<Map<String, Object>> out = new ArrayList<>(effective.size());
    for (EffectiveControl c : effective) out.add(c.toWire());
    return out;
  }

  public Map<String, Object> meta() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("originCount", originCount);
    out.put("sourceCount", sourceCount);
    out.put("effectiveCount", effective.size());
    out.put("forceOneVisible", forceOneVisible);
    return out;
  }
}
