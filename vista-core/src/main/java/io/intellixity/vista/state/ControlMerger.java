package io.intellixity.vista.state;

import io.intellixity.vista.model.Control;
import io.intellixity.vista.model.ViewDefinition;
import io.intellixity.vista.model.ViewDefinitionParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges a view's declared controls with a user's raw overrides.\n
 *
 * Rules:\n
 * - declared attributes come from the definition, user keys (show, display_order, width) from the override\n
 * - overrides for controls the view no longer declares are kept as hidden orphans\n
 * - at least one control is visible: if none is, the lowest display order is switched on\n
 */
public final class ControlMerger {
  private ControlMerger() {}

  public static MergedControls merge(ViewDefinition definition, Object rawOverrides) {
    List<String> warnings = new ArrayList<>();
    Map<String, ControlOverride> overrides = parseOverrides(rawOverrides, warnings);

    List<EffectiveControl> effective = new ArrayList<>();
    Set<String> declared = new HashSet<>();
    for (Control c : definition.controls()) {
      if (!declared.add(c.id())) continue;
      ControlOverride o = overrides.getOrDefault(c.id(), ControlOverride.NONE);
      effective.add(new EffectiveControl(
          c.id(),
          c,
          o.visible() != null ? o.visible() : c.defaultVisible(),
          o.displayOrder() != null ? o.displayOrder() : c.displayOrder(),
          o.width() != null ? o.width() : c.width(),
          false));
    }
    int declaredCount = effective.size();
    for (var e : overrides.entrySet()) {
      if (declared.contains(e.getKey())) continue;
      effective.add(EffectiveControl.orphan(e.getKey(), e.getValue().width()));
    }

    boolean forced = forceOneVisible(effective, declaredCount);

    Map<String, Map<String, Object>> source = new LinkedHashMap<>();
    for (EffectiveControl c : effective) {
      Map<String, Object> norm = c.orphan()
          ? overrides.get(c.id()).toSource()
          : c.asOverride().toSource();
      if (!norm.isEmpty()) source.put(c.id(), norm);
    }

    // List.sort is stable: ties keep definition order, orphans last.
    List<EffectiveControl> ordered = new ArrayList<>(effective);
    ordered.sort(Comparator.comparingInt(EffectiveControl::displayOrder));

    return new MergedControls(ordered, source, declaredCount, overrides.size(), forced, warnings);
  }

  private static boolean forceOneVisible(List<EffectiveControl> effective, int declaredCount) {
    if (effective.isEmpty()) return false;
    for (EffectiveControl c : effective) if (c.visible()) return false;

    // Declared controls win over orphans.
    int candidates = declaredCount > 0 ? declaredCount : effective.size();
    int best = 0;
    for (int i = 1; i < candidates; i++) {
      if (effective.get(i).displayOrder() < effective.get(best).displayOrder()) best = i;
    }
    effective.set(best, effective.get(best).withVisible(true));
    return true;
  }

  /** Parses raw overrides, dropping malformed values with a warning. */
  public static Map<String, ControlOverride> parseOverrides(Object raw, List<String> warnings) {
    Map<String, ControlOverride> out = new LinkedHashMap<>();
    if (raw == null) return out;
    if (!(raw instanceof Map<?, ?> m)) {
      warnings.add("controls source is not an object; ignored");
      return out;
    }
    for (var e : m.entrySet()) {
      if (e.getKey() == null) continue;
      String id = String.valueOf(e.getKey());
      if (!(e.getValue() instanceof Map<?, ?> entry)) {
        warnings.add("override for control '" + id + "' is not an object; ignored");
        continue;
      }
      out.put(id, new ControlOverride(
          visibleValue(entry.get(ControlOverride.SHOW), id, warnings),
          integerValue(entry, ControlOverride.DISPLAY_ORDER, id, warnings),
          integerValue(entry, ControlOverride.WIDTH, id, warnings)));
    }
    return out;
  }

  private static Boolean visibleValue(Object raw, String id, List<String> warnings) {
    if (raw == null) return null;
    if (raw instanceof Boolean b) return b;
    if (raw instanceof Number n && (n.intValue() == 0 || n.intValue() == 1)) return n.intValue() == 1;
    if (raw instanceof String s) {
      String v = s.trim().toLowerCase(Locale.ROOT);
      if (v.equals("true") || v.equals("false")) return Boolean.parseBoolean(v);
    }
    warnings.add("override '" + id + "." + ControlOverride.SHOW + "' is not a boolean; ignored");
    return null;
  }

  private static Integer integerValue(Map<?, ?> entry, String key, String id, List<String> warnings) {
    Object raw = entry.get(key);
    if (raw == null) return null;
    Integer v = ViewDefinitionParser.integer(raw);
    if (v == null || (v < 0 && ControlOverride.WIDTH.equals(key))) {
      warnings.add("override '" + id + "." + key + "' is not a valid integer; ignored");
      return null;
    }
    return v;
  }
}
