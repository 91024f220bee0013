package io.intellixity.vista.model;

import io.intellixity.vista.error.InvalidViewInputException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses a stored view document into a {@link ViewDefinition}.\n
 *
 * Layout:\n
 * - ROOT: TABLE, ALLOW_FILTER, ALLOW_SORT, DEFAULT_SORT_COLUMN, DEFAULT_SORT_REVERSE, ALLOW_TABLE_OVERRIDE\n
 * - any other section: control id -> control document (gruppe, feld, label, type, show, display_order, width)\n
 */
public final class ViewDefinitionParser {
  public static final String ROOT_SECTION = "ROOT";

  private static final Set<String> CONTROL_KEYS =
      Set.of("gruppe", "feld", "label", "type", "control_type", "show", "display_order", "width");

  private ViewDefinitionParser() {}

  public static ViewDefinition parse(String id, String name, Map<String, ?> document) {
    if (id == null || id.isBlank()) throw new InvalidViewInputException("view id is required");
    Map<String, ?> doc = document == null ? Map.of() : document;

    Map<String, Object> root = new LinkedHashMap<>();
    List<Control> controls = new ArrayList<>();
    for (var section : doc.entrySet()) {
      String sectionName = section.getKey();
      if (sectionName == null || !(section.getValue() instanceof Map<?, ?> body)) continue;
      if (ROOT_SECTION.equalsIgnoreCase(sectionName)) {
        body.forEach((k, v) -> root.put(String.valueOf(k), v));
        continue;
      }
      for (var entry : body.entrySet()) {
        if (entry.getKey() == null || !(entry.getValue() instanceof Map<?, ?> controlDoc)) continue;
        controls.add(parseControl(String.valueOf(entry.getKey()), sectionName, controlDoc));
      }
    }

    return new ViewDefinition(
        id.trim(),
        name,
        string(rootValue(root, "TABLE")),
        string(rootValue(root, "DEFAULT_SORT_COLUMN")),
        bool(rootValue(root, "DEFAULT_SORT_REVERSE"), false),
        bool(rootValue(root, "ALLOW_FILTER"), true),
        bool(rootValue(root, "ALLOW_SORT"), true),
        bool(rootValue(root, "ALLOW_TABLE_OVERRIDE"), false),
        controls,
        root);
  }

  static Control parseControl(String id, String section, Map<?, ?> doc) {
    Object rawType = doc.get("type") != null ? doc.get("type") : doc.get("control_type");
    Map<String, Object> attributes = new LinkedHashMap<>();
    for (var e : doc.entrySet()) {
      String key = String.valueOf(e.getKey());
      if (!CONTROL_KEYS.contains(key)) attributes.put(key, e.getValue());
    }
    Integer order = integer(doc.get("display_order"));
    return new Control(
        id,
        section,
        string(doc.get("gruppe")),
        string(doc.get("feld")),
        string(doc.get("label")),
        ControlType.parse(string(rawType)),
        string(rawType),
        bool(doc.get("show"), true),
        order == null ? 0 : order,
        integer(doc.get("width")),
        attributes);
  }

  private static Object rootValue(Map<String, Object> root, String key) {
    Object v = root.get(key);
    if (v != null) return v;
    for (var e : root.entrySet()) if (e.getKey().equalsIgnoreCase(key)) return e.getValue();
    return null;
  }

  static String string(Object raw) {
    if (raw == null) return null;
    String s = String.valueOf(raw).trim();
    return s.isEmpty() ? null : s;
  }

  /** Lenient boolean: true/false, 1/0, yes/no, ja/nein. Unrecognized values yield the default. */
  public static boolean bool(Object raw, boolean dflt) {
    if (raw instanceof Boolean b) return b;
    if (raw instanceof Number n) return n.doubleValue() != 0;
    if (raw == null) return dflt;
    return switch (String.valueOf(raw).trim().toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes", "ja", "y" -> true;
      case "false", "0", "no", "nein", "n" -> false;
      default -> dflt;
    };
  }

  /** Lenient integer; null if absent or not a whole number. */
  public static Integer integer(Object raw) {
    if (raw == null || raw instanceof Boolean) return null;
    if (raw instanceof Number n) {
      double d = n.doubleValue();
      if (!Double.isFinite(d)) return null;
      return (int) d;
    }
    String s = String.valueOf(raw).trim();
    if (s.isEmpty()) return null;
    try {
      double d = Double.parseDouble(s);
      return Double.isFinite(d) ? (int) d : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
