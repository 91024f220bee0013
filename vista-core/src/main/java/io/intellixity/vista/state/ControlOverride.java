package io.intellixity.vista.state;

import java.util.LinkedHashMap;
import java.util.Map;

/** User customization of one control. Null parts fall back to the definition. */
public record ControlOverride(Boolean visible, Integer displayOrder, Integer width) {
  public static final String SHOW = "show";
  public static final String DISPLAY_ORDER = "display_order";
  public static final String WIDTH = "width";

  public static final ControlOverride NONE = new ControlOverride(null, null, null);

  public boolean isEmpty() {
    return visible == null && displayOrder == null && width == null;
  }

  /** Persisted form; only the parts that are set. */
  public Map<String, Object> toSource() {
    Map<String, Object> out = new LinkedHashMap<>();
    if (visible != null) out.put(SHOW, visible);
    if (displayOrder != null) out.put(DISPLAY_ORDER, displayOrder);
    if (width != null) out.put(WIDTH, width);
    return out;
  }
}
