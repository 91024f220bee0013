package io.intellixity.vista.state;

import io.intellixity.vista.model.Control;
import io.intellixity.vista.model.ControlType;
import io.intellixity.vista.model.FieldKey;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A control after user overrides were applied.
 *
 * @param control the declaring control; null for orphans
 * @param orphan true when only an override exists and the view no longer declares the control
 */
public record EffectiveControl(
    String id,
    Control control,
    boolean visible,
    int displayOrder,
    Integer width,
    boolean orphan
) {
  public static EffectiveControl orphan(String id, Integer width) {
    return new EffectiveControl(id, null, false, 0, width, true);
  }

  public EffectiveControl withVisible(boolean visible) {
    return new EffectiveControl(id, control, visible, displayOrder, width, orphan);
  }

  public ControlType type() {
    return control == null ? ControlType.OTHER : control.type();
  }

  /** Projected field, or null for orphans and unbound controls. */
  public FieldKey fieldKey() {
    return control != null && control.isBound() ? control.fieldKey() : null;
  }

  public ControlOverride asOverride() {
    return new ControlOverride(visible, displayOrder, width);
  }

  /** Client form: declared attributes verbatim, then the effective user keys. */
  public Map<String, Object> toWire() {
    Map<String, Object> out = new LinkedHashMap<>();
    if (control != null) {
      out.putAll(control.attributes());
      out.put("gruppe", control.group());
      out.put("feld", control.field());
      out.put("label", control.label());
      if (control.rawType() != null) out.put("type", control.rawType());
    }
    out.put(ControlOverride.SHOW, visible);
    out.put(ControlOverride.DISPLAY_ORDER, displayOrder);
    if (width != null) out.put(ControlOverride.WIDTH, width);
    if (orphan) out.put("_orphan", true);
    out.put("control_guid", id);
    return out;
  }
}
