package io.intellixity.vista.query;

import io.intellixity.vista.model.Control;
import io.intellixity.vista.model.ControlType;
import io.intellixity.vista.temporal.PdvmStamp;
import io.intellixity.vista.temporal.ProjectedRow;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a projected row carries any data for a view.\n
 *
 * SYSTEM controls are ignored, they always have values. A view without any other bound control never
 * classifies a row as empty.\n
 */
public final class RowEmptiness {
  private RowEmptiness() {}

  public static boolean isEmpty(ProjectedRow row, Collection<Control> controls) {
    boolean considered = false;
    for (Control c : controls) {
      if (c.isSystem() || !c.isBound()) continue;
      considered = true;
      if (!isEmptyValue(c.type(), row.value(c.fieldKey()))) return false;
    }
    return considered;
  }

  public static boolean isEmptyValue(ControlType type, Object raw) {
    if (raw == null) return true;
    if (raw instanceof String s && s.isBlank()) return true;
    return switch (type) {
      case STRING, DROPDOWN, BOOLEAN -> false;
      case NUMBER -> Numbers.parse(raw) == null;
      case DATE, DATETIME -> {
        Double d = Numbers.parse(raw);
        yield d != null && d == PdvmStamp.SENTINEL_MIN.value();
      }
      case OTHER -> (raw instanceof List<?> l && l.isEmpty()) || (raw instanceof Map<?, ?> m && m.isEmpty());
    };
  }
}
