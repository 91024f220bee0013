package io.intellixity.vista.state;

import java.util.Locale;
import java.util.Objects;

/** Identity of persisted per-user view state: one view, rendered over one table, in one edit mode. */
public record ViewStateKey(String viewId, String table, String editType) {
  public static final String DEFAULT_EDIT_TYPE = "view";

  public ViewStateKey {
    Objects.requireNonNull(viewId, "viewId");
    Objects.requireNonNull(table, "table");
    viewId = viewId.trim().toLowerCase(Locale.ROOT);
    table = table.trim().toLowerCase(Locale.ROOT);
    editType = editType == null || editType.isBlank() ? DEFAULT_EDIT_TYPE : editType.trim().toLowerCase(Locale.ROOT);
  }

  /** {@code viewId::table::editType}, lower-cased. */
  public String serialize() {
    return viewId + "::" + table + "::" + editType;
  }

  @Override
  public String toString() {
    return serialize();
  }
}
