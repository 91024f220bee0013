package io.intellixity.vista.spi;

import java.util.Map;

/**
 * Persisted per-user state of one view, as raw documents.
 *
 * @param controls control id -> user keys; null when nothing was saved
 * @param tableState table state wire form; null when nothing was saved
 */
public record StoredViewState(Map<String, Object> controls, Map<String, Object> tableState) {
  public static final StoredViewState EMPTY = new StoredViewState(null, null);
}
