package io.intellixity.vista.spi;

import io.intellixity.vista.state.ViewStateKey;

import java.util.Map;

/** Per-user persistence of control overrides and table state. */
public interface ViewStateStore {

  /** Never null; {@link StoredViewState#EMPTY} when the user has no saved state for the key. */
  StoredViewState load(String userId, ViewStateKey key);

  void save(String userId, ViewStateKey key, Map<String, ?> controls, Map<String, ?> tableState);
}
