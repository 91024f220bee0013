package io.intellixity.vista.cache;

import java.util.List;

/**
 * Snapshot handed to one request.
 *
 * @param warnings degraded-path notes, e.g. a failed refresh that left the previous snapshot in place
 * @param refreshed true when this call loaded or refreshed the table
 */
public record CacheHandle(TableSnapshot snapshot, List<String> warnings, boolean refreshed) {
  public CacheHandle {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
