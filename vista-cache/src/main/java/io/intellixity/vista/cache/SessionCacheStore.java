package io.intellixity.vista.cache;

import java.util.Objects;

/** Caches owned by one session. */
public record SessionCacheStore(String sessionId, TableCache tables, ResultCache results) {
  public SessionCacheStore {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(tables, "tables");
    Objects.requireNonNull(results, "results");
  }
}
