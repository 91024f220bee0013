package io.intellixity.vista.cache;

import io.intellixity.vista.cache.internal.BoundedCache;
import io.intellixity.vista.session.SessionContext;
import io.intellixity.vista.session.Sessions;
import io.intellixity.vista.spi.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Resolves the {@link SessionCacheStore} of a session, creating it on first use.\n
 *
 * Stores are kept in a bounded LRU map; sessions idle for longer than the configured duration lose their caches
 * and start cold on their next request.\n
 */
public final class SessionCacheRegistry {
  private static final Logger log = LoggerFactory.getLogger(SessionCacheRegistry.class);

  private final RecordStore store;
  private final TableCacheSettings tableSettings;
  private final int resultCacheMaxEntries;
  private final Clock clock;
  private final BoundedCache<String, SessionCacheStore> sessions;

  public SessionCacheRegistry(RecordStore store,
                              TableCacheSettings tableSettings,
                              int resultCacheMaxEntries,
                              int maxSessions,
                              Duration sessionIdle,
                              Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.tableSettings = Objects.requireNonNull(tableSettings, "tableSettings");
    if (resultCacheMaxEntries <= 0) throw new IllegalArgumentException("resultCacheMaxEntries must be > 0");
    this.resultCacheMaxEntries = resultCacheMaxEntries;
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(sessionIdle, "sessionIdle");
    this.sessions = new BoundedCache<>(maxSessions, BoundedCache.Order.ACCESS, sessionIdle.toMillis(), clock::millis);
  }

  public SessionCacheStore forSession(String sessionId) {
    Objects.requireNonNull(sessionId, "sessionId");
    String id = sessionId.trim();
    if (id.isEmpty()) throw new IllegalArgumentException("sessionId is blank");
    return sessions.getOrCompute(id, () -> {
      log.debug("vista.sessions op=create session={}", id);
      return new SessionCacheStore(id,
          new TableCache(store, tableSettings, clock),
          new ResultCache(resultCacheMaxEntries, clock));
    });
  }

  /** Store of the session bound to the current thread. */
  public SessionCacheStore current() {
    SessionContext ctx = Sessions.currentOrThrow();
    return forSession(ctx.sessionId());
  }

  public void evict(String sessionId) {
    if (sessionId != null && sessions.remove(sessionId.trim()) != null) {
      log.debug("vista.sessions op=evict session={}", sessionId);
    }
  }

  public int size() {
    return sessions.size();
  }
}
