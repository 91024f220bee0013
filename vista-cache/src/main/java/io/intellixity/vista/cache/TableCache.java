package io.intellixity.vista.cache;

import io.intellixity.vista.error.UpstreamUnavailableException;
import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.query.OffsetPage;
import io.intellixity.vista.spi.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session cache of decoded table rows with throttled incremental refresh.\n
 *
 * - first access: full load in chunks, most recently modified first, up to the requested cap\n
 * - later access: rows modified after the watermark, at most once per refresh interval\n
 * - larger cap than loaded: full reload\n
 *
 * Readers take the published snapshot without locking. Writers of one table serialize on its slot lock;
 * record store calls of a delta refresh run outside it. A snapshot is never older than the refresh interval
 * plus the duration of one refresh, except while the record store is failing.\n
 */
public final class TableCache {
  private static final Logger log = LoggerFactory.getLogger(TableCache.class);

  /** Same order as the record store pages: {@code modified_at DESC NULLS LAST, uid}. */
  private static final Comparator<DataRow> MOST_RECENT_FIRST = Comparator.comparing(
      DataRow::modifiedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
      .thenComparing(DataRow::id);

  private final RecordStore store;
  private final TableCacheSettings settings;
  private final Clock clock;
  private final ConcurrentHashMap<TableKey, Slot> slots = new ConcurrentHashMap<>();

  private static final class Slot {
    final ReentrantLock lock = new ReentrantLock();
    volatile TableSnapshot snapshot;
    Instant nextEligibleRefresh = Instant.MIN;
  }

  public TableCache(RecordStore store, TableCacheSettings settings, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public TableCacheSettings settings() { return settings; }

  /** Clamps a requested row cap to {@code [1, maxRows]}. */
  public int effectiveCap(int requestedCap) {
    return Math.max(1, Math.min(requestedCap, settings.maxRows()));
  }

  /** Current snapshot without loading or refreshing; null if the table was never loaded. */
  public TableSnapshot peek(String table, boolean includeRetired) {
    Slot slot = slots.get(new TableKey(table, includeRetired));
    return slot == null ? null : slot.snapshot;
  }

  public CacheHandle ensure(String table, boolean includeRetired, int requestedCap) {
    TableKey key = new TableKey(table, includeRetired);
    int cap = effectiveCap(requestedCap);
    Slot slot = slots.computeIfAbsent(key, k -> new Slot());

    TableSnapshot current = slot.snapshot;
    if (current == null || cap > current.cap()) return loadFull(key, slot, cap);
    return refreshIfDue(key, slot);
  }

  private CacheHandle loadFull(TableKey key, Slot slot, int cap) {
    slot.lock.lock();
    try {
      TableSnapshot current = slot.snapshot;
      if (current != null && cap <= current.cap()) return new CacheHandle(current, List.of(), false);

      TableSnapshot loaded;
      try {
        loaded = fullLoad(key, cap, current == null ? 0 : current.version());
      } catch (UpstreamUnavailableException e) {
        if (current == null) throw e;
        log.warn("vista.tablecache op=reload table={} cap={} failed, keeping version={}: {}",
            key, cap, current.version(), e.getMessage());
        return new CacheHandle(current, List.of("table reload failed, serving cached rows: " + e.getMessage()), false);
      }
      slot.snapshot = loaded;
      slot.nextEligibleRefresh = loaded.lastRefresh().plus(settings.refreshMinInterval());
      return new CacheHandle(loaded, List.of(), true);
    } finally {
      slot.lock.unlock();
    }
  }

  private TableSnapshot fullLoad(TableKey key, int cap, long previousVersion) {
    long started = System.nanoTime();
    Map<String, DataRow> byId = new LinkedHashMap<>();
    int offset = 0;
    while (byId.size() < cap) {
      int limit = Math.min(settings.chunkSize(), cap - byId.size());
      List<DataRow> page = store.fetchPage(key.table(), key.includeRetired(), OffsetPage.of(offset, limit));
      for (DataRow r : page) {
        if (byId.size() >= cap) break;
        byId.putIfAbsent(r.id(), r);
      }
      if (page.size() < limit) break;
      offset += page.size();
    }
    boolean truncated = byId.size() >= cap
        && !store.fetchPage(key.table(), key.includeRetired(), OffsetPage.of(cap, 1)).isEmpty();

    List<DataRow> rows = new ArrayList<>(byId.values());
    rows.sort(MOST_RECENT_FIRST);
    TableSnapshot snap = new TableSnapshot(key, rows, index(rows), maxModified(rows, null),
        previousVersion + 1, cap, truncated, clock.instant());

    if (log.isDebugEnabled()) {
      log.debug("vista.tablecache op=full table={} rows={} cap={} truncated={} version={} tookMs={}",
          key, rows.size(), cap, truncated, snap.version(), (System.nanoTime() - started) / 1_000_000);
    }
    return snap;
  }

  private CacheHandle refreshIfDue(TableKey key, Slot slot) {
    Instant now = clock.instant();
    LocalDateTime since;
    slot.lock.lock();
    try {
      if (now.isBefore(slot.nextEligibleRefresh)) return new CacheHandle(slot.snapshot, List.of(), false);
      slot.nextEligibleRefresh = now.plus(settings.refreshMinInterval());
      since = slot.snapshot.watermark();
    } finally {
      slot.lock.unlock();
    }

    List<DataRow> changed;
    try {
      changed = store.fetchChangedSince(key.table(), key.includeRetired(), since);
    } catch (RuntimeException e) {
      return keepCurrent(key, slot, since, e);
    }

    slot.lock.lock();
    try {
      TableSnapshot merged = merge(slot.snapshot, changed, now);
      slot.snapshot = merged;
      return new CacheHandle(merged, List.of(), true);
    } finally {
      slot.lock.unlock();
    }
  }

  private static CacheHandle keepCurrent(TableKey key, Slot slot, LocalDateTime since, RuntimeException e) {
    TableSnapshot current = slot.snapshot;
    if (e instanceof UpstreamUnavailableException) {
      log.warn("vista.tablecache op=delta table={} since={} failed, keeping version={}: {}",
          key, since, current.version(), e.getMessage());
    } else {
      log.warn("vista.tablecache op=delta table={} since={} failed, keeping version={}: {}",
          key, since, current.version(), e.getMessage(), e);
    }
    return new CacheHandle(current, List.of("table refresh failed, serving cached rows: " + e.getMessage()), false);
  }

  private TableSnapshot merge(TableSnapshot current, List<DataRow> changed, Instant now) {
    if (changed.isEmpty()) {
      return new TableSnapshot(current.key(), current.rows(), current.rowsById(), current.watermark(),
          current.version(), current.cap(), current.truncated(), now);
    }

    Map<String, DataRow> byId = index(current.rows());
    int updated = 0;
    for (DataRow incoming : changed) {
      DataRow existing = byId.get(incoming.id());
      if (existing != null && !incoming.isNotOlderThan(existing)) continue;
      if (incoming.equals(existing)) continue;
      byId.put(incoming.id(), incoming);
      updated++;
    }
    LocalDateTime watermark = maxModified(changed, current.watermark());
    if (updated == 0) {
      return new TableSnapshot(current.key(), current.rows(), current.rowsById(), watermark,
          current.version(), current.cap(), current.truncated(), now);
    }

    List<DataRow> rows = new ArrayList<>(byId.values());
    rows.sort(MOST_RECENT_FIRST);
    boolean truncated = current.truncated();
    if (rows.size() > current.cap()) {
      rows = new ArrayList<>(rows.subList(0, current.cap()));
      truncated = true;
    }
    TableSnapshot snap = new TableSnapshot(current.key(), rows, index(rows), watermark,
        current.version() + 1, current.cap(), truncated, now);
    log.debug("vista.tablecache op=delta table={} fetched={} updated={} version={}",
        current.key(), changed.size(), updated, snap.version());
    return snap;
  }

  private static Map<String, DataRow> index(List<DataRow> rows) {
    Map<String, DataRow> out = new LinkedHashMap<>(rows.size() * 2);
    for (DataRow r : rows) out.put(r.id(), r);
    return out;
  }

  private static LocalDateTime maxModified(List<DataRow> rows, LocalDateTime start) {
    LocalDateTime max = start;
    for (DataRow r : rows) {
      if (r.modifiedAt() != null && (max == null || r.modifiedAt().isAfter(max))) max = r.modifiedAt();
    }
    return max;
  }
}
