package io.intellixity.vista.cache.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Synchronized size-bounded map with optional idle expiry.\n
 *
 * - ACCESS order: least recently used entry is evicted first\n
 * - INSERTION order: oldest write is evicted first, reads do not refresh it\n
 * - Idle: expire-after-access (0 disables)\n
 */
public final class BoundedCache<K, V> {
  public enum Order { ACCESS, INSERTION }

  private final int maxEntries;
  private final long idleMillis;
  private final LongSupplier nowMillis;
  private final LinkedHashMap<K, Entry<V>> map;

  private static final class Entry<V> {
    final V value;
    long accessAt;

    Entry(V value, long now) {
      this.value = value;
      this.accessAt = now;
    }
  }

  public BoundedCache(int maxEntries, Order order) {
    this(maxEntries, order, 0, System::currentTimeMillis);
  }

  public BoundedCache(int maxEntries, Order order, long idleMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    Objects.requireNonNull(order, "order");
    this.maxEntries = maxEntries;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.map = new LinkedHashMap<>(16, 0.75f, order == Order.ACCESS);
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    Entry<V> e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, now)) {
      map.remove(key);
      return null;
    }
    e.accessAt = now;
    return e.value;
  }

  public synchronized V put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    // Re-inserting moves the key to the tail in both orders.
    Entry<V> prev = map.remove(key);
    map.put(key, new Entry<>(value, now));
    evictIfNeeded();
    return prev == null ? null : prev.value;
  }

  /** Returns the cached value, creating it under the cache lock when absent. */
  public synchronized V getOrCompute(K key, Supplier<V> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    V existing = get(key);
    if (existing != null) return existing;
    V created = supplier.get();
    if (created == null) throw new IllegalStateException("supplier returned null for " + key);
    put(key, created);
    return created;
  }

  public synchronized V remove(K key) {
    Entry<V> e = map.remove(key);
    return e == null ? null : e.value;
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private boolean isExpired(Entry<V> e, long now) {
    return idleMillis > 0 && (now - e.accessAt) >= idleMillis;
  }

  private void pruneExpired(long now) {
    if (idleMillis == 0 || map.isEmpty()) return;
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next().getValue(), now)) it.remove();
    }
  }

  private void evictIfNeeded() {
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (map.size() > maxEntries && it.hasNext()) {
      it.next();
      it.remove();
    }
  }
}
