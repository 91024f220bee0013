package io.intellixity.vista.cache;

import io.intellixity.vista.cache.internal.BoundedCache;
import io.intellixity.vista.query.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-session cache of pipeline results keyed by {@link ResultCacheKey#hash()}.\n
 *
 * An entry only counts as a hit when it was computed from the current table version. Computation happens
 * outside the cache lock; above the ceiling the oldest insertion is evicted.\n
 */
public final class ResultCache {
  private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

  public record Lookup(CachedResult entry, boolean hit) {
    public PipelineResult result() { return entry.result(); }
  }

  private final BoundedCache<String, CachedResult> entries;
  private final Clock clock;

  public ResultCache(int maxEntries, Clock clock) {
    this.entries = new BoundedCache<>(maxEntries, BoundedCache.Order.INSERTION);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Lookup getOrCompute(ResultCacheKey key, Supplier<PipelineResult> compute) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(compute, "compute");
    String hash = key.hash();

    CachedResult cached = entries.get(hash);
    if (cached != null && cached.tableVersion() == key.tableVersion()) return new Lookup(cached, true);

    PipelineResult computed = compute.get();
    CachedResult entry = new CachedResult(computed, key.tableVersion(), clock.instant());
    entries.put(hash, entry);
    log.debug("vista.resultcache op=store view={} table={} version={} total={}",
        key.viewId(), key.table(), key.tableVersion(), computed.total());
    return new Lookup(entry, false);
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
  }
}
