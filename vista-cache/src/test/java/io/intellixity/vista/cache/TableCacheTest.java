package io.intellixity.vista.cache;

import io.intellixity.vista.error.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

final class TableCacheTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 1, 10, 0);

  private final FakeRecordStore store = new FakeRecordStore();
  private final MutableClock clock = new MutableClock(Instant.parse("2025-02-12T10:00:00Z"));
  private final TableCache cache = new TableCache(store, new TableCacheSettings(100, 2, Duration.ofSeconds(2)), clock);

  private void seed(int n) {
    for (int i = 0; i < n; i++) store.put("r" + i, "v" + i, T0.plusMinutes(i));
  }

  @Test
  void fullLoadReadsChunksNewestFirst() {
    seed(5);
    CacheHandle h = cache.ensure("t", true, 100);

    TableSnapshot s = h.snapshot();
    assertTrue(h.refreshed());
    assertEquals(5, s.size());
    assertEquals("r4", s.rows().get(0).id());
    assertEquals(T0.plusMinutes(4), s.watermark());
    assertEquals(1, s.version());
    assertFalse(s.truncated());
    // chunks of two: 2 + 2 + 1
    assertEquals(3, store.pageCalls);
  }

  @Test
  void capTruncatesAndLargerCapReloads() {
    seed(5);
    TableSnapshot small = cache.ensure("t", true, 3).snapshot();
    assertEquals(3, small.size());
    assertTrue(small.truncated());

    TableSnapshot same = cache.ensure("t", true, 2).snapshot();
    assertSame(small, same);

    TableSnapshot bigger = cache.ensure("t", true, 10).snapshot();
    assertEquals(5, bigger.size());
    assertFalse(bigger.truncated());
    assertEquals(2, bigger.version());
  }

  @Test
  void requestedCapIsClamped() {
    assertEquals(100, cache.effectiveCap(1_000_000));
    assertEquals(1, cache.effectiveCap(0));
  }

  @Test
  void deltaRefreshIsThrottled() {
    seed(2);
    cache.ensure("t", true, 100);
    store.put("r9", "new", T0.plusHours(1));

    CacheHandle early = cache.ensure("t", true, 100);
    assertFalse(early.refreshed());
    assertEquals(2, early.snapshot().size());
    assertEquals(0, store.deltaCalls);

    clock.advance(Duration.ofSeconds(2));
    CacheHandle due = cache.ensure("t", true, 100);
    assertTrue(due.refreshed());
    assertEquals(T0.plusMinutes(1), store.lastSince);
    assertEquals(3, due.snapshot().size());
    assertEquals("r9", due.snapshot().rows().get(0).id());
    assertEquals(2, due.snapshot().version());
    assertEquals(T0.plusHours(1), due.snapshot().watermark());
  }

  @Test
  void unchangedRefreshKeepsVersion() {
    seed(2);
    cache.ensure("t", true, 100);
    clock.advance(Duration.ofSeconds(5));
    TableSnapshot s = cache.ensure("t", true, 100).snapshot();
    assertEquals(1, s.version());
    assertEquals(1, store.deltaCalls);
  }

  @Test
  void updatedRowReplacesOlderCopy() {
    seed(2);
    cache.ensure("t", true, 100);
    store.put("r0", "changed", T0.plusHours(2));
    clock.advance(Duration.ofSeconds(3));

    TableSnapshot s = cache.ensure("t", true, 100).snapshot();
    assertEquals(2, s.size());
    assertEquals("r0", s.rows().get(0).id());
    assertEquals(T0.plusHours(2), s.row("r0").modifiedAt());
  }

  @Test
  void deltaBeyondCapMarksTruncated() {
    seed(2);
    cache.ensure("t", true, 2);
    store.put("r7", "x", T0.plusHours(1));
    clock.advance(Duration.ofSeconds(3));

    TableSnapshot s = cache.ensure("t", true, 2).snapshot();
    assertEquals(2, s.size());
    assertTrue(s.truncated());
    assertNull(s.row("r0"));
  }

  @Test
  void failedRefreshServesPreviousSnapshot() {
    seed(2);
    TableSnapshot first = cache.ensure("t", true, 100).snapshot();
    store.failing = true;
    clock.advance(Duration.ofSeconds(3));

    CacheHandle h = cache.ensure("t", true, 100);
    assertSame(first, h.snapshot());
    assertFalse(h.refreshed());
    assertEquals(1, h.warnings().size());
  }

  @Test
  void emptyTableRefreshesUnbounded() {
    TableSnapshot empty = cache.ensure("t", true, 100).snapshot();
    assertEquals(0, empty.size());
    assertNull(empty.watermark());

    store.put("late", "x", T0);
    clock.advance(Duration.ofSeconds(2));
    TableSnapshot s = cache.ensure("t", true, 100).snapshot();
    assertNull(store.lastSince);
    assertEquals(1, store.deltaCalls);
    assertEquals(1, s.size());
    assertEquals(T0, s.watermark());
  }

  @Test
  void failedInitialLoadPropagates() {
    store.failing = true;
    assertThrows(UpstreamUnavailableException.class, () -> cache.ensure("t", true, 10));
    assertNull(cache.peek("t", true));
  }

  @Test
  void retiredVariantsAreCachedSeparately() {
    seed(1);
    cache.ensure("t", true, 10);
    assertNull(cache.peek("t", false));
    assertNotNull(cache.peek("t", true));
  }

  @Test
  void unexpectedStoreErrorServesPreviousSnapshot() {
    seed(2);
    TableSnapshot first = cache.ensure("t", true, 100).snapshot();
    store.deltaFailure = new IllegalStateException("connection reset");
    clock.advance(Duration.ofSeconds(3));

    CacheHandle h = cache.ensure("t", true, 100);
    assertSame(first, h.snapshot());
    assertFalse(h.refreshed());
    assertEquals(List.of("table refresh failed, serving cached rows: connection reset"), h.warnings());

    store.deltaFailure = null;
    store.put("r5", "x", T0.plusHours(1));
    clock.advance(Duration.ofSeconds(3));
    assertEquals(2, cache.ensure("t", true, 100).snapshot().version());
  }

  @Test
  void equalModificationTimesKeepIdOrderAcrossRefreshes() {
    for (String id : List.of("m", "c", "x", "a", "q")) store.put(id, id, T0);
    TableSnapshot loaded = cache.ensure("t", true, 100).snapshot();
    assertEquals(List.of("a", "c", "m", "q", "x"), ids(loaded));

    store.put("new", "n", T0.plusHours(1));
    clock.advance(Duration.ofSeconds(3));
    TableSnapshot refreshed = cache.ensure("t", true, 100).snapshot();
    assertEquals(List.of("new", "a", "c", "m", "q", "x"), ids(refreshed));

    store.put("new", "n2", T0.plusHours(2));
    clock.advance(Duration.ofSeconds(3));
    assertEquals(List.of("new", "a", "c", "m", "q", "x"), ids(cache.ensure("t", true, 100).snapshot()));
  }

  @Test
  void concurrentRefreshesPublishEveryVersionOnce() throws Exception {
    TableCache shared = new TableCache(store, new TableCacheSettings(1_000, 50, Duration.ZERO), clock);
    seed(3);
    TableSnapshot initial = shared.ensure("t", true, 1_000).snapshot();

    int readers = 6;
    int writes = 40;
    ExecutorService pool = Executors.newFixedThreadPool(readers + 1);
    CountDownLatch start = new CountDownLatch(1);
    AtomicBoolean writing = new AtomicBoolean(true);
    List<Future<List<TableSnapshot>>> observed = new ArrayList<>();
    try {
      Future<?> writer = pool.submit(() -> {
        start.await();
        for (int i = 0; i < writes; i++) store.put("w" + (i % 10), "x" + i, T0.plusHours(1).plusSeconds(i));
        writing.set(false);
        return null;
      });
      for (int t = 0; t < readers; t++) {
        observed.add(pool.submit(() -> {
          start.await();
          List<TableSnapshot> seen = new ArrayList<>();
          while (writing.get()) seen.add(shared.ensure("t", true, 1_000).snapshot());
          seen.add(shared.ensure("t", true, 1_000).snapshot());
          return seen;
        }));
      }
      start.countDown();
      writer.get(10, TimeUnit.SECONDS);

      Map<Long, TableSnapshot> byVersion = new HashMap<>();
      byVersion.put(initial.version(), initial);
      for (Future<List<TableSnapshot>> f : observed) {
        long previous = 0;
        for (TableSnapshot s : f.get(10, TimeUnit.SECONDS)) {
          assertTrue(s.version() >= previous, "version went back from " + previous + " to " + s.version());
          previous = s.version();
          TableSnapshot sameVersion = byVersion.putIfAbsent(s.version(), s);
          if (sameVersion != null) assertEquals(sameVersion.rows(), s.rows(), "version " + s.version());
        }
      }

      TableSnapshot last = shared.ensure("t", true, 1_000).snapshot();
      byVersion.putIfAbsent(last.version(), last);
      assertEquals(13, last.size());
      for (int k = 0; k < 10; k++) {
        assertEquals(T0.plusHours(1).plusSeconds(30 + k), last.row("w" + k).modifiedAt());
      }
      // every published version was handed to the caller that produced it, so there are no gaps
      Set<Long> expected = LongStream.rangeClosed(1, last.version()).boxed().collect(Collectors.toSet());
      assertEquals(expected, byVersion.keySet());
      assertTrue(last.version() >= 2 && last.version() <= 1 + writes);
    } finally {
      pool.shutdownNow();
    }
  }

  private static List<String> ids(TableSnapshot s) {
    List<String> out = new ArrayList<>();
    for (var r : s.rows()) out.add(r.id());
    return out;
  }
}
