package io.intellixity.vista.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * @param maxRows ceiling for the rows held per table; requested caps are clamped to it
 * @param chunkSize page size of a full load
 * @param refreshMinInterval minimum time between two delta refreshes of one table
 */
public record TableCacheSettings(int maxRows, int chunkSize, Duration refreshMinInterval) {
  public static final TableCacheSettings DEFAULTS = new TableCacheSettings(20_000, 2_000, Duration.ofSeconds(2));

  public TableCacheSettings {
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
    if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
    Objects.requireNonNull(refreshMinInterval, "refreshMinInterval");
    if (refreshMinInterval.isNegative()) throw new IllegalArgumentException("refreshMinInterval must be >= 0");
  }
}
