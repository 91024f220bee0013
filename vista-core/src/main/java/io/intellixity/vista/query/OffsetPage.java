package io.intellixity.vista.query;

import io.intellixity.vista.error.InvalidViewInputException;

/** Window {@code [offset, offset + limit)} over an ordered result. */
public record OffsetPage(int offset, int limit) {
  public OffsetPage {
    if (limit <= 0) throw new InvalidViewInputException("limit must be > 0");
    if (offset < 0) throw new InvalidViewInputException("offset must be >= 0");
  }

  public static OffsetPage of(int offset, int limit) {
    return new OffsetPage(offset, limit);
  }

  /** Exclusive end, saturated at {@link Integer#MAX_VALUE}. */
  public int end() {
    long end = (long) offset + limit;
    return end > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) end;
  }

  public OffsetPage next() {
    return new OffsetPage(end(), limit);
  }
}
