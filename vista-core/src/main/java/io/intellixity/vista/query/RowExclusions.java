package io.intellixity.vista.query;

import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.temporal.PdvmStamp;

import java.util.Locale;

/** Rows that never reach a matrix: reserved template ids and records retired before today. */
public final class RowExclusions {
  private static final char[] RESERVED_DIGITS = {'0', '5', '6'};

  private RowExclusions() {}

  /** True for ids whose 32 hex digits are all {@code 0}, all {@code 5} or all {@code 6}. */
  public static boolean isReservedId(String id) {
    if (id == null) return false;
    String hex = id.replace("-", "").trim().toLowerCase(Locale.ROOT);
    if (hex.length() != 32) return false;
    for (char digit : RESERVED_DIGITS) {
      if (allEqual(hex, digit)) return true;
    }
    return false;
  }

  private static boolean allEqual(String s, char c) {
    for (int i = 0; i < s.length(); i++) if (s.charAt(i) != c) return false;
    return true;
  }

  /**
   * A row is retired once the day of its valid-until date lies before the current day. Missing dates and
   * "never retires" dates are exempt; the empty sentinel {@code 1001.0} is an ordinary past date and retires.
   */
  public static boolean isRetired(DataRow row, int currentDay) {
    PdvmStamp until = row.validUntil();
    if (until == null || until.neverRetires()) return false;
    return until.day() < currentDay;
  }
}
