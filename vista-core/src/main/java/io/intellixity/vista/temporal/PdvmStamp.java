package io.intellixity.vista.temporal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Point in time encoded as {@code YYYYDDD.fraction}: four-digit year, day of year (1-366) and the elapsed
 * fraction of that day (0.5 = noon).\n
 *
 * The encoding is monotonic, so stamps order the same way the instants they denote do. History maps in stored
 * records use the textual form of these values as keys, and the as-of date of a session is one of them.\n
 */
public record PdvmStamp(double value) implements Comparable<PdvmStamp> {
  /** "No value recorded". */
  public static final PdvmStamp SENTINEL_MIN = new PdvmStamp(1001.0);
  public static final PdvmStamp SENTINEL_MAX = new PdvmStamp(9999365.99999);

  /** Any stamp on or after this value never retires a record. */
  private static final double NEVER_RETIRES_FROM = 9999365.0;
  private static final double SECONDS_PER_DAY = 86_400.0;

  public PdvmStamp {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("PdvmStamp must be finite: " + value);
    }
  }

  @JsonCreator
  public static PdvmStamp of(double value) {
    return new PdvmStamp(value);
  }

  public static PdvmStamp of(LocalDateTime dt) {
    if (dt == null) return SENTINEL_MIN;
    if (dt.toLocalDate().equals(LocalDate.of(1, 1, 1))) return SENTINEL_MIN;
    double datePart = dt.getYear() * 1000.0 + dt.getDayOfYear();
    double seconds = dt.toLocalTime().toNanoOfDay() / 1_000_000_000.0;
    return new PdvmStamp(datePart + seconds / SECONDS_PER_DAY);
  }

  public static PdvmStamp of(LocalDate date) {
    return date == null ? SENTINEL_MIN : of(date.atStartOfDay());
  }

  public static PdvmStamp now(Clock clock) {
    return of(LocalDateTime.now(clock));
  }

  /** Parses a stored history key (e.g. {@code "2025043.0"}); returns null for anything non-numeric. */
  public static PdvmStamp tryParse(Object raw) {
    if (raw == null) return null;
    if (raw instanceof PdvmStamp s) return s;
    if (raw instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? new PdvmStamp(d) : null;
    }
    String s = String.valueOf(raw).trim();
    if (s.isEmpty()) return null;
    try {
      double d = Double.parseDouble(s);
      return Double.isFinite(d) ? new PdvmStamp(d) : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Calendar day, {@code YYYYDDD}. */
  public int day() {
    return (int) Math.floor(value);
  }

  public boolean isEmptySentinel() {
    return Math.abs(value - SENTINEL_MIN.value) < 0.0001;
  }

  public boolean neverRetires() {
    return value >= NEVER_RETIRES_FROM;
  }

  /** Converts back to a local date-time; null if the day-of-year part does not denote a real date. */
  public LocalDateTime toLocalDateTime() {
    int day = day();
    int year = day / 1000;
    int dayOfYear = day % 1000;
    try {
      LocalDate date = LocalDate.ofYearDay(year, dayOfYear);
      long seconds = Math.round((value - day) * SECONDS_PER_DAY);
      if (seconds >= (long) SECONDS_PER_DAY) seconds = (long) SECONDS_PER_DAY - 1;
      return LocalDateTime.of(date, LocalTime.ofSecondOfDay(seconds));
    } catch (DateTimeException e) {
      return null;
    }
  }

  @JsonValue
  public double value() {
    return value;
  }

  @Override
  public int compareTo(PdvmStamp other) {
    return Double.compare(value, other.value);
  }
}
