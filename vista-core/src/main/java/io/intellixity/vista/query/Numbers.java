package io.intellixity.vista.query;

import java.util.regex.Pattern;

/** Lenient numeric reading of projected values. */
public final class Numbers {
  private static final String DIGITS = "\\d(?:_?\\d)*";
  /** Plain decimal text; no hex literals and no {@code d}/{@code f} type suffixes. */
  private static final Pattern DECIMAL = Pattern.compile(
      "[+-]?(?:" + DIGITS + "(?:\\.(?:" + DIGITS + ")?)?|\\." + DIGITS + ")(?:[eE][+-]?" + DIGITS + ")?");
  private static final Pattern INFINITY = Pattern.compile("([+-]?)(?i:inf|infinity)");

  private Numbers() {}

  /** Numeric value of {@code raw}, or null when it is not a number. NaN counts as "not a number". */
  public static Double parse(Object raw) {
    if (raw == null || raw instanceof Boolean) return null;
    if (raw instanceof Number n) {
      double d = n.doubleValue();
      return Double.isNaN(d) ? null : d;
    }
    String s = String.valueOf(raw).trim();
    if (DECIMAL.matcher(s).matches()) return Double.parseDouble(s.replace("_", ""));
    var inf = INFINITY.matcher(s);
    if (inf.matches()) return "-".equals(inf.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    return null;
  }
}
