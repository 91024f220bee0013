package io.intellixity.vista.temporal;

/**
 * A field resolved for one as-of date.
 *
 * @param value the effective value, null when nothing was recorded on or before the as-of date
 * @param effectiveFrom the history timestamp that was selected; null for plain values and absent values
 */
public record ProjectedValue(Object value, PdvmStamp effectiveFrom) {
  public static final ProjectedValue ABSENT = new ProjectedValue(null, null);

  public static ProjectedValue plain(Object value) {
    return value == null ? ABSENT : new ProjectedValue(value, null);
  }

  public boolean isAbsent() {
    return value == null;
  }
}
