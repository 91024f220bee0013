package io.intellixity.vista.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SortDirection {
  ASC("asc"), DESC("desc"), NONE(null);

  private final String wire;

  SortDirection(String wire) { this.wire = wire; }

  @JsonValue
  public String wire() { return wire; }

  /** Returns null for anything other than {@code asc}, {@code desc} or null. */
  public static SortDirection fromWire(Object raw) {
    if (raw == null) return NONE;
    if ("asc".equals(raw)) return ASC;
    if ("desc".equals(raw)) return DESC;
    return null;
  }
}
