package io.intellixity.vista.model;

import java.util.Locale;

/** Value type of a column; decides emptiness and sort behavior. */
public enum ControlType {
  STRING, DROPDOWN, NUMBER, DATE, DATETIME, BOOLEAN, OTHER;

  public static ControlType parse(String raw) {
    if (raw == null) return STRING;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "", "string", "text", "base" -> STRING;
      case "dropdown" -> DROPDOWN;
      case "number", "float", "int" -> NUMBER;
      case "date" -> DATE;
      case "datetime" -> DATETIME;
      case "boolean", "bool" -> BOOLEAN;
      default -> OTHER;
    };
  }

  public boolean isTextual() {
    return this == STRING || this == DROPDOWN;
  }

  public boolean isDateLike() {
    return this == DATE || this == DATETIME;
  }
}
