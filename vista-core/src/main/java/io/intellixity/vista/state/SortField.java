package io.intellixity.vista.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Single-column sort; a missing control or {@link SortDirection#NONE} means "keep input order". */
public record SortField(@JsonProperty("control_guid") String controlId, SortDirection direction) {
  public static final SortField NONE = new SortField(null, SortDirection.NONE);

  public SortField {
    direction = direction == null ? SortDirection.NONE : direction;
  }

  public static SortField asc(String controlId) { return new SortField(controlId, SortDirection.ASC); }
  public static SortField desc(String controlId) { return new SortField(controlId, SortDirection.DESC); }

  public boolean isActive() {
    return controlId != null && !controlId.isBlank() && direction != SortDirection.NONE;
  }
}
