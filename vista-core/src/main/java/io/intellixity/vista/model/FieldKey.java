package io.intellixity.vista.model;

import java.util.Objects;

/** Location of a field inside a record: {@code group.field}. */
public record FieldKey(String group, String field) {
  /** Reserved group whose values come from record metadata. */
  public static final String SYSTEM_GROUP = "SYSTEM";

  public FieldKey {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(field, "field");
  }

  public static FieldKey of(String group, String field) {
    return new FieldKey(group, field);
  }

  public boolean isSystem() {
    return SYSTEM_GROUP.equalsIgnoreCase(group);
  }

  @Override
  public String toString() {
    return group + "." + field;
  }
}
