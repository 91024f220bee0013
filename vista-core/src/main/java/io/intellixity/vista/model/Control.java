package io.intellixity.vista.model;

import java.util.Map;
import java.util.Objects;

/**
 * Column declared by a view definition.
 *
 * @param id stable control id, unique within the view
 * @param section definition section the control was declared in
 * @param rawType type string as stored, kept for round-tripping
 * @param attributes every other key of the control document, verbatim
 */
public record Control(
    String id,
    String section,
    String group,
    String field,
    String label,
    ControlType type,
    String rawType,
    boolean defaultVisible,
    int displayOrder,
    Integer width,
    Map<String, Object> attributes
) {
  public Control {
    Objects.requireNonNull(id, "id");
    section = section == null ? "" : section;
    group = group == null ? "" : group;
    field = field == null ? "" : field;
    label = label == null ? "" : label;
    type = type == null ? ControlType.STRING : type;
    attributes = attributes == null ? Map.of() : attributes;
  }

  public FieldKey fieldKey() {
    return new FieldKey(group, field);
  }

  /** Controls without a group or field cannot be projected. */
  public boolean isBound() {
    return !group.isBlank() && !field.isBlank();
  }

  public boolean isSystem() {
    return FieldKey.SYSTEM_GROUP.equalsIgnoreCase(group);
  }
}
