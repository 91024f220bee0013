package io.intellixity.vista.temporal;

import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.model.FieldKey;

import java.util.Map;
import java.util.Objects;

/** A row together with the values of the requested fields as of one date. */
public record ProjectedRow(DataRow row, PdvmStamp asOf, Map<FieldKey, ProjectedValue> values) {
  public ProjectedRow {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(asOf, "asOf");
    values = values == null ? Map.of() : values;
  }

  public String id() { return row.id(); }

  public ProjectedValue get(FieldKey key) {
    ProjectedValue v = values.get(key);
    return v == null ? ProjectedValue.ABSENT : v;
  }

  public Object value(FieldKey key) {
    return get(key).value();
  }
}
