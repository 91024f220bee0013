package io.intellixity.vista.temporal;

import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.model.FieldKey;
import io.intellixity.vista.model.FieldValue;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves versioned record fields to the value effective at an as-of date.\n
 *
 * - history maps: value at the greatest timestamp &lt;= asOf, otherwise absent\n
 * - plain values: passed through\n
 * - SYSTEM group: read from record metadata, never projected\n
 */
public final class TemporalProjector {
  private TemporalProjector() {}

  public static ProjectedRow project(DataRow row, Collection<FieldKey> fields, PdvmStamp asOf) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(asOf, "asOf");
    if (fields == null || fields.isEmpty()) return new ProjectedRow(row, asOf, Map.of());

    Map<FieldKey, ProjectedValue> out = new HashMap<>(fields.size() * 2);
    for (FieldKey key : fields) {
      if (key == null || out.containsKey(key)) continue;
      out.put(key, projectField(row, key, asOf));
    }
    return new ProjectedRow(row, asOf, out);
  }

  public static ProjectedValue projectField(DataRow row, FieldKey key, PdvmStamp asOf) {
    if (key.isSystem()) return ProjectedValue.plain(row.systemValue(key.field()));

    FieldValue stored = row.field(key);
    if (stored == null) return ProjectedValue.ABSENT;
    if (stored instanceof FieldValue.Scalar s) return ProjectedValue.plain(s.value());

    var hit = ((FieldValue.Temporal) stored).versions().floorEntry(asOf);
    if (hit == null) return ProjectedValue.ABSENT;
    return new ProjectedValue(hit.getValue(), hit.getKey());
  }
}
