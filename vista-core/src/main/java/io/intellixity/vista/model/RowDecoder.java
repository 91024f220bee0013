package io.intellixity.vista.model;

import io.intellixity.vista.temporal.PdvmStamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decodes the stored {@code group -> field -> value} document of a record into typed fields.\n
 *
 * A JSON object is a history map when it is non-empty and every key parses as a stamp; any other value,
 * including objects with non-numeric keys, is kept as a scalar. Values of the SYSTEM group are always scalars.\n
 */
public final class RowDecoder {
  private RowDecoder() {}

  public static DataRow decode(String id,
                               String name,
                               Map<String, ?> document,
                               boolean retired,
                               LocalDateTime validUntil,
                               LocalDateTime createdAt,
                               LocalDateTime modifiedAt) {
    return new DataRow(
        id,
        name,
        decodeFields(document),
        retired,
        validUntil == null ? null : PdvmStamp.of(validUntil),
        createdAt,
        modifiedAt);
  }

  public static Map<FieldKey, FieldValue> decodeFields(Map<String, ?> document) {
    if (document == null || document.isEmpty()) return Map.of();
    Map<FieldKey, FieldValue> out = new LinkedHashMap<>();
    for (var g : document.entrySet()) {
      String group = g.getKey();
      if (group == null || !(g.getValue() instanceof Map<?, ?> fields)) continue;
      boolean system = FieldKey.SYSTEM_GROUP.equalsIgnoreCase(group);
      for (var f : fields.entrySet()) {
        if (f.getKey() == null) continue;
        FieldKey key = new FieldKey(group, String.valueOf(f.getKey()));
        out.put(key, system ? FieldValue.scalar(f.getValue()) : decodeValue(f.getValue()));
      }
    }
    return out;
  }

  public static FieldValue decodeValue(Object raw) {
    if (!(raw instanceof Map<?, ?> m) || m.isEmpty()) return FieldValue.scalar(raw);
    TreeMap<PdvmStamp, Object> versions = new TreeMap<>();
    for (var e : m.entrySet()) {
      PdvmStamp ts = PdvmStamp.tryParse(e.getKey());
      if (ts == null) return FieldValue.scalar(raw);
      versions.put(ts, e.getValue());
    }
    return FieldValue.temporal(versions);
  }
}
