package io.intellixity.vista.model;

import io.intellixity.vista.temporal.PdvmStamp;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One record of a source table, decoded once at the record store boundary.
 *
 * @param id stable, globally unique record id
 * @param fields stored values by {@code group.field}
 * @param retired the record's retired ("historisch") flag
 * @param validUntil retirement date; null means the record never retires
 * @param modifiedAt last modification, drives delta refresh
 */
public record DataRow(
    String id,
    String name,
    Map<FieldKey, FieldValue> fields,
    boolean retired,
    PdvmStamp validUntil,
    LocalDateTime createdAt,
    LocalDateTime modifiedAt
) {
  public DataRow {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
    name = name == null ? "" : name;
    fields = fields == null ? Map.of() : Map.copyOf(fields);
  }

  public FieldValue field(FieldKey key) {
    return fields.get(key);
  }

  /**
   * Value of a {@code SYSTEM} column. Metadata columns win; anything else falls back to a scalar stored in the
   * record's own SYSTEM group. Lookup is case-insensitive.
   */
  public Object systemValue(String field) {
    if (field == null) return null;
    switch (field.trim().toLowerCase(Locale.ROOT)) {
      case "uid":
      case "id":
        return id;
      case "name":
        return name;
      case "historisch":
        return retired ? 1 : 0;
      case "gilt_bis":
        return validUntil == null ? null : iso(validUntil.toLocalDateTime());
      case "created_at":
        return iso(createdAt);
      case "modified_at":
        return iso(modifiedAt);
      default:
        return storedSystemValue(field);
    }
  }

  private Object storedSystemValue(String field) {
    for (var e : fields.entrySet()) {
      FieldKey k = e.getKey();
      if (!k.isSystem() || !k.field().equalsIgnoreCase(field)) continue;
      if (e.getValue() instanceof FieldValue.Scalar s) return s.value();
    }
    return null;
  }

  private static String iso(LocalDateTime dt) {
    return dt == null ? null : dt.toString();
  }

  public DataRow withModifiedAt(LocalDateTime modifiedAt) {
    return new DataRow(id, name, fields, retired, validUntil, createdAt, modifiedAt);
  }

  /** Newer-or-same comparison on {@link #modifiedAt()}; a missing timestamp counts as oldest. */
  public boolean isNotOlderThan(DataRow other) {
    Objects.requireNonNull(other, "other");
    if (other.modifiedAt == null) return true;
    if (modifiedAt == null) return false;
    return !modifiedAt.isBefore(other.modifiedAt);
  }
}
