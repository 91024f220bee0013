package io.intellixity.vista.cache;

import io.intellixity.vista.model.DataRow;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of one cached table.
 *
 * @param rows at most {@code cap} rows, most recently modified first
 * @param rowsById the same rows, by id
 * @param watermark greatest modification time seen; null while the table is empty
 * @param version bumped on every full load and on every refresh that changed a row
 * @param truncated true when the table holds more rows than {@code cap}
 */
public record TableSnapshot(
    TableKey key,
    List<DataRow> rows,
    Map<String, DataRow> rowsById,
    LocalDateTime watermark,
    long version,
    int cap,
    boolean truncated,
    Instant lastRefresh
) {
  public TableSnapshot {
    rows = List.copyOf(rows);
    rowsById = Map.copyOf(rowsById);
  }

  public int size() {
    return rows.size();
  }

  public DataRow row(String id) {
    return id == null ? null : rowsById.get(id);
  }
}
