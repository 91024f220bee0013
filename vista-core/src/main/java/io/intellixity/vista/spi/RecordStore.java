package io.intellixity.vista.spi;

import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.query.OffsetPage;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read access to the record tables a view renders.\n
 *
 * Failures surface as {@link io.intellixity.vista.error.UpstreamUnavailableException}; an unknown table as
 * {@link io.intellixity.vista.error.ViewNotFoundException}.\n
 */
public interface RecordStore {

  /** One page of rows ordered by last modification, most recent first. */
  List<DataRow> fetchPage(String table, boolean includeRetired, OffsetPage page);

  /**
   * Rows modified strictly after {@code since}, oldest first.
   *
   * @param since watermark; null means every row
   */
  List<DataRow> fetchChangedSince(String table, boolean includeRetired, LocalDateTime since);
}
