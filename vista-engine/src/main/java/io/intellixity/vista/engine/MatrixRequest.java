package io.intellixity.vista.engine;

import java.util.Objects;

/**
 * One matrix request.
 *
 * @param table requested table; null renders the view's root table
 * @param controlsSource control overrides to use instead of the persisted ones; null uses the persisted ones
 * @param tableStateSource table state to use instead of the persisted one; null uses the persisted one
 * @param limit page size; null uses the default
 * @param maxBaseRows table cache cap; null uses the default
 */
public record MatrixRequest(
    String viewId,
    String table,
    String editType,
    Object controlsSource,
    Object tableStateSource,
    boolean includeRetired,
    Integer limit,
    int offset,
    Integer maxBaseRows
) {
  public MatrixRequest {
    Objects.requireNonNull(viewId, "viewId");
  }

  public static MatrixRequest of(String viewId) {
    return new MatrixRequest(viewId, null, null, null, null, true, null, 0, null);
  }

  public MatrixRequest withPage(int offset, int limit) {
    return new MatrixRequest(viewId, table, editType, controlsSource, tableStateSource, includeRetired,
        limit, offset, maxBaseRows);
  }

  public MatrixRequest withTableState(Object tableStateSource) {
    return new MatrixRequest(viewId, table, editType, controlsSource, tableStateSource, includeRetired,
        limit, offset, maxBaseRows);
  }

  public MatrixRequest withControls(Object controlsSource) {
    return new MatrixRequest(viewId, table, editType, controlsSource, tableStateSource, includeRetired,
        limit, offset, maxBaseRows);
  }

  public MatrixRequest withTable(String table) {
    return new MatrixRequest(viewId, table, editType, controlsSource, tableStateSource, includeRetired,
        limit, offset, maxBaseRows);
  }

  public MatrixRequest withIncludeRetired(boolean includeRetired) {
    return new MatrixRequest(viewId, table, editType, controlsSource, tableStateSource, includeRetired,
        limit, offset, maxBaseRows);
  }

  public MatrixRequest withMaxBaseRows(Integer maxBaseRows) {
    return new MatrixRequest(viewId, table, editType, controlsSource, tableStateSource, includeRetired,
        limit, offset, maxBaseRows);
  }
}
