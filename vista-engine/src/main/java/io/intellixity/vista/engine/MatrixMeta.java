package io.intellixity.vista.engine;

import java.util.List;

/**
 * @param maxBaseRows cap of the table snapshot the page was built from; may exceed the requested cap
 * @param totalAfterFilter rows matching the filters, across all pages
 * @param returnedData data rows on this page
 * @param returnedRows data plus group rows on this page
 * @param totalsScope always {@code global}: totals cover every matching row, not just this page
 */
public record MatrixMeta(
    int maxBaseRows,
    int baseLoaded,
    int totalAfterFilter,
    int offset,
    int limit,
    int returnedData,
    int returnedRows,
    boolean hasMore,
    boolean cacheHit,
    long tableVersion,
    boolean truncated,
    String totalsScope,
    boolean forceOneVisible,
    boolean restricted,
    List<String> warnings
) {
  public static final String GLOBAL = "global";

  public MatrixMeta {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
