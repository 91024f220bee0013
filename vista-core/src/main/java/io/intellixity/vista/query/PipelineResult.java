package io.intellixity.vista.query;

import java.util.List;

/**
 * @param orderedIds filtered and sorted record ids
 * @param total {@code orderedIds.size()}
 * @param baseLoaded rows left after exclusion, before filtering
 * @param aggregate global totals, only when grouping is enabled
 */
public record PipelineResult(
    List<String> orderedIds,
    int total,
    int baseLoaded,
    Aggregate aggregate,
    List<String> warnings
) {
  public PipelineResult {
    orderedIds = List.copyOf(orderedIds);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
