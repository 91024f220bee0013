package io.intellixity.vista.engine;

import io.intellixity.vista.query.Aggregate;
import io.intellixity.vista.query.MatrixRow;

import java.util.List;
import java.util.Map;

/** A rendered matrix page together with the state it was rendered with. */
public record ViewMatrix(
    String viewId,
    String table,
    double asOf,
    Map<String, Map<String, Object>> controlsSource,
    List<Map<String, Object>> controlsEffective,
    Map<String, Object> tableStateSource,
    Map<String, Object> tableStateEffective,
    List<MatrixRow> rows,
    Aggregate totals,
    MatrixMeta meta
) {}
