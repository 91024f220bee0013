package io.intellixity.vista.engine;

import java.util.List;
import java.util.Map;

/** Persisted state of a view for one user, with the effective controls it yields. */
public record ViewStateView(
    String viewId,
    String table,
    Map<String, Map<String, Object>> controlsSource,
    List<Map<String, Object>> controlsEffective,
    Map<String, Object> tableStateSource,
    Map<String, Object> tableStateEffective,
    Map<String, Object> meta
) {}
