package io.intellixity.vista.engine;

import io.intellixity.vista.model.ViewDefinition;
import io.intellixity.vista.state.MergedControls;
import io.intellixity.vista.state.Sanitized;
import io.intellixity.vista.state.TableState;
import io.intellixity.vista.state.ViewStateKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A view bound to one table and one user's state.
 *
 * @param tableState sanitized user state, as persisted
 * @param effectiveState user state after the view's filter/sort policy and default sort
 */
record ResolvedView(
    ViewDefinition definition,
    String table,
    ViewStateKey key,
    MergedControls controls,
    Sanitized<TableState> tableState,
    TableState effectiveState
) {
  List<String> warnings() {
    List<String> out = new ArrayList<>(controls.warnings());
    out.addAll(tableState.warnings());
    return out;
  }

  Map<String, Object> meta() {
    Map<String, Object> ts = new LinkedHashMap<>();
    ts.put("sourceOk", tableState.sourceOk());
    ts.put("warnings", tableState.warnings());

    Map<String, Object> out = new LinkedHashMap<>(controls.meta());
    out.put("controlWarnings", controls.warnings());
    out.put("tableState", ts);
    return out;
  }

  ViewStateView toStateView() {
    return new ViewStateView(
        definition.id(),
        table,
        controls.source(),
        controls.effectiveWire(),
        tableState.value().toSource(),
        effectiveState.toSource(),
        meta());
  }
}
