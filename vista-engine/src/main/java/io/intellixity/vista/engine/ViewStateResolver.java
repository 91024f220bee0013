package io.intellixity.vista.engine;

import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.model.Control;
import io.intellixity.vista.model.ViewDefinition;
import io.intellixity.vista.session.SessionContext;
import io.intellixity.vista.spi.StoredViewState;
import io.intellixity.vista.spi.ViewDefinitionStore;
import io.intellixity.vista.spi.ViewStateStore;
import io.intellixity.vista.state.ControlMerger;
import io.intellixity.vista.state.MergedControls;
import io.intellixity.vista.state.Sanitized;
import io.intellixity.vista.state.SortField;
import io.intellixity.vista.state.TableState;
import io.intellixity.vista.state.TableStateSanitizer;
import io.intellixity.vista.state.ViewStateKey;

import java.util.Map;
import java.util.Objects;

/**
 * Loads a view and merges it with the caller's state: request overrides first, persisted state for the
 * parts a request leaves out.
 */
final class ViewStateResolver {
  private final ViewDefinitionStore definitions;
  private final ViewStateStore states;
  private final TableOverridePolicy overridePolicy;

  ViewStateResolver(ViewDefinitionStore definitions, ViewStateStore states, TableOverridePolicy overridePolicy) {
    this.definitions = Objects.requireNonNull(definitions, "definitions");
    this.states = Objects.requireNonNull(states, "states");
    this.overridePolicy = Objects.requireNonNull(overridePolicy, "overridePolicy");
  }

  ViewDefinition definition(String viewId) {
    return definitions.load(viewId);
  }

  String table(ViewDefinition definition, String requestedTable) {
    return overridePolicy.resolve(definition, requestedTable);
  }

  ResolvedView resolve(SessionContext ctx,
                       String viewId,
                       String requestedTable,
                       String editType,
                       Object controlsOverride,
                       Object tableStateOverride) {
    requireObject(controlsOverride, "controlsSource");
    requireObject(tableStateOverride, "tableStateSource");

    ViewDefinition definition = definitions.load(viewId);
    String table = overridePolicy.resolve(definition, requestedTable);
    ViewStateKey key = new ViewStateKey(definition.id(), table, editType);

    StoredViewState stored = (controlsOverride != null && tableStateOverride != null)
        ? StoredViewState.EMPTY
        : states.load(ctx.userId(), key);
    if (stored == null) stored = StoredViewState.EMPTY;

    MergedControls merged = ControlMerger.merge(definition,
        controlsOverride != null ? controlsOverride : stored.controls());
    Sanitized<TableState> sanitized = TableStateSanitizer.sanitize(
        tableStateOverride != null ? tableStateOverride : stored.tableState());

    return new ResolvedView(definition, table, key, merged, sanitized, applyViewPolicy(definition, sanitized.value()));
  }

  /** Drops what the view disallows and fills in the view's default sort. */
  static TableState applyViewPolicy(ViewDefinition definition, TableState state) {
    TableState out = state;
    if (!definition.allowFilter()) out = out.withFilters(Map.of());
    if (!definition.allowSort()) out = out.withSort(SortField.NONE);
    if (!out.sort().isActive() && definition.defaultSortColumn() != null) {
      String controlId = defaultSortControl(definition);
      if (controlId != null) {
        out = out.withSort(definition.defaultSortReverse() ? SortField.desc(controlId) : SortField.asc(controlId));
      }
    }
    return out;
  }

  /** DEFAULT_SORT_COLUMN names a control id, or else a field of one of the controls. */
  private static String defaultSortControl(ViewDefinition definition) {
    String column = definition.defaultSortColumn();
    if (definition.control(column) != null) return column;
    for (Control c : definition.controls()) {
      if (c.field().equalsIgnoreCase(column)) return c.id();
    }
    return null;
  }

  static void requireObject(Object raw, String name) {
    if (raw != null && !(raw instanceof Map<?, ?>)) {
      throw new InvalidViewInputException(name + " must be a JSON object");
    }
  }
}
