package io.intellixity.vista.query;

import io.intellixity.vista.model.Control;
import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.model.FieldKey;
import io.intellixity.vista.state.GroupSpec;
import io.intellixity.vista.state.TableState;
import io.intellixity.vista.temporal.PdvmStamp;
import io.intellixity.vista.temporal.ProjectedRow;
import io.intellixity.vista.temporal.TemporalProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exclude, filter, sort and aggregate one table snapshot for one view.\n
 *
 * Input rows are expected most recently modified first; that order survives when no sort applies.
 * Filter, sort and aggregation failures skip the stage and leave a warning instead of failing the request.\n
 */
public final class QueryPipeline {
  private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

  private QueryPipeline() {}

  public static PipelineResult run(List<DataRow> rows,
                                   List<Control> controls,
                                   TableState state,
                                   PdvmStamp asOf,
                                   int currentDay) {
    TableState ts = state == null ? TableState.DEFAULT : state;
    Map<String, Control> byId = new LinkedHashMap<>();
    for (Control c : controls) byId.putIfAbsent(c.id(), c);
    Set<FieldKey> fields = fieldKeys(controls);
    List<String> warnings = new ArrayList<>();

    List<ProjectedRow> base = new ArrayList<>(rows.size());
    for (DataRow row : rows) {
      if (RowExclusions.isReservedId(row.id()) || RowExclusions.isRetired(row, currentDay)) continue;
      ProjectedRow projected = TemporalProjector.project(row, fields, asOf);
      if (RowEmptiness.isEmpty(projected, controls)) continue;
      base.add(projected);
    }
    int baseLoaded = base.size();

    List<ProjectedRow> filtered = base;
    try {
      filtered = RowFilters.apply(base, ts.filters(), byId);
    } catch (RuntimeException e) {
      skipped("filter", e, warnings);
    }

    List<ProjectedRow> sorted = filtered;
    if (ts.sort().isActive()) {
      try {
        sorted = RowSorter.sort(filtered, byId.get(ts.sort().controlId()), ts.sort().direction());
      } catch (RuntimeException e) {
        skipped("sort", e, warnings);
      }
    }

    List<String> ids = new ArrayList<>(sorted.size());
    for (ProjectedRow r : sorted) ids.add(r.id());

    Aggregate aggregate = null;
    if (ts.group().enabled()) {
      try {
        aggregate = aggregate(sorted, ts.group(), byId);
      } catch (RuntimeException e) {
        skipped("aggregate", e, warnings);
      }
    }

    return new PipelineResult(ids, ids.size(), baseLoaded, aggregate, warnings);
  }

  /** Distinct bound field keys of the given controls, in order. */
  public static Set<FieldKey> fieldKeys(List<Control> controls) {
    Set<FieldKey> out = new LinkedHashSet<>();
    for (Control c : controls) if (c.isBound()) out.add(c.fieldKey());
    return out;
  }

  static Aggregate aggregate(List<ProjectedRow> rows, GroupSpec group, Map<String, Control> byId) {
    Control sumControl = group.sumBy() == null ? null : byId.get(group.sumBy());
    return new Aggregate(rows.size(), sum(rows, sumControl));
  }

  /** Sum of the numeric values of {@code control}; null when no row has one. */
  public static Double sum(List<ProjectedRow> rows, Control control) {
    if (control == null || !control.isBound()) return null;
    double s = 0.0;
    boolean any = false;
    for (ProjectedRow r : rows) {
      Double n = Numbers.parse(r.value(control.fieldKey()));
      if (n == null) continue;
      s += n;
      any = true;
    }
    return any ? s : null;
  }

  private static void skipped(String stage, RuntimeException e, List<String> warnings) {
    log.warn("vista.pipeline stage={} skipped: {}", stage, e.toString());
    warnings.add(stage + " skipped: " + e.getMessage());
  }
}
