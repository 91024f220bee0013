package io.intellixity.vista.engine;

import io.intellixity.vista.cache.CacheHandle;
import io.intellixity.vista.cache.ResultCache;
import io.intellixity.vista.cache.ResultCacheKey;
import io.intellixity.vista.cache.SessionCacheRegistry;
import io.intellixity.vista.cache.SessionCacheStore;
import io.intellixity.vista.cache.TableSnapshot;
import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.model.Control;
import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.model.FieldKey;
import io.intellixity.vista.query.Aggregate;
import io.intellixity.vista.query.MatrixRow;
import io.intellixity.vista.query.OffsetPage;
import io.intellixity.vista.query.PageGrouper;
import io.intellixity.vista.query.PipelineResult;
import io.intellixity.vista.query.QueryPipeline;
import io.intellixity.vista.session.SessionContext;
import io.intellixity.vista.state.GroupSpec;
import io.intellixity.vista.state.TableState;
import io.intellixity.vista.temporal.PdvmStamp;
import io.intellixity.vista.temporal.ProjectedRow;
import io.intellixity.vista.temporal.ProjectedValue;
import io.intellixity.vista.temporal.TemporalProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders one page of a view.\n
 *
 * Flow: paging check -> view + user state -> table access -> table cache -> result cache (or pipeline) ->
 * page slice -> projection -> optional page grouping. The result cache is always consulted with the version of
 * the snapshot this request's own {@code ensure} returned.\n
 */
public final class MatrixBuilder {
  private static final Logger log = LoggerFactory.getLogger(MatrixBuilder.class);

  private final ViewStateResolver resolver;
  private final SessionCacheRegistry caches;
  private final TableAccessPolicy accessPolicy;
  private final EngineSettings settings;
  private final Clock clock;

  MatrixBuilder(ViewStateResolver resolver,
                SessionCacheRegistry caches,
                TableAccessPolicy accessPolicy,
                EngineSettings settings,
                Clock clock) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.caches = Objects.requireNonNull(caches, "caches");
    this.accessPolicy = Objects.requireNonNull(accessPolicy, "accessPolicy");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ViewMatrix build(SessionContext ctx, MatrixRequest req) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(req, "req");
    OffsetPage page = page(req.offset(), req.limit());

    ResolvedView view = resolver.resolve(ctx, req.viewId(), req.table(), req.editType(),
        req.controlsSource(), req.tableStateSource());
    List<String> warnings = new ArrayList<>(view.warnings());

    if (!accessPolicy.canRead(view.table(), ctx)) {
      log.info("vista.matrix view={} table={} user={} restricted", view.definition().id(), view.table(), ctx.userId());
      return restricted(ctx, view, page, warnings);
    }

    SessionCacheStore store = caches.forSession(ctx.sessionId());
    int requestedCap = req.maxBaseRows() == null ? settings.maxBaseRows() : req.maxBaseRows();
    CacheHandle handle = store.tables().ensure(view.table(), req.includeRetired(), requestedCap);
    TableSnapshot snapshot = handle.snapshot();
    warnings.addAll(handle.warnings());

    List<Control> controls = view.definition().controls();
    TableState state = view.effectiveState();
    PdvmStamp asOf = ctx.asOf();
    int currentDay = PdvmStamp.now(clock).day();

    ResultCacheKey key = new ResultCacheKey(view.definition().id(), view.table(), snapshot.version(),
        state.toSource(), req.includeRetired(), asOf, currentDay);
    ResultCache.Lookup lookup = store.results().getOrCompute(key,
        () -> QueryPipeline.run(snapshot.rows(), controls, state, asOf, currentDay));
    PipelineResult result = lookup.result();
    warnings.addAll(result.warnings());

    List<ProjectedRow> pageRows = projectPage(snapshot, result.orderedIds(), page, controls, asOf);
    Map<String, Control> byId = view.definition().controlsById();
    GroupSpec group = state.group();

    List<MatrixRow> rows;
    if (group.groupsPage()) {
      rows = PageGrouper.group(pageRows, byId.get(group.by()),
          group.sumBy() == null ? null : byId.get(group.sumBy()), r -> toDataRow(r, controls));
    } else {
      rows = new ArrayList<>(pageRows.size());
      for (ProjectedRow r : pageRows) rows.add(toDataRow(r, controls));
    }
    Aggregate totals = group.enabled() ? result.aggregate() : null;

    MatrixMeta meta = new MatrixMeta(
        snapshot.cap(),
        result.baseLoaded(),
        result.total(),
        page.offset(),
        page.limit(),
        pageRows.size(),
        rows.size(),
        page.end() < result.total(),
        lookup.hit(),
        snapshot.version(),
        snapshot.truncated(),
        MatrixMeta.GLOBAL,
        view.controls().forceOneVisible(),
        false,
        warnings);

    log.debug("vista.matrix view={} table={} version={} total={} offset={} limit={} cacheHit={}",
        view.definition().id(), view.table(), snapshot.version(), result.total(), page.offset(), page.limit(),
        lookup.hit());

    return new ViewMatrix(view.definition().id(), view.table(), asOf.value(),
        view.controls().source(), view.controls().effectiveWire(),
        view.tableState().value().toSource(), state.toSource(),
        rows, totals, meta);
  }

  OffsetPage page(int offset, Integer limit) {
    int l = limit == null ? settings.defaultLimit() : limit;
    if (l < 1 || l > settings.maxLimit()) {
      throw new InvalidViewInputException("limit must be between 1 and " + settings.maxLimit());
    }
    if (offset < 0) throw new InvalidViewInputException("offset must be >= 0");
    return OffsetPage.of(offset, l);
  }

  private static List<ProjectedRow> projectPage(TableSnapshot snapshot,
                                                List<String> orderedIds,
                                                OffsetPage page,
                                                List<Control> controls,
                                                PdvmStamp asOf) {
    int from = Math.min(page.offset(), orderedIds.size());
    int to = Math.min(page.end(), orderedIds.size());
    Set<FieldKey> fields = QueryPipeline.fieldKeys(controls);
    List<ProjectedRow> out = new ArrayList<>(to - from);
    for (String id : orderedIds.subList(from, to)) {
      DataRow row = snapshot.row(id);
      if (row != null) out.add(TemporalProjector.project(row, fields, asOf));
    }
    return out;
  }

  static MatrixRow toDataRow(ProjectedRow row, List<Control> controls) {
    Map<String, Object> values = new LinkedHashMap<>();
    Map<String, Double> effectiveFrom = new LinkedHashMap<>();
    for (Control c : controls) {
      if (!c.isBound()) continue;
      ProjectedValue v = row.get(c.fieldKey());
      values.put(c.id(), v.value());
      if (v.effectiveFrom() != null) effectiveFrom.put(c.id(), v.effectiveFrom().value());
    }
    return MatrixRow.data(row.id(), row.row().name(), values, effectiveFrom);
  }

  private ViewMatrix restricted(SessionContext ctx, ResolvedView view, OffsetPage page, List<String> warnings) {
    MatrixMeta meta = new MatrixMeta(0, 0, 0, page.offset(), page.limit(), 0, 0, false, false, 0, false,
        MatrixMeta.GLOBAL, view.controls().forceOneVisible(), true, warnings);
    return new ViewMatrix(view.definition().id(), view.table(), ctx.asOf().value(),
        view.controls().source(), view.controls().effectiveWire(),
        view.tableState().value().toSource(), view.effectiveState().toSource(),
        List.of(), null, meta);
  }
}
