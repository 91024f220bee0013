package io.intellixity.vista.engine;

import io.intellixity.vista.cache.CacheHandle;
import io.intellixity.vista.cache.SessionCacheRegistry;
import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.model.Control;
import io.intellixity.vista.model.ViewDefinition;
import io.intellixity.vista.query.MatrixRow;
import io.intellixity.vista.query.PipelineResult;
import io.intellixity.vista.query.QueryPipeline;
import io.intellixity.vista.session.SessionContext;
import io.intellixity.vista.session.Sessions;
import io.intellixity.vista.spi.ViewDefinitionStore;
import io.intellixity.vista.spi.ViewStateStore;
import io.intellixity.vista.state.EffectiveControl;
import io.intellixity.vista.state.TableState;
import io.intellixity.vista.temporal.PdvmStamp;
import io.intellixity.vista.temporal.TemporalProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for view operations. Every method reads the caller from the session bound to the current thread
 * (see {@link Sessions}).
 */
public final class ViewService {
  private static final Logger log = LoggerFactory.getLogger(ViewService.class);

  private final ViewStateResolver resolver;
  private final ViewStateStore states;
  private final SessionCacheRegistry caches;
  private final TableAccessPolicy accessPolicy;
  private final MatrixBuilder matrices;
  private final EngineSettings settings;
  private final Clock clock;

  public ViewService(ViewDefinitionStore definitions,
                     ViewStateStore states,
                     SessionCacheRegistry caches,
                     EngineSettings settings,
                     Clock clock) {
    this.states = Objects.requireNonNull(states, "states");
    this.caches = Objects.requireNonNull(caches, "caches");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.resolver = new ViewStateResolver(definitions, states, new TableOverridePolicy(settings.systemTablePrefix()));
    this.accessPolicy = new TableAccessPolicy(settings.restrictedTables());
    this.matrices = new MatrixBuilder(resolver, caches, accessPolicy, settings, clock);
  }

  public ViewDefinitionView getDefinition(String viewId) {
    ViewDefinition def = resolver.definition(viewId);
    List<Map<String, Object>> controls = new ArrayList<>(def.controls().size());
    for (Control c : def.controls()) {
      controls.add(new EffectiveControl(c.id(), c, c.defaultVisible(), c.displayOrder(), c.width(), false).toWire());
    }
    return new ViewDefinitionView(def.id(), def.name(), def.rootTable(), def.root(), controls);
  }

  public ViewStateView getState(String viewId, String table, String editType) {
    SessionContext ctx = Sessions.currentOrThrow();
    return resolver.resolve(ctx, viewId, table, editType, null, null).toStateView();
  }

  /** Persists normalized state; parts missing from {@code update} keep their persisted value. */
  public ViewStateView putState(String viewId, String table, String editType, StateUpdate update) {
    SessionContext ctx = Sessions.currentOrThrow();
    StateUpdate body = update == null ? new StateUpdate(null, null) : update;
    ResolvedView view = resolver.resolve(ctx, viewId, table, editType, body.controlsSource(), body.tableStateSource());

    states.save(ctx.userId(), view.key(), view.controls().source(), view.tableState().value().toSource());
    log.info("vista.state op=save user={} key={} controls={} warnings={}",
        ctx.userId(), view.key(), view.controls().source().size(), view.warnings().size());
    return view.toStateView();
  }

  public ViewMatrix postMatrix(MatrixRequest request) {
    return matrices.build(Sessions.currentOrThrow(), request);
  }

  /** Projected base rows, most recently modified first, after exclusions and without user state. */
  public BaseRowsView getBase(String viewId, String table, Integer limit, boolean includeRetired) {
    SessionContext ctx = Sessions.currentOrThrow();
    int l = limit == null ? settings.defaultLimit() : limit;
    if (l < 1 || l > settings.maxLimit()) {
      throw new InvalidViewInputException("limit must be between 1 and " + settings.maxLimit());
    }

    ViewDefinition def = resolver.definition(viewId);
    String effectiveTable = resolver.table(def, table);
    if (!accessPolicy.canRead(effectiveTable, ctx)) return new BaseRowsView(def.id(), effectiveTable, true, List.of());

    CacheHandle handle = caches.forSession(ctx.sessionId()).tables()
        .ensure(effectiveTable, includeRetired, settings.maxBaseRows());
    PdvmStamp asOf = ctx.asOf();
    int currentDay = PdvmStamp.now(clock).day();
    PipelineResult base = QueryPipeline.run(handle.snapshot().rows(), def.controls(), TableState.DEFAULT, asOf, currentDay);

    var fields = QueryPipeline.fieldKeys(def.controls());
    List<MatrixRow> rows = new ArrayList<>(Math.min(l, base.total()));
    for (String id : base.orderedIds()) {
      if (rows.size() >= l) break;
      var row = handle.snapshot().row(id);
      if (row != null) rows.add(MatrixBuilder.toDataRow(TemporalProjector.project(row, fields, asOf), def.controls()));
    }
    return new BaseRowsView(def.id(), effectiveTable, false, rows);
  }
}
