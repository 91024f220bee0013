package io.intellixity.vista.server.web;

import io.intellixity.vista.engine.BaseRowsView;
import io.intellixity.vista.engine.MatrixRequest;
import io.intellixity.vista.engine.StateUpdate;
import io.intellixity.vista.engine.ViewDefinitionView;
import io.intellixity.vista.engine.ViewMatrix;
import io.intellixity.vista.engine.ViewService;
import io.intellixity.vista.engine.ViewStateView;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/views")
public final class ViewController {
  private final ViewService views;

  public ViewController(ViewService views) {
    this.views = views;
  }

  public record StateBody(Object controlsSource, Object tableStateSource) {}

  public record MatrixBody(
      Object controlsSource,
      Object tableStateSource,
      Boolean includeRetired,
      Integer limit,
      Integer offset,
      Integer maxBaseRows
  ) {}

  @GetMapping("/{viewId}")
  public ViewDefinitionView definition(@PathVariable("viewId") String viewId) {
    return views.getDefinition(viewId);
  }

  @GetMapping("/{viewId}/state")
  public ViewStateView state(@PathVariable("viewId") String viewId,
                             @RequestParam(value = "table", required = false) String table,
                             @RequestParam(value = "editType", required = false) String editType) {
    return views.getState(viewId, table, editType);
  }

  @PutMapping("/{viewId}/state")
  public ViewStateView putState(@PathVariable("viewId") String viewId,
                                @RequestParam(value = "table", required = false) String table,
                                @RequestParam(value = "editType", required = false) String editType,
                                @RequestBody(required = false) StateBody body) {
    StateUpdate update = body == null
        ? new StateUpdate(null, null)
        : new StateUpdate(body.controlsSource(), body.tableStateSource());
    return views.putState(viewId, table, editType, update);
  }

  @PostMapping("/{viewId}/matrix")
  public ViewMatrix matrix(@PathVariable("viewId") String viewId,
                           @RequestParam(value = "table", required = false) String table,
                           @RequestParam(value = "editType", required = false) String editType,
                           @RequestBody(required = false) MatrixBody body) {
    MatrixBody b = body == null ? new MatrixBody(null, null, null, null, null, null) : body;
    return views.postMatrix(new MatrixRequest(
        viewId,
        table,
        editType,
        b.controlsSource(),
        b.tableStateSource(),
        b.includeRetired() == null || b.includeRetired(),
        b.limit(),
        b.offset() == null ? 0 : b.offset(),
        b.maxBaseRows()));
  }

  @GetMapping("/{viewId}/base")
  public BaseRowsView base(@PathVariable("viewId") String viewId,
                           @RequestParam(value = "table", required = false) String table,
                           @RequestParam(value = "limit", required = false) Integer limit,
                           @RequestParam(value = "includeRetired", defaultValue = "true") boolean includeRetired) {
    return views.getBase(viewId, table, limit, includeRetired);
  }
}
