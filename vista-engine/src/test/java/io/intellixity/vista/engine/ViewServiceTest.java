package io.intellixity.vista.engine;

import io.intellixity.vista.cache.SessionCacheRegistry;
import io.intellixity.vista.cache.TableCacheSettings;
import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.error.ViewNotFoundException;
import io.intellixity.vista.query.Aggregate;
import io.intellixity.vista.query.MatrixRow;
import io.intellixity.vista.session.SessionContext;
import io.intellixity.vista.session.Sessions;
import io.intellixity.vista.temporal.PdvmStamp;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

final class ViewServiceTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 1, 8, 0);

  private final InMemoryStores.Views views = new InMemoryStores.Views();
  private final InMemoryStores.States states = new InMemoryStores.States();
  private final InMemoryStores.Records records = new InMemoryStores.Records();
  private final InMemoryStores.MutableClock clock = new InMemoryStores.MutableClock(Instant.parse("2025-02-12T10:00:00Z"));
  private final ViewService service = new ViewService(views, states,
      new SessionCacheRegistry(records, new TableCacheSettings(1000, 100, Duration.ofSeconds(2)), 16, 8,
          Duration.ofMinutes(30), clock),
      new EngineSettings(2, 50, 1000, "sys_", Map.of("sys_benutzer", Set.of("admin"))),
      clock);

  private final SessionContext alice = SessionContext.of("s-alice", "alice", PdvmStamp.of(2025043.5));

  ViewServiceTest() {
    views.add("persons", viewDocument("persons", Map.of()));
    views.add("users", viewDocument("sys_benutzer", Map.of()));
    views.add("locked", viewDocument("persons", Map.of("ALLOW_FILTER", false, "ALLOW_SORT", false)));
    person("r1", "anna", "berlin", 10, 1);
    person("r2", "bert", "hamburg", 20, 2);
    person("r3", "carl", "berlin", 30, 3);
    person("r4", "dora", "koeln", 40, 4);
    person("r5", "emil", "berlin", 50, 5);
  }

  private static Map<String, Object> viewDocument(String table, Map<String, Object> rootFlags) {
    Map<String, Object> root = new LinkedHashMap<>(rootFlags);
    root.put("TABLE", table);
    Map<String, Object> controls = new LinkedHashMap<>();
    controls.put("c-name", Map.of("gruppe", "P", "feld", "NAME", "label", "Name", "type", "text", "display_order", 1));
    controls.put("c-city", Map.of("gruppe", "P", "feld", "CITY", "label", "City", "display_order", 2));
    controls.put("c-amount", Map.of("gruppe", "P", "feld", "AMOUNT", "type", "int", "display_order", 3));
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("ROOT", root);
    doc.put("PERSON", controls);
    return doc;
  }

  private void person(String id, String name, String city, int amount, int minute) {
    records.put("persons", id, Map.of("NAME", name, "CITY", city, "AMOUNT", amount), T0.plusMinutes(minute));
  }

  private <T> T as(SessionContext ctx, Supplier<T> body) {
    return Sessions.inSession(ctx, body);
  }

  private static List<String> dataIds(ViewMatrix m) {
    List<String> ids = new ArrayList<>();
    for (MatrixRow r : m.rows()) if (r.isData()) ids.add(r.id());
    return ids;
  }

  @Test
  void pagesPartitionTheResult() {
    List<String> seen = new ArrayList<>();
    List<Boolean> hasMore = new ArrayList<>();
    for (int offset = 0; offset < 6; offset += 2) {
      MatrixRequest req = MatrixRequest.of("persons").withPage(offset, 2);
      ViewMatrix m = as(alice, () -> service.postMatrix(req));
      seen.addAll(dataIds(m));
      hasMore.add(m.meta().hasMore());
      assertEquals(5, m.meta().totalAfterFilter());
    }
    assertEquals(List.of("r5", "r4", "r3", "r2", "r1"), seen);
    assertEquals(List.of(true, true, false), hasMore);
  }

  @Test
  void dataRowsCarryProjectedValuesByControlId() {
    ViewMatrix m = as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withPage(0, 1)));
    MatrixRow r5 = m.rows().get(0);
    assertEquals("emil", r5.values().get("c-name"));
    assertEquals(50, r5.values().get("c-amount"));
    assertTrue(r5.effectiveFrom().isEmpty());
    assertEquals(2025043.5, m.asOf());
  }

  @Test
  void secondIdenticalRequestHitsResultCache() {
    MatrixRequest req = MatrixRequest.of("persons").withTableState(Map.of("filters", Map.of("c-city", "berlin")));
    ViewMatrix first = as(alice, () -> service.postMatrix(req));
    ViewMatrix second = as(alice, () -> service.postMatrix(req));

    assertFalse(first.meta().cacheHit());
    assertTrue(second.meta().cacheHit());
    assertEquals(List.of("r5", "r3"), dataIds(second));
    assertEquals(3, second.meta().totalAfterFilter());
  }

  @Test
  void changedTableInvalidatesCachedResult() {
    MatrixRequest req = MatrixRequest.of("persons").withPage(0, 10);
    ViewMatrix before = as(alice, () -> service.postMatrix(req));

    person("r6", "fritz", "berlin", 60, 60);
    clock.advance(Duration.ofSeconds(3));
    ViewMatrix after = as(alice, () -> service.postMatrix(req));

    assertFalse(after.meta().cacheHit());
    assertEquals(before.meta().tableVersion() + 1, after.meta().tableVersion());
    assertEquals("r6", dataIds(after).get(0));
    assertEquals(6, after.meta().totalAfterFilter());
  }

  @Test
  void sessionsDoNotShareCaches() {
    as(alice, () -> service.postMatrix(MatrixRequest.of("persons")));
    SessionContext bob = SessionContext.of("s-bob", "bob", PdvmStamp.of(2025043.5));
    ViewMatrix m = as(bob, () -> service.postMatrix(MatrixRequest.of("persons")));
    assertFalse(m.meta().cacheHit());
    assertEquals(2, records.pageCalls);
  }

  @Test
  void groupedPageWithGlobalTotals() {
    Map<String, Object> state = Map.of("group", Map.of("enabled", true, "by", "c-city", "sum_control_guid", "c-amount"));
    ViewMatrix m = as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withTableState(state).withPage(0, 2)));

    assertEquals(new Aggregate(5, 150.0), m.totals());
    assertEquals(MatrixMeta.GLOBAL, m.meta().totalsScope());
    assertEquals(2, m.meta().returnedData());
    assertEquals(4, m.meta().returnedRows());

    MatrixRow berlin = m.rows().get(0);
    assertEquals(MatrixRow.GROUP, berlin.kind());
    assertEquals("berlin", berlin.key());
    assertEquals(1L, berlin.count());
    assertEquals(50.0, berlin.sum());
    assertEquals("berlin", m.rows().get(1).groupKey());
  }

  @Test
  void totalsAreTheSameOnEveryPage() {
    Map<String, Object> state = Map.of("group", Map.of("enabled", true, "by", "c-city", "sum_control_guid", "c-amount"));
    int data = 0;
    for (int offset = 0; offset < 6; offset += 2) {
      MatrixRequest req = MatrixRequest.of("persons").withTableState(state).withPage(offset, 2);
      ViewMatrix m = as(alice, () -> service.postMatrix(req));
      assertEquals(new Aggregate(5, 150.0), m.totals(), "offset " + offset);
      data += m.meta().returnedData();
    }
    assertEquals(5, data);
  }

  @Test
  void metaReportsCapOfTheServedSnapshot() {
    ViewMatrix wide = as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withMaxBaseRows(500)));
    assertEquals(500, wide.meta().maxBaseRows());

    ViewMatrix narrow = as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withMaxBaseRows(10)));
    assertEquals(500, narrow.meta().maxBaseRows());
    assertEquals(5, narrow.meta().baseLoaded());
  }

  @Test
  void ungroupedMatrixHasNoTotals() {
    ViewMatrix m = as(alice, () -> service.postMatrix(MatrixRequest.of("persons")));
    assertNull(m.totals());
  }

  @Test
  void sortAndFilterFollowRequestState() {
    Map<String, Object> state = Map.of(
        "sort", Map.of("control_guid", "c-amount", "direction", "asc"),
        "filters", Map.of("c-name", "R"));
    ViewMatrix m = as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withTableState(state).withPage(0, 10)));
    assertEquals(List.of("r2", "r3", "r4"), dataIds(m));
  }

  @Test
  void viewPolicyDropsDisallowedState() {
    Map<String, Object> state = Map.of(
        "sort", Map.of("control_guid", "c-amount", "direction", "asc"),
        "filters", Map.of("c-name", "anna"));
    ViewMatrix m = as(alice, () -> service.postMatrix(MatrixRequest.of("locked").withTableState(state).withPage(0, 10)));

    assertEquals(List.of("r5", "r4", "r3", "r2", "r1"), dataIds(m));
    assertEquals(Map.of("c-name", "anna"), m.tableStateSource().get("filters"));
    assertEquals(Map.of(), m.tableStateEffective().get("filters"));
  }

  @Test
  void foreignTableOverrideIsRejected() {
    assertThrows(InvalidViewInputException.class,
        () -> as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withTable("orders"))));
    assertThrows(InvalidViewInputException.class,
        () -> as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withTable("x; drop table y"))));
  }

  @Test
  void systemTablesMayStandInForEachOther() {
    records.put("sys_rollen", "g1", Map.of("NAME", "group"), T0);
    SessionContext admin = SessionContext.of("s-admin", "root", PdvmStamp.of(2025043.5), "ADMIN");
    ViewMatrix m = as(admin, () -> service.postMatrix(MatrixRequest.of("users").withTable("sys_rollen")));
    assertEquals("sys_rollen", m.table());
    assertEquals(List.of("g1"), dataIds(m));
  }

  @Test
  void restrictedTableRendersEmptyWithoutReading() {
    records.put("sys_benutzer", "u1", Map.of("NAME", "someone"), T0);

    ViewMatrix denied = as(alice, () -> service.postMatrix(MatrixRequest.of("users")));
    assertTrue(denied.meta().restricted());
    assertTrue(denied.rows().isEmpty());
    assertEquals(0, records.pageCalls);

    SessionContext admin = SessionContext.of("s-admin", "root", PdvmStamp.of(2025043.5), "admin");
    ViewMatrix allowed = as(admin, () -> service.postMatrix(MatrixRequest.of("users")));
    assertFalse(allowed.meta().restricted());
    assertEquals(List.of("u1"), dataIds(allowed));
  }

  @Test
  void pagingBoundsAreValidated() {
    assertThrows(InvalidViewInputException.class,
        () -> as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withPage(0, 51))));
    assertThrows(InvalidViewInputException.class,
        () -> as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withPage(-1, 2))));
    assertThrows(InvalidViewInputException.class,
        () -> as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withControls(List.of()))));
  }

  @Test
  void unknownViewIsNotFound() {
    assertThrows(ViewNotFoundException.class, () -> as(alice, () -> service.postMatrix(MatrixRequest.of("nope"))));
    assertThrows(ViewNotFoundException.class, () -> service.getDefinition("nope"));
  }

  @Test
  void operationsNeedABoundSession() {
    assertThrows(IllegalStateException.class, () -> service.postMatrix(MatrixRequest.of("persons")));
  }

  @Test
  void savedStateIsUsedByLaterRequests() {
    Map<String, Object> controls = Map.of("c-city", Map.of("show", false), "gone", Map.of("width", 120));
    Map<String, Object> tableState = Map.of("sort", Map.of("control_guid", "c-amount", "direction", "asc"));
    ViewStateView saved = as(alice,
        () -> service.putState("persons", null, null, new StateUpdate(controls, tableState)));

    ViewStateView loaded = as(alice, () -> service.getState("persons", null, "VIEW"));
    assertEquals(saved.controlsSource(), loaded.controlsSource());
    assertEquals(false, loaded.controlsSource().get("c-city").get("show"));
    assertEquals(Map.of("width", 120), loaded.controlsSource().get("gone"));
    assertEquals(saved.tableStateSource(), loaded.tableStateSource());

    ViewMatrix m = as(alice, () -> service.postMatrix(MatrixRequest.of("persons").withPage(0, 10)));
    assertEquals(List.of("r1", "r2", "r3", "r4", "r5"), dataIds(m));

    SessionContext other = SessionContext.of("s-other", "other", PdvmStamp.of(2025043.5));
    ViewStateView untouched = as(other, () -> service.getState("persons", null, null));
    assertEquals(true, untouched.controlsSource().get("c-city").get("show"));
  }

  @Test
  void partialUpdateKeepsPersistedParts() {
    Map<String, Object> tableState = Map.of("filters", Map.of("c-city", "koeln"));
    as(alice, () -> service.putState("persons", null, null, new StateUpdate(null, tableState)));
    as(alice, () -> service.putState("persons", null, null,
        new StateUpdate(Map.of("c-name", Map.of("width", 80)), null)));

    ViewStateView loaded = as(alice, () -> service.getState("persons", null, null));
    assertEquals(Map.of("c-city", "koeln"), loaded.tableStateSource().get("filters"));
    assertEquals(80, loaded.controlsSource().get("c-name").get("width"));
  }

  @Test
  void definitionListsDeclaredControls() {
    ViewDefinitionView def = service.getDefinition("persons");
    assertEquals("persons", def.rootTable());
    assertEquals(3, def.controls().size());
    assertEquals("c-name", def.controls().get(0).get("control_guid"));
  }

  @Test
  void baseRowsIgnoreUserState() {
    as(alice, () -> service.putState("persons", null, null,
        new StateUpdate(null, Map.of("filters", Map.of("c-city", "koeln")))));
    BaseRowsView base = as(alice, () -> service.getBase("persons", null, 3, true));
    assertFalse(base.restricted());
    List<String> ids = new ArrayList<>();
    for (MatrixRow r : base.rows()) ids.add(r.id());
    assertEquals(List.of("r5", "r4", "r3"), ids);
  }
}
