package io.intellixity.vista.server.web;

import io.intellixity.vista.cache.SessionCacheRegistry;
import io.intellixity.vista.cache.TableCacheSettings;
import io.intellixity.vista.engine.EngineSettings;
import io.intellixity.vista.engine.ViewService;
import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.error.UpstreamUnavailableException;
import io.intellixity.vista.error.ViewNotFoundException;
import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.model.RowDecoder;
import io.intellixity.vista.model.ViewDefinition;
import io.intellixity.vista.model.ViewDefinitionParser;
import io.intellixity.vista.query.OffsetPage;
import io.intellixity.vista.spi.RecordStore;
import io.intellixity.vista.spi.StoredViewState;
import io.intellixity.vista.spi.ViewDefinitionStore;
import io.intellixity.vista.spi.ViewStateStore;
import io.intellixity.vista.state.ViewStateKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class ViewControllerTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 1, 8, 0);

  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    mvc = mvcWith(Clock.fixed(Instant.parse("2025-02-12T12:00:00Z"), ZoneOffset.UTC));
  }

  private static MockMvc mvcWith(Clock clock) {
    ViewDefinition persons = ViewDefinitionParser.parse("persons", "Persons", Map.of(
        "ROOT", Map.of("TABLE", "persons"),
        "PERSON", Map.of("c-name", Map.of("gruppe", "P", "feld", "NAME", "type", "text"))));
    ViewDefinitionStore definitions = id -> {
      if (!"persons".equals(id)) throw new ViewNotFoundException("view not found: " + id);
      return persons;
    };
    List<DataRow> rows = List.of(
        RowDecoder.decode("r2", "bert", Map.of("P", Map.of("NAME", "bert")), false, null, null, T0.plusMinutes(2)),
        RowDecoder.decode("r1", "anna", Map.of("P", Map.of("NAME", "anna")), false, null, null, T0.plusMinutes(1)));

    ViewService service = new ViewService(definitions, new MapStates(), new SessionCacheRegistry(
        new ListRecords(rows), TableCacheSettings.DEFAULTS, 16, 16, Duration.ofMinutes(30), clock),
        EngineSettings.DEFAULTS, clock);

    return MockMvcBuilders.standaloneSetup(new ViewController(service))
        .setControllerAdvice(new ApiExceptionHandler())
        .addFilters(new SessionContextFilter(clock))
        .build();
  }

  @Test
  void rendersMatrixPage() throws Exception {
    mvc.perform(post("/api/views/persons/matrix")
            .header(SessionContextFilter.SESSION_HEADER, "s1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"limit\":1}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rows[0].id").value("r2"))
        .andExpect(jsonPath("$.rows[0].kind").value("data"))
        .andExpect(jsonPath("$.rows[0].values['c-name']").value("bert"))
        .andExpect(jsonPath("$.meta.hasMore").value(true))
        .andExpect(jsonPath("$.meta.totalAfterFilter").value(2));
  }

  @Test
  void repeatedRequestWithoutAsOfHitsResultCache() throws Exception {
    MockMvc ticking = mvcWith(new TickingClock(Instant.parse("2025-02-12T12:00:00Z"), Duration.ofSeconds(5)));
    for (boolean expectedHit : new boolean[] {false, true}) {
      ticking.perform(post("/api/views/persons/matrix")
              .header(SessionContextFilter.SESSION_HEADER, "s1")
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"limit\":10}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.meta.cacheHit").value(expectedHit))
          .andExpect(jsonPath("$.meta.totalAfterFilter").value(2));
    }
  }

  @Test
  void savesAndReadsState() throws Exception {
    mvc.perform(put("/api/views/persons/state")
            .header(SessionContextFilter.SESSION_HEADER, "s1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"tableStateSource\":{\"sort\":{\"control_guid\":\"c-name\",\"direction\":\"desc\"}}}"))
        .andExpect(status().isOk());

    mvc.perform(get("/api/views/persons/state").header(SessionContextFilter.SESSION_HEADER, "s2")
            .header(SessionContextFilter.USER_HEADER, "s1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tableStateSource.sort.direction").value("desc"))
        .andExpect(jsonPath("$.tableStateEffective.sort.control_guid").value("c-name"));
  }

  @Test
  void errorsMapToStatusCodes() throws Exception {
    mvc.perform(get("/api/views/missing").header(SessionContextFilter.SESSION_HEADER, "s1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));

    mvc.perform(post("/api/views/persons/matrix")
            .header(SessionContextFilter.SESSION_HEADER, "s1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"limit\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_input"));

    mvc.perform(post("/api/views/persons/matrix")
            .header(SessionContextFilter.SESSION_HEADER, "s1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{not json"))
        .andExpect(status().isBadRequest());

    mvc.perform(get("/api/views/persons/base"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void statusOfEachErrorKind() {
    assertEquals(HttpStatus.NOT_FOUND, ApiExceptionHandler.statusOf(new ViewNotFoundException("x")));
    assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusOf(new InvalidViewInputException("x")));
    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiExceptionHandler.statusOf(new UpstreamUnavailableException("x")));
  }

  private static final class MapStates implements ViewStateStore {
    private final Map<String, StoredViewState> saved = new HashMap<>();

    @Override
    public StoredViewState load(String userId, ViewStateKey key) {
      return saved.getOrDefault(userId + "|" + key, StoredViewState.EMPTY);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void save(String userId, ViewStateKey key, Map<String, ?> controls, Map<String, ?> tableState) {
      saved.put(userId + "|" + key,
          new StoredViewState((Map<String, Object>) controls, (Map<String, Object>) tableState));
    }
  }

  /** Moves forward by a fixed step on every read. */
  private static final class TickingClock extends Clock {
    private final AtomicReference<Instant> now;
    private final Duration step;

    TickingClock(Instant start, Duration step) {
      this.now = new AtomicReference<>(start);
      this.step = step;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      throw new UnsupportedOperationException();
    }

    @Override
    public Instant instant() {
      return now.getAndUpdate(i -> i.plus(step));
    }
  }

  private record ListRecords(List<DataRow> rows) implements RecordStore {
    @Override
    public List<DataRow> fetchPage(String table, boolean includeRetired, OffsetPage page) {
      if (page.offset() >= rows.size()) return List.of();
      return rows.subList(page.offset(), Math.min(rows.size(), page.end()));
    }

    @Override
    public List<DataRow> fetchChangedSince(String table, boolean includeRetired, LocalDateTime since) {
      return List.of();
    }
  }
}
