package io.intellixity.vista.store.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vista.spi.StoredViewState;
import io.intellixity.vista.spi.ViewStateStore;
import io.intellixity.vista.state.ViewStateKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;

/** Per-user view state in {@code sys_view_state(user_id, state_key, controls, table_state, modified_at)}. */
public final class JdbcViewStateStore implements ViewStateStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcViewStateStore.class);

  private final JdbcHandle handle;
  private final String table;
  private final JsonColumns json;

  public JdbcViewStateStore(JdbcHandle handle, String table, ObjectMapper mapper) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.table = PostgresSql.requireIdentifier(table);
    this.json = new JsonColumns(mapper);
  }

  @Override
  public StoredViewState load(String userId, ViewStateKey key) {
    String sql = PostgresSql.selectState(handle.schema(), table);
    log.debug("vista.jdbc op=STATE_LOAD handleId={} key={} sql={}", handle.id(), key, sql);
    try (Connection c = handle.dataSource().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, userId);
      ps.setString(2, key.serialize());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return StoredViewState.EMPTY;
        return new StoredViewState(
            json.readObject(rs.getObject("controls"), "controls"),
            json.readObject(rs.getObject("table_state"), "table_state"));
      }
    } catch (SQLException e) {
      throw SqlErrors.translate("STATE_LOAD", table, e);
    }
  }

  @Override
  public void save(String userId, ViewStateKey key, Map<String, ?> controls, Map<String, ?> tableState) {
    String sql = PostgresSql.upsertState(handle.schema(), table);
    log.debug("vista.jdbc op=STATE_SAVE handleId={} key={} sql={}", handle.id(), key, sql);
    try (Connection c = handle.dataSource().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, userId);
      ps.setString(2, key.serialize());
      ps.setObject(3, json.jsonb(controls));
      ps.setObject(4, json.jsonb(tableState));
      ps.executeUpdate();
    } catch (SQLException e) {
      throw SqlErrors.translate("STATE_SAVE", table, e);
    }
  }
}
