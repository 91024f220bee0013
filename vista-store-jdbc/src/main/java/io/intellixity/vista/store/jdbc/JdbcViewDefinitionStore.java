package io.intellixity.vista.store.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.error.ViewNotFoundException;
import io.intellixity.vista.model.ViewDefinition;
import io.intellixity.vista.model.ViewDefinitionParser;
import io.intellixity.vista.spi.ViewDefinitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.UUID;

/** View definitions stored as documents in a record table (default {@code sys_viewdaten}), keyed by uid. */
public final class JdbcViewDefinitionStore implements ViewDefinitionStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcViewDefinitionStore.class);

  private final JdbcHandle handle;
  private final String table;
  private final JsonColumns json;

  public JdbcViewDefinitionStore(JdbcHandle handle, String table, ObjectMapper mapper) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.table = PostgresSql.requireIdentifier(table);
    this.json = new JsonColumns(mapper);
  }

  @Override
  public ViewDefinition load(String viewId) {
    UUID uid = parseId(viewId);
    String sql = PostgresSql.selectView(handle.schema(), table);
    log.debug("vista.jdbc op=VIEW handleId={} sql={}", handle.id(), sql);
    try (Connection c = handle.dataSource().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setObject(1, uid);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) throw new ViewNotFoundException("view not found: " + viewId);
        return ViewDefinitionParser.parse(uid.toString(), rs.getString("name"),
            json.readObject(rs.getObject("daten"), "daten"));
      }
    } catch (SQLException e) {
      throw SqlErrors.translate("VIEW", table, e);
    }
  }

  static UUID parseId(String viewId) {
    try {
      return UUID.fromString(viewId == null ? "" : viewId.trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidViewInputException("view id is not a UUID: " + viewId);
    }
  }
}
