package io.intellixity.vista.store.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.query.OffsetPage;
import io.intellixity.vista.spi.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL record tables: {@code uid uuid, name text, daten jsonb, historisch int, gilt_bis timestamp|text,
 * created_at timestamp, modified_at timestamp}.
 */
public final class JdbcRecordStore implements RecordStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

  private final JdbcHandle handle;
  private final JdbcRowReader reader;

  public JdbcRecordStore(JdbcHandle handle, ObjectMapper mapper) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.reader = new JdbcRowReader(new JsonColumns(mapper));
  }

  @Override
  public List<DataRow> fetchPage(String table, boolean includeRetired, OffsetPage page) {
    String sql = PostgresSql.selectPage(handle.schema(), table, includeRetired);
    return query("PAGE", table, sql, ps -> {
      ps.setInt(1, page.limit());
      ps.setInt(2, page.offset());
    });
  }

  @Override
  public List<DataRow> fetchChangedSince(String table, boolean includeRetired, LocalDateTime since) {
    String sql = PostgresSql.selectChangedSince(handle.schema(), table, includeRetired, since != null);
    return query("DELTA", table, sql, ps -> {
      if (since != null) ps.setObject(1, since);
    });
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  private List<DataRow> query(String op, String table, String sql, Binder binder) {
    long start = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("vista.jdbc op={} handleId={} schema={} sql={}", op, handle.id(), handle.schema(), sql);
    }
    try (Connection c = handle.dataSource().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      binder.bind(ps);
      try (ResultSet rs = ps.executeQuery()) {
        List<DataRow> out = new ArrayList<>();
        while (rs.next()) out.add(reader.read(rs));
        if (log.isDebugEnabled()) {
          log.debug("vista.jdbc_done op={} table={} rows={} durationMs={}",
              op, table, out.size(), (System.nanoTime() - start) / 1_000_000.0);
        }
        return out;
      }
    } catch (SQLException e) {
      throw SqlErrors.translate(op, table, e);
    }
  }
}
