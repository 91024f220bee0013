package io.intellixity.vista.store.jdbc;

import io.intellixity.vista.model.DataRow;
import io.intellixity.vista.model.RowDecoder;
import io.intellixity.vista.temporal.PdvmStamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/** Reads one record row ({@link PostgresSql#RECORD_COLUMNS}) into a decoded {@link DataRow}. */
final class JdbcRowReader {
  private static final Logger log = LoggerFactory.getLogger(JdbcRowReader.class);

  private final JsonColumns json;

  JdbcRowReader(JsonColumns json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  DataRow read(ResultSet rs) throws SQLException {
    Object uid = rs.getObject("uid");
    Object retired = rs.getObject("historisch");
    return new DataRow(
        String.valueOf(uid),
        rs.getString("name"),
        RowDecoder.decodeFields(json.readObject(rs.getObject("daten"), "daten")),
        retired instanceof Number n ? n.intValue() != 0 : Boolean.TRUE.equals(retired),
        validUntil(rs.getObject("gilt_bis")),
        rs.getObject("created_at", LocalDateTime.class),
        rs.getObject("modified_at", LocalDateTime.class));
  }

  /**
   * {@code gilt_bis} is a timestamp in some tables and text in others. Text holds either a stamp
   * ({@code "9999365.00000"}) or an ISO date / date-time. Blank or unreadable values mean "no date".
   */
  static PdvmStamp validUntil(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Timestamp ts) return PdvmStamp.of(ts.toLocalDateTime());
    if (raw instanceof java.sql.Date d) return PdvmStamp.of(d.toLocalDate());
    if (raw instanceof LocalDateTime dt) return PdvmStamp.of(dt);
    if (raw instanceof OffsetDateTime odt) return PdvmStamp.of(odt.toLocalDateTime());
    if (raw instanceof LocalDate d) return PdvmStamp.of(d);
    String s = String.valueOf(raw).trim();
    if (s.isEmpty()) return null;
    PdvmStamp stamp = PdvmStamp.tryParse(s);
    return stamp != null ? stamp : parseIso(s);
  }

  private static PdvmStamp parseIso(String s) {
    String iso = s.length() > 10 && s.charAt(10) == ' ' ? s.substring(0, 10) + 'T' + s.substring(11) : s;
    try {
      if (iso.length() == 10) return PdvmStamp.of(LocalDate.parse(iso));
      TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
      return t instanceof OffsetDateTime odt ? PdvmStamp.of(odt.toLocalDateTime()) : PdvmStamp.of((LocalDateTime) t);
    } catch (DateTimeParseException e) {
      log.debug("vista.jdbc op=ROW_READ column=gilt_bis value={} unreadable, treated as no date", s);
      return null;
    }
  }
}
