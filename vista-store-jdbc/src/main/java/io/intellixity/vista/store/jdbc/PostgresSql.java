package io.intellixity.vista.store.jdbc;

import io.intellixity.vista.error.InvalidViewInputException;

import java.util.regex.Pattern;

/** SQL text of the record, view and state queries. Identifiers are validated and always quoted. */
final class PostgresSql {
  static final String RECORD_COLUMNS = "uid, name, daten, historisch, gilt_bis, created_at, modified_at";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  private PostgresSql() {}

  static String requireIdentifier(String ident) {
    if (ident == null || !IDENTIFIER.matcher(ident).matches()) {
      throw new InvalidViewInputException("invalid SQL identifier: " + ident);
    }
    return ident;
  }

  static String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  static String qualified(String schema, String table) {
    String t = quoteIdent(requireIdentifier(table));
    return schema == null ? t : quoteIdent(requireIdentifier(schema)) + "." + t;
  }

  /** Page of records, most recently modified first. Binds: limit, offset. */
  static String selectPage(String schema, String table, boolean includeRetired) {
    return "SELECT " + RECORD_COLUMNS + " FROM " + qualified(schema, table)
        + (includeRetired ? "" : " WHERE historisch = 0")
        + " ORDER BY modified_at DESC NULLS LAST, uid"
        + " LIMIT ? OFFSET ?";
  }

  /** Records changed after a watermark, oldest first. Binds: the watermark when {@code bounded}. */
  static String selectChangedSince(String schema, String table, boolean includeRetired, boolean bounded) {
    StringBuilder sql = new StringBuilder("SELECT ").append(RECORD_COLUMNS)
        .append(" FROM ").append(qualified(schema, table));
    String glue = " WHERE ";
    if (bounded) {
      sql.append(glue).append("modified_at > ?");
      glue = " AND ";
    }
    if (!includeRetired) sql.append(glue).append("historisch = 0");
    return sql.append(" ORDER BY modified_at ASC NULLS FIRST, uid").toString();
  }

  /** Binds: uid. */
  static String selectView(String schema, String table) {
    return "SELECT uid, name, daten FROM " + qualified(schema, table) + " WHERE uid = ?";
  }

  /** Binds: user_id, state_key. */
  static String selectState(String schema, String table) {
    return "SELECT controls, table_state FROM " + qualified(schema, table) + " WHERE user_id = ? AND state_key = ?";
  }

  /** Binds: user_id, state_key, controls, table_state. */
  static String upsertState(String schema, String table) {
    return "INSERT INTO " + qualified(schema, table) + " (user_id, state_key, controls, table_state, modified_at)"
        + " VALUES (?, ?, ?, ?, now())"
        + " ON CONFLICT (user_id, state_key) DO UPDATE SET"
        + " controls = EXCLUDED.controls, table_state = EXCLUDED.table_state, modified_at = EXCLUDED.modified_at";
  }
}
