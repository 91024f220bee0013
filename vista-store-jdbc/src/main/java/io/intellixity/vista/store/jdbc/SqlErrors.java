package io.intellixity.vista.store.jdbc;

import io.intellixity.vista.error.UpstreamUnavailableException;
import io.intellixity.vista.error.ViewMatrixException;
import io.intellixity.vista.error.ViewNotFoundException;

import java.sql.SQLException;

/** Maps JDBC failures onto the engine's error taxonomy. */
final class SqlErrors {
  static final String UNDEFINED_TABLE = "42P01";

  private SqlErrors() {}

  static ViewMatrixException translate(String op, String table, SQLException e) {
    if (UNDEFINED_TABLE.equals(e.getSQLState())) {
      return new ViewNotFoundException("unknown table: " + table, e);
    }
    return new UpstreamUnavailableException(op + " on " + table + " failed: " + e.getMessage(), e);
  }
}
