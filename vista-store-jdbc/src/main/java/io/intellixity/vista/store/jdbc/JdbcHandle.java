package io.intellixity.vista.store.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** Data source plus the schema the vista tables live in (resolved by application code). */
public final class JdbcHandle {
  private final String id;
  private final DataSource dataSource;
  private final String schema;

  public JdbcHandle(String id, DataSource dataSource, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.schema = (schema == null || schema.isBlank()) ? null : PostgresSql.requireIdentifier(schema.trim());
  }

  public String id() { return id; }
  public DataSource dataSource() { return dataSource; }
  public String schema() { return schema; }
}
