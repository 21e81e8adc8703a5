package io.intellixity.calcaudit.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** DataSource plus the schema holding the metadata tables (resolved by application code). */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public String id() { return id; }
  public DataSource client() { return client; }

  /** Schema name, or {@code null} to use the connection's search path. */
  public String schema() { return schema; }

  /** {@code table}, qualified with the schema when there is one. */
  String table(String table) {
    return schema == null ? table : schema + "." + table;
  }
}
