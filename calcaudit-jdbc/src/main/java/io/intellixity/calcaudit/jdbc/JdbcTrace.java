package io.intellixity.calcaudit.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** DEBUG tracing of metadata SQL, shared by the JDBC readers. */
final class JdbcTrace {
  private static final Logger log = LoggerFactory.getLogger("io.intellixity.calcaudit.jdbc");

  private JdbcTrace() {}

  static void sql(JdbcHandle handle, String op, String sql) {
    if (!log.isDebugEnabled()) return;
    log.debug("calcaudit.jdbc op={} handleId={} schema={} sql={}",
        op, handle.id(), handle.schema() == null ? "null" : handle.schema(), sql);
  }

  static void done(String op, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("calcaudit.jdbc_done op={} rows={} durationMs={}", op, rows, durationNanos / 1_000_000.0);
  }
}
