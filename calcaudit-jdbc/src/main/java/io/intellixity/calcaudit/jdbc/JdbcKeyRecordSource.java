package io.intellixity.calcaudit.jdbc;

import io.intellixity.calcaudit.audit.KeyRecordSource;
import io.intellixity.calcaudit.audit.KeyRecordSourceException;
import io.intellixity.calcaudit.model.KeyRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@link KeyRecordSource} reading the fund metadata tables over JDBC. */
public final class JdbcKeyRecordSource implements KeyRecordSource {
  private final JdbcHandle handle;

  public JdbcKeyRecordSource(JdbcHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public List<KeyRecord> fetch(String fundId) {
    Objects.requireNonNull(fundId, "fundId");
    String sql = MetadataQueries.keyRecords(handle);
    long start = System.nanoTime();
    JdbcTrace.sql(handle, "FETCH_KEYS", sql);
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, fundId);
      try (ResultSet rs = ps.executeQuery()) {
        List<KeyRecord> out = new ArrayList<>();
        while (rs.next()) out.add(KeyRecordRowMapper.map(rs));
        JdbcTrace.done("FETCH_KEYS", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new KeyRecordSourceException("Failed to fetch key records for fundId=" + fundId + " from " + handle.id(), e);
    } catch (IllegalArgumentException e) {
      throw new KeyRecordSourceException("Malformed key record for fundId=" + fundId + ": " + e.getMessage(), e);
    }
  }

  @Override
  public List<String> fundIds() {
    String sql = MetadataQueries.fundIds(handle);
    long start = System.nanoTime();
    JdbcTrace.sql(handle, "FUND_IDS", sql);
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql);
         ResultSet rs = ps.executeQuery()) {
      List<String> out = new ArrayList<>();
      while (rs.next()) {
        Object v = rs.getObject("fund_id");
        if (v != null) out.add(String.valueOf(v));
      }
      JdbcTrace.done("FUND_IDS", out.size(), System.nanoTime() - start);
      return out;
    } catch (SQLException e) {
      throw new KeyRecordSourceException("Failed to list funds from " + handle.id(), e);
    }
  }
}
