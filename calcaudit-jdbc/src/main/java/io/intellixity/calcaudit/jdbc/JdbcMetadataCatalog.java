package io.intellixity.calcaudit.jdbc;

import io.intellixity.calcaudit.audit.KeyRecordSourceException;
import io.intellixity.calcaudit.catalog.DatagroupCell;
import io.intellixity.calcaudit.catalog.MetadataCatalog;
import io.intellixity.calcaudit.catalog.MetadataStats;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@link MetadataCatalog} over the fund, datagroup and key master tables. */
public final class JdbcMetadataCatalog implements MetadataCatalog {
  private final JdbcHandle handle;

  public JdbcMetadataCatalog(JdbcHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public List<DatagroupCell> datagroupCells() {
    String sql = MetadataQueries.datagroupCells(handle);
    long start = System.nanoTime();
    JdbcTrace.sql(handle, "DATAGROUP_CELLS", sql);
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(sql);
         ResultSet rs = ps.executeQuery()) {
      List<DatagroupCell> out = new ArrayList<>();
      while (rs.next()) {
        String fundName = rs.getString("fund_name");
        String datagroupName = rs.getString("datagroup_name");
        out.add(new DatagroupCell(
            rs.getString("fund_id"),
            fundName == null ? "" : fundName,
            rs.getString("datagroup_id"),
            datagroupName == null ? "" : datagroupName,
            rs.getInt("key_count")));
      }
      JdbcTrace.done("DATAGROUP_CELLS", out.size(), System.nanoTime() - start);
      return out;
    } catch (SQLException e) {
      throw new KeyRecordSourceException("Failed to read the fund/datagroup catalog from " + handle.id(), e);
    }
  }

  @Override
  public MetadataStats stats() {
    long start = System.nanoTime();
    String dgSql = MetadataQueries.datagroupStats(handle);
    String keySql = MetadataQueries.keyStats(handle);
    JdbcTrace.sql(handle, "DATAGROUP_STATS", dgSql);
    JdbcTrace.sql(handle, "KEY_STATS", keySql);
    try (Connection c = handle.client().getConnection()) {
      int dgTotal = 0;
      int dgMissing = 0;
      try (PreparedStatement ps = c.prepareStatement(dgSql); ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          dgTotal = rs.getInt("total_count");
          dgMissing = rs.getInt("missing_count");
        }
      }
      try (PreparedStatement ps = c.prepareStatement(keySql); ResultSet rs = ps.executeQuery()) {
        MetadataStats stats = rs.next()
            ? new MetadataStats(dgTotal, dgMissing,
                rs.getInt("total_count"),
                rs.getInt("missing_count"),
                rs.getInt("raw_count"),
                rs.getInt("calculated_count"),
                rs.getInt("missing_formula_count"))
            : new MetadataStats(dgTotal, dgMissing, 0, 0, 0, 0, 0);
        JdbcTrace.done("STATS", 2, System.nanoTime() - start);
        return stats;
      }
    } catch (SQLException e) {
      throw new KeyRecordSourceException("Failed to read metadata statistics from " + handle.id(), e);
    }
  }
}
