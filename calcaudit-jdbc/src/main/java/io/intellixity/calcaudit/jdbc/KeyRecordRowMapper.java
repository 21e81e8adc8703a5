package io.intellixity.calcaudit.jdbc;

import io.intellixity.calcaudit.model.Context;
import io.intellixity.calcaudit.model.KeyRecord;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps a row of {@link MetadataQueries#keyRecords(JdbcHandle)} to a {@link KeyRecord}.\n
 *
 * NULL calculation_level reads as 0 and NULL is_current as point-in-time. The full key is composed from fund id,
 * datagroup lookup, key lookup and context, the same way formula references are.\n
 */
final class KeyRecordRowMapper {
  private KeyRecordRowMapper() {}

  static KeyRecord map(ResultSet rs) throws SQLException {
    String fundId = rs.getString("fund_id");
    String datagroup = rs.getString("datagroup_lookup");
    String key = rs.getString("key_lookup");
    int level = rs.getInt("calculation_level");
    boolean current = rs.getBoolean("is_current");
    String formula = rs.getString("formula");

    return new KeyRecord(fundId, datagroup, key, KeyRecord.fullKey(fundId, datagroup, key, Context.ofCurrentFlag(current)),
        level, current, formula);
  }
}
