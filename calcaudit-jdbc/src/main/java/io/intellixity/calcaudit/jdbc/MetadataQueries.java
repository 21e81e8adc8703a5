package io.intellixity.calcaudit.jdbc;

/** SQL over the fund metadata tables. */
final class MetadataQueries {
  static final String KEY_MASTER = "lm_key_metadata_master";
  static final String DATAGROUP_MASTER = "lm_datagroup_metadata_master";
  static final String FUNDS = "lm_funds";

  private MetadataQueries() {}

  /** Key records of one fund; one bind: the fund id as text. */
  static String keyRecords(JdbcHandle h) {
    return "SELECT CAST(km.fund_id AS VARCHAR) AS fund_id,"
        + " dgm.datagroup_lookup AS datagroup_lookup,"
        + " km.key_lookup AS key_lookup,"
        + " km.calculation_level AS calculation_level,"
        + " km.is_current AS is_current,"
        + " km.formula AS formula"
        + " FROM " + h.table(KEY_MASTER) + " km"
        + " INNER JOIN " + h.table(DATAGROUP_MASTER) + " dgm ON km.datagroup_id = dgm.id"
        + " WHERE CAST(km.fund_id AS VARCHAR) = ?"
        + " AND km.is_deleted = FALSE AND dgm.is_deleted = FALSE"
        + " ORDER BY dgm.sequence, km.sequence, km.id";
  }

  static String fundIds(JdbcHandle h) {
    return "SELECT DISTINCT km.fund_id AS fund_id FROM " + h.table(KEY_MASTER) + " km"
        + " WHERE km.is_deleted = FALSE ORDER BY km.fund_id";
  }

  /** Live datagroups per live fund with their live key counts; datagroups without keys count 0. */
  static String datagroupCells(JdbcHandle h) {
    return "SELECT CAST(f.id AS VARCHAR) AS fund_id,"
        + " f.fund_name AS fund_name,"
        + " CAST(dgm.id AS VARCHAR) AS datagroup_id,"
        + " dgm.datagroup_display_name AS datagroup_name,"
        + " COUNT(km.id) AS key_count"
        + " FROM " + h.table(DATAGROUP_MASTER) + " dgm"
        + " INNER JOIN " + h.table(FUNDS) + " f ON dgm.fund_id = f.id"
        + " LEFT JOIN " + h.table(KEY_MASTER) + " km ON km.datagroup_id = dgm.id AND km.is_deleted = FALSE"
        + " WHERE dgm.is_deleted = FALSE AND f.is_deleted = FALSE"
        + " GROUP BY f.id, f.fund_name, dgm.id, dgm.datagroup_display_name, dgm.sequence"
        + " ORDER BY f.fund_name, dgm.sequence, dgm.id";
  }

  static String datagroupStats(JdbcHandle h) {
    return "SELECT COUNT(*) AS total_count,"
        + " COUNT(*) FILTER (WHERE description IS NULL OR TRIM(description) = '') AS missing_count"
        + " FROM " + h.table(DATAGROUP_MASTER)
        + " WHERE is_deleted = FALSE";
  }

  static String keyStats(JdbcHandle h) {
    return "SELECT COUNT(*) AS total_count,"
        + " COUNT(*) FILTER (WHERE description IS NULL OR TRIM(description) = '') AS missing_count,"
        + " COUNT(*) FILTER (WHERE is_raw = TRUE) AS raw_count,"
        + " COUNT(*) FILTER (WHERE is_calculated = TRUE) AS calculated_count,"
        + " COUNT(*) FILTER (WHERE is_calculated = TRUE AND formula IS NULL) AS missing_formula_count"
        + " FROM " + h.table(KEY_MASTER)
        + " WHERE is_deleted = FALSE";
  }
}
