package io.intellixity.calcaudit.jdbc;

import io.intellixity.calcaudit.audit.KeyRecordSourceException;
import io.intellixity.calcaudit.catalog.DatagroupCell;
import io.intellixity.calcaudit.catalog.MetadataStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
final class JdbcMetadataCatalogTest {
  @Mock DataSource dataSource;
  @Mock Connection connection;
  @Mock PreparedStatement statement;
  @Mock PreparedStatement keyStatement;
  @Mock ResultSet rs;
  @Mock ResultSet keyRs;

  private JdbcMetadataCatalog catalog;

  @BeforeEach
  void setUp() {
    catalog = new JdbcMetadataCatalog(new JdbcHandle("jdbc:test", dataSource, "meta"));
  }

  @Test
  void readsDatagroupCellsWithKeyCounts() throws Exception {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(rs);
    when(rs.next()).thenReturn(true, true, false);
    when(rs.getString("fund_id")).thenReturn("10", "10");
    when(rs.getString("fund_name")).thenReturn("Fund A", "Fund A");
    when(rs.getString("datagroup_id")).thenReturn("7", "8");
    when(rs.getString("datagroup_name")).thenReturn("Returns", "Fees");
    when(rs.getInt("key_count")).thenReturn(12, 0);

    List<DatagroupCell> cells = catalog.datagroupCells();

    assertEquals(List.of(
        new DatagroupCell("10", "Fund A", "7", "Returns", 12),
        new DatagroupCell("10", "Fund A", "8", "Fees", 0)), cells);
    assertFalse(cells.get(1).hasKeys());
    verify(connection).prepareStatement(argThat((String sql) ->
        sql.contains("FROM meta.lm_datagroup_metadata_master dgm")
            && sql.contains("JOIN meta.lm_funds f")
            && sql.contains("LEFT JOIN meta.lm_key_metadata_master km")
            && sql.contains("dgm.is_deleted = FALSE AND f.is_deleted = FALSE")));
    verify(connection).close();
  }

  @Test
  void combinesDatagroupAndKeyStatistics() throws Exception {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement, keyStatement);
    when(statement.executeQuery()).thenReturn(rs);
    when(keyStatement.executeQuery()).thenReturn(keyRs);
    when(rs.next()).thenReturn(true);
    when(rs.getInt("total_count")).thenReturn(40);
    when(rs.getInt("missing_count")).thenReturn(3);
    when(keyRs.next()).thenReturn(true);
    when(keyRs.getInt("total_count")).thenReturn(900);
    when(keyRs.getInt("missing_count")).thenReturn(25);
    when(keyRs.getInt("raw_count")).thenReturn(600);
    when(keyRs.getInt("calculated_count")).thenReturn(300);
    when(keyRs.getInt("missing_formula_count")).thenReturn(4);

    assertEquals(new MetadataStats(40, 3, 900, 25, 600, 300, 4), catalog.stats());
    verify(statement).close();
    verify(keyStatement).close();
    verify(connection).close();
  }

  @Test
  void statsQueriesCountMissingDescriptionsAndFormulas() {
    JdbcHandle h = new JdbcHandle("jdbc:test", dataSource, null);
    assertTrue(MetadataQueries.datagroupStats(h).contains("TRIM(description) = ''"));
    assertTrue(MetadataQueries.keyStats(h).contains("is_calculated = TRUE AND formula IS NULL"));
  }

  @Test
  void failureBecomesSourceException() throws Exception {
    SQLException boom = new SQLException("timeout");
    when(dataSource.getConnection()).thenThrow(boom);

    KeyRecordSourceException ex = assertThrows(KeyRecordSourceException.class, () -> catalog.stats());
    assertSame(boom, ex.getCause());
    assertThrows(KeyRecordSourceException.class, () -> catalog.datagroupCells());
  }
}
