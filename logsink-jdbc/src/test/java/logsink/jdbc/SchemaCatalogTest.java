package logsink.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SchemaCatalogTest {

  @Test
  void columnsAreDeclaredOnce() {
    assertEquals(List.of("id", "logged_at", "log_level", "category", "event_id", "event_name",
            "thread_id", "message_template", "rendered_message", "properties", "scopes", "exception"),
        SchemaCatalog.allColumnNames());
    assertFalse(SchemaCatalog.insertableColumns().contains(LogColumn.ID));
    assertEquals(SchemaCatalog.columns().size() - 1, SchemaCatalog.insertableColumns().size());
  }

  @Test
  void ordinalsFollowDeclaration() {
    assertEquals(1, SchemaCatalog.ordinalOf(LogColumn.ID));
    assertEquals(SchemaCatalog.columns().size(), SchemaCatalog.ordinalOf(LogColumn.EXCEPTION));
    assertEquals(1, SchemaCatalog.insertOrdinalOf(LogColumn.LOGGED_AT));
    assertThrows(IllegalArgumentException.class, () -> SchemaCatalog.insertOrdinalOf(LogColumn.ID));
  }

  @Test
  void statementsAreDerivedFromColumns() {
    String insert = SchemaCatalog.insertSql();
    assertTrue(insert.startsWith("INSERT INTO log_entry (logged_at, "));
    assertEquals(SchemaCatalog.insertableColumns().size(), insert.chars().filter(c -> c == '?').count());
    assertEquals("SELECT " + String.join(", ", SchemaCatalog.allColumnNames()) + " FROM log_entry",
        SchemaCatalog.selectSql());
    assertTrue(SchemaCatalog.createTableSql().startsWith("CREATE TABLE IF NOT EXISTS log_entry ("));
  }

  @Test
  void createStatementsAreIdempotentOnH2() throws SQLException {
    try (Connection conn = DriverManager.getConnection("jdbc:h2:mem:" + UUID.randomUUID());
         Statement st = conn.createStatement()) {
      for (int i = 0; i < 2; i++) {
        for (String sql : SchemaCatalog.createStatements()) {
          st.execute(sql);
        }
      }
      try (ResultSet rs = st.executeQuery(SchemaCatalog.selectSql())) {
        assertEquals(SchemaCatalog.columns().size(), rs.getMetaData().getColumnCount());
        assertFalse(rs.next());
      }
    }
  }
}
