package logsink.jdbc;

import logsink.LogLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionGuardTest {
  private static final String COUNT = "SELECT COUNT(*) FROM " + SchemaCatalog.TABLE;

  @TempDir
  Path dir;

  @Test
  void createsDatabaseAndTableOnFirstUse() {
    try (ConnectionGuard guard = ConnectionGuard.builder().databaseFile(dir, "lazy").build()) {
      assertFalse(Files.exists(guard.databaseFile()));
      assertEquals(0L, guard.databaseFileSize());

      long count = guard.withReadConnection(conn -> JdbcTemplate.queryForLong(conn, COUNT));

      assertEquals(0L, count);
      assertTrue(Files.exists(guard.databaseFile()));
      assertTrue(guard.databaseFileSize() > 0);
      assertTrue(guard.databaseFile().getFileName().toString().endsWith(".v1.mv.db"));
    }
  }

  @Test
  void fileCanBeDeletedAfterClose() throws Exception {
    ConnectionGuard guard = ConnectionGuard.builder().databaseFile(dir, "release").build();
    new H2LogStore(guard).insertBatch(List.of(
        TestEntries.entry(LogLevel.INFORMATION, "c", "m", 0)));

    guard.close();

    Files.delete(guard.databaseFile());
    assertFalse(Files.exists(guard.databaseFile()));
  }

  @Test
  void useAfterCloseThrows() {
    ConnectionGuard guard = TestEntries.memoryGuard();
    guard.withWriteAccess(conn -> null);
    guard.close();
    guard.close();

    assertTrue(guard.isClosed());
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> guard.withWriteAccess(conn -> null));
    assertTrue(ex.getMessage().contains("closed"));
    assertThrows(IllegalStateException.class, () -> guard.withReadConnection(conn -> null));
  }

  @Test
  void transactionRollsBackOnFailure() {
    try (ConnectionGuard guard = TestEntries.memoryGuard()) {
      H2LogStore store = new H2LogStore(guard);
      Object[] row = store.toRow(TestEntries.entry(LogLevel.ERROR, "c", "m", 0));

      assertThrows(IllegalStateException.class, () -> guard.inTransaction(conn -> {
        JdbcTemplate.update(conn, SchemaCatalog.insertSql(), row);
        throw new IllegalStateException("abort");
      }));

      long afterRollback = guard.withReadConnection(conn -> JdbcTemplate.queryForLong(conn, COUNT));
      assertEquals(0L, afterRollback);
      // auto-commit restored: a plain write is visible to the pool
      guard.withWriteAccess(conn -> JdbcTemplate.update(conn, SchemaCatalog.insertSql(), row));
      long afterPlainWrite = guard.withReadConnection(conn -> JdbcTemplate.queryForLong(conn, COUNT));
      assertEquals(1L, afterPlainWrite);
    }
  }

  @Test
  void reopensInvalidWriterConnection() throws Exception {
    String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    List<Connection> opened = new CopyOnWriteArrayList<>();
    try (ConnectionGuard guard = ConnectionGuard.builder()
        .connectionProvider(() -> {
          Connection conn = DriverManager.getConnection(url);
          opened.add(conn);
          return conn;
        })
        .build()) {
      guard.withWriteAccess(conn -> null);
      opened.get(0).close();

      long count = guard.withReadConnection(conn -> JdbcTemplate.queryForLong(conn, COUNT));

      assertEquals(0L, count);
      assertEquals(2, opened.size());
    }
  }

  @Test
  void providerOnlyGuardReadsThroughWriter() {
    AtomicInteger opens = new AtomicInteger();
    String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    try (ConnectionGuard guard = ConnectionGuard.builder()
        .connectionProvider(() -> {
          opens.incrementAndGet();
          return DriverManager.getConnection(url);
        })
        .readerPoolSize(4)
        .build()) {
      guard.withReadConnection(conn -> JdbcTemplate.queryForLong(conn, COUNT));
      guard.withReadConnection(conn -> JdbcTemplate.queryForLong(conn, COUNT));

      assertEquals(1, opens.get());
      assertNull(guard.jdbcUrl());
      assertNull(guard.databaseFile());
      assertEquals(0L, guard.databaseFileSize());
    }
  }

  @Test
  void compactOnCloseShutsDownCleanly() {
    ConnectionGuard guard = ConnectionGuard.builder()
        .databaseFile(dir, "compact")
        .compactOnClose(true)
        .build();
    guard.withWriteAccess(conn -> null);

    assertDoesNotThrow(guard::close);
    assertTrue(Files.exists(guard.databaseFile()));
  }

  @Test
  void sqlFailuresAreWrapped() {
    try (ConnectionGuard guard = TestEntries.memoryGuard()) {
      assertThrows(LogStoreException.class, () ->
          guard.withWriteAccess(conn -> conn.createStatement().execute("SELECT * FROM missing_table")));
    }
  }

  @Test
  void builderValidation() {
    assertThrows(IllegalArgumentException.class, () -> ConnectionGuard.builder().build());
    assertThrows(IllegalArgumentException.class, () -> ConnectionGuard.builder()
        .databaseFile(dir, "a")
        .jdbcUrl("jdbc:h2:mem:a")
        .build());
    assertThrows(IllegalArgumentException.class, () -> ConnectionGuard.builder()
        .jdbcUrl("jdbc:h2:mem:a")
        .readerPoolSize(-1)
        .build());
  }
}
