package logsink.jdbc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseFilesTest {

  @TempDir
  Path dir;

  @Test
  void embedsSchemaVersionInName() {
    Path path = DatabaseFiles.databasePath(dir, "app-logs");

    assertEquals(dir.toAbsolutePath().resolve("app-logs.v" + SchemaCatalog.SCHEMA_VERSION), path);
    assertEquals("app-logs.v" + SchemaCatalog.SCHEMA_VERSION + ".mv.db",
        DatabaseFiles.dataFile(path).getFileName().toString());
    assertEquals("jdbc:h2:file:" + path, DatabaseFiles.jdbcUrl(path));
  }

  @Test
  void rejectsUnsafeNames() {
    assertThrows(IllegalArgumentException.class, () -> DatabaseFiles.databasePath(dir, "../escape"));
    assertThrows(IllegalArgumentException.class, () -> DatabaseFiles.databasePath(dir, "a;b"));
    assertThrows(IllegalArgumentException.class, () -> DatabaseFiles.databasePath(dir, ""));
    assertThrows(NullPointerException.class, () -> DatabaseFiles.databasePath(dir, null));
  }
}
