package logsink.jdbc;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Naming of the on-disk database. The schema version is embedded in the file name:
 * {@code <dir>/<baseName>.v<version>.mv.db}.
 */
public final class DatabaseFiles {
  static final String H2_DATA_SUFFIX = ".mv.db";
  private static final String NAME_PATTERN = "[A-Za-z0-9_-]+";

  private DatabaseFiles() {}

  /**
   * Path passed to H2, without the data file suffix.
   */
  public static Path databasePath(Path directory, String baseName) {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(baseName, "baseName");
    if (!baseName.matches(NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid database name: " + baseName);
    }
    return directory.toAbsolutePath().resolve(baseName + ".v" + SchemaCatalog.SCHEMA_VERSION);
  }

  /** The data file H2 creates for {@code databasePath}. */
  public static Path dataFile(Path databasePath) {
    return databasePath.resolveSibling(databasePath.getFileName() + H2_DATA_SUFFIX);
  }

  public static String jdbcUrl(Path databasePath) {
    return "jdbc:h2:file:" + databasePath.toAbsolutePath();
  }
}
