package logsink.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import logsink.spi.ConnectionProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the single writable connection to the embedded database and serializes every
 * write against it.
 *
 * <p>{@link #withWriteAccess} and {@link #inTransaction} run their work while holding a
 * fair lock, so batch inserts, housekeeping deletes and table creation never overlap.
 * The table is created from {@link SchemaCatalog} on first use. When the database is
 * addressed by URL, reads go through a small read-only HikariCP pool and do not take
 * the lock; otherwise they share the writer connection.
 *
 * <p>{@link #close()} closes the pool and issues {@code SHUTDOWN} on the writer, which
 * releases H2's in-process database so the file can be moved or deleted.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ConnectionGuard implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionGuard.class.getName());

  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  /**
   * Work executed with a connection.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface ConnectionWork<T> {
    T execute(Connection connection) throws SQLException;
  }

  private final ConnectionProvider writerProvider;
  private final String jdbcUrl;
  private final Path databasePath;
  private final int readerPoolSize;
  private final boolean compactOnClose;
  private final ReentrantLock writeLock = new ReentrantLock(true);

  private Connection writer;
  private volatile boolean schemaReady;
  private volatile HikariDataSource readers;
  private volatile boolean closed;

  private ConnectionGuard(Builder builder) {
    if (builder.databasePath != null && builder.jdbcUrl != null) {
      throw new IllegalArgumentException("Set either databasePath or jdbcUrl, not both");
    }
    if (builder.readerPoolSize < 0) {
      throw new IllegalArgumentException("readerPoolSize must be >= 0");
    }
    this.databasePath = builder.databasePath;
    this.jdbcUrl = builder.databasePath != null
        ? DatabaseFiles.jdbcUrl(builder.databasePath) : builder.jdbcUrl;
    if (builder.connectionProvider != null) {
      this.writerProvider = builder.connectionProvider;
    } else if (jdbcUrl != null) {
      String url = jdbcUrl;
      this.writerProvider = () -> DriverManager.getConnection(url);
    } else {
      throw new IllegalArgumentException("databasePath, jdbcUrl or connectionProvider must be set");
    }
    this.readerPoolSize = jdbcUrl != null ? builder.readerPoolSize : 0;
    this.compactOnClose = builder.compactOnClose;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs {@code work} with exclusive use of the writer connection, in auto-commit mode.
   *
   * @throws LogStoreException if the work or the connection fails
   * @throws IllegalStateException if the guard has been closed
   */
  public <T> T withWriteAccess(ConnectionWork<T> work) {
    ensureOpen();
    writeLock.lock();
    try {
      ensureOpen();
      Connection conn = writerConnection();
      ensureSchema(conn);
      return work.execute(conn);
    } catch (SQLException e) {
      throw new LogStoreException("Write operation failed", e);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Runs {@code work} in one transaction on the writer connection. The transaction is
   * rolled back if the work throws or the commit fails.
   *
   * @throws LogStoreException if the work, the commit or the connection fails
   * @throws IllegalStateException if the guard has been closed
   */
  public <T> T inTransaction(ConnectionWork<T> work) {
    return withWriteAccess(conn -> {
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        restoreAutoCommit(conn);
      }
    });
  }

  /**
   * Runs read-only {@code work} on a pooled reader connection, or on the writer
   * connection under the lock when no pool is configured.
   *
   * @throws LogStoreException if the work or the connection fails
   * @throws IllegalStateException if the guard has been closed
   */
  public <T> T withReadConnection(ConnectionWork<T> work) {
    if (readerPoolSize == 0) {
      return withWriteAccess(work);
    }
    ensureOpen();
    if (!schemaReady) {
      withWriteAccess(conn -> null);
    }
    try (Connection conn = readerPool().getConnection()) {
      return work.execute(conn);
    } catch (SQLException e) {
      throw new LogStoreException("Read operation failed", e);
    }
  }

  private Connection writerConnection() throws SQLException {
    if (writer != null) {
      if (writer.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        return writer;
      }
      logger.warning("Writer connection is no longer valid; reopening");
      closeQuietly(writer);
      writer = null;
      schemaReady = false;
    }
    writer = writerProvider.getConnection();
    writer.setAutoCommit(true);
    return writer;
  }

  private void ensureSchema(Connection conn) throws SQLException {
    if (schemaReady) {
      return;
    }
    try (Statement st = conn.createStatement()) {
      for (String sql : SchemaCatalog.createStatements()) {
        st.execute(sql);
      }
    }
    schemaReady = true;
    logger.log(Level.FINE, "Schema v{0} ready", SchemaCatalog.SCHEMA_VERSION);
  }

  private synchronized HikariDataSource readerPool() {
    ensureOpen();
    if (readers == null) {
      HikariConfig config = new HikariConfig();
      config.setJdbcUrl(jdbcUrl);
      config.setMaximumPoolSize(readerPoolSize);
      config.setMinimumIdle(0);
      config.setReadOnly(true);
      config.setAutoCommit(true);
      config.setPoolName("logsink-readers");
      config.setInitializationFailTimeout(-1);
      readers = new HikariDataSource(config);
    }
    return readers;
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void restoreAutoCommit(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit", e);
    }
  }

  private static void closeQuietly(Connection conn) {
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Ignoring failure closing stale connection", e);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("ConnectionGuard has been closed");
    }
  }

  public boolean isClosed() {
    return closed;
  }

  public String jdbcUrl() {
    return jdbcUrl;
  }

  /**
   * Path of the H2 data file, or {@code null} when the guard was built from a URL or
   * connection provider.
   */
  public Path databaseFile() {
    return databasePath == null ? null : DatabaseFiles.dataFile(databasePath);
  }

  /**
   * @return size of the data file in bytes, {@code 0} if there is none yet
   */
  public long databaseFileSize() {
    Path file = databaseFile();
    if (file == null || !Files.exists(file)) {
      return 0L;
    }
    try {
      return Files.size(file);
    } catch (IOException e) {
      throw new LogStoreException("Failed to read size of " + file, e);
    }
  }

  /**
   * Closes the reader pool, shuts the database down and closes the writer. Waits for a
   * running write to finish first. Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    boolean locked = false;
    try {
      locked = writeLock.tryLock(30, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    try {
      if (closed) {
        return;
      }
      closed = true;
      synchronized (this) {
        if (readers != null) {
          readers.close();
          readers = null;
        }
      }
      if (writer != null) {
        try (Statement st = writer.createStatement()) {
          st.execute(compactOnClose ? "SHUTDOWN COMPACT" : "SHUTDOWN");
        } catch (SQLException e) {
          logger.log(Level.WARNING, "Database shutdown failed", e);
        }
        closeQuietly(writer);
        writer = null;
      }
      logger.fine("Connection guard closed");
    } finally {
      if (locked) {
        writeLock.unlock();
      }
    }
  }

  /** Builder for {@link ConnectionGuard}. */
  public static final class Builder {
    private Path databasePath;
    private String jdbcUrl;
    private ConnectionProvider connectionProvider;
    private int readerPoolSize = 2;
    private boolean compactOnClose;

    private Builder() {}

    /**
     * Addresses a file database by directory and base name; the schema version is
     * appended to the name (see {@link DatabaseFiles}).
     */
    public Builder databaseFile(Path directory, String baseName) {
      this.databasePath = DatabaseFiles.databasePath(directory, baseName);
      return this;
    }

    /**
     * Addresses the database by JDBC URL, for example an in-memory H2 database.
     */
    public Builder jdbcUrl(String jdbcUrl) {
      this.jdbcUrl = jdbcUrl;
      return this;
    }

    /**
     * Overrides how the writer connection is opened. Without a URL or file, reads
     * also use this connection.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Maximum pooled read-only connections. Optional. Defaults to {@code 2};
     * {@code 0} routes reads through the writer connection.
     */
    public Builder readerPoolSize(int readerPoolSize) {
      this.readerPoolSize = readerPoolSize;
      return this;
    }

    /**
     * Compacts the database file on close. Optional. Defaults to {@code false}.
     */
    public Builder compactOnClose(boolean compactOnClose) {
      this.compactOnClose = compactOnClose;
      return this;
    }

    /**
     * @return a new guard; no connection is opened until first use
     * @throws IllegalArgumentException if no connection source is set, or both a
     *     file and a URL are set
     */
    public ConnectionGuard build() {
      return new ConnectionGuard(this);
    }
  }
}
