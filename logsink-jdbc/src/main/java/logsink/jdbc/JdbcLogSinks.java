package logsink.jdbc;

import logsink.LogSink;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Factory for a {@link LogSink} backed by an H2 file database.
 *
 * <pre>{@code
 * try (LogSink sink = JdbcLogSinks.open(Path.of("logs"), "app", b -> b
 *     .houseKeeping(HouseKeepingOptions.manual()))) {
 *   sink.logger("App").info("Started");
 * }
 * }</pre>
 */
public final class JdbcLogSinks {
  private JdbcLogSinks() {}

  /**
   * Opens a sink with default options over {@code <directory>/<baseName>.v<schema>.mv.db}.
   */
  public static LogSink open(Path directory, String baseName) {
    return open(directory, baseName, b -> { });
  }

  /**
   * Opens a sink over {@code <directory>/<baseName>.v<schema>.mv.db}. The customizer may
   * set any option except the store and reader. The connection guard is closed with
   * the sink.
   */
  public static LogSink open(Path directory, String baseName, Consumer<LogSink.Builder> customizer) {
    ConnectionGuard guard = ConnectionGuard.builder()
        .databaseFile(directory, baseName)
        .build();
    return open(guard, customizer);
  }

  /**
   * Opens a sink over an existing guard, which the sink takes ownership of.
   */
  public static LogSink open(ConnectionGuard guard, Consumer<LogSink.Builder> customizer) {
    Objects.requireNonNull(guard, "guard");
    Objects.requireNonNull(customizer, "customizer");
    LogSink.Builder builder = LogSink.builder();
    try {
      customizer.accept(builder);
      return builder
          .store(new H2LogStore(guard))
          .reader(new H2LogReader(guard))
          .closeOnShutdown(guard)
          .build();
    } catch (RuntimeException e) {
      guard.close();
      throw e;
    }
  }
}
