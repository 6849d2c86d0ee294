package logsink.benchmark;

import logsink.jdbc.ConnectionGuard;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Temporary H2 file databases for benchmarks. Each trial gets a fresh directory that is
 * removed on teardown.
 */
final class BenchmarkDatabases {

  private BenchmarkDatabases() {}

  static Path newDirectory(String prefix) {
    try {
      return Files.createTempDirectory(prefix);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static ConnectionGuard open(Path directory) {
    return ConnectionGuard.builder()
        .databaseFile(directory, "bench")
        .build();
  }

  static void delete(Path directory) {
    if (directory == null || !Files.exists(directory)) {
      return;
    }
    try (Stream<Path> files = Files.walk(directory)) {
      files.sorted(Comparator.reverseOrder()).forEach(path -> {
        try {
          Files.deleteIfExists(path);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
