package logsink.benchmark;

import logsink.LogEntry;
import logsink.LogLevel;
import logsink.jdbc.ConnectionGuard;
import logsink.jdbc.H2LogStore;
import org.openjdk.jmh.annotations.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Measures raw transactional batch inserts through {@link H2LogStore}, without the
 * buffer and writer thread.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class InsertBatchBenchmark {

  @Param({"1", "100", "1000"})
  private int batchSize;

  private Path directory;
  private ConnectionGuard guard;
  private H2LogStore store;
  private List<LogEntry> batch;

  @Setup(Level.Trial)
  public void setup() {
    directory = BenchmarkDatabases.newDirectory("logsink-bench-insert");
    guard = BenchmarkDatabases.open(directory);
    store = new H2LogStore(guard);
    batch = new ArrayList<>(batchSize);
    for (int i = 0; i < batchSize; i++) {
      batch.add(LogEntry.builder(LogLevel.INFORMATION)
          .category("Benchmark")
          .messageTemplate("Item {Index} of {Total}")
          .parameter("Index", i)
          .parameter("Total", batchSize)
          .build());
    }
  }

  @Benchmark
  public void insertBatch() {
    store.insertBatch(batch);
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    guard.close();
    BenchmarkDatabases.delete(directory);
  }
}
