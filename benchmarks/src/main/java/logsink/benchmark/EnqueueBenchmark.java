package logsink.benchmark;

import logsink.LogSink;
import logsink.SinkLogger;
import logsink.buffer.BatchingOptions;
import logsink.buffer.OverflowPolicy;
import logsink.housekeeping.HouseKeepingOptions;
import logsink.jdbc.JdbcLogSinks;
import org.openjdk.jmh.annotations.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Measures producer-side throughput of {@link SinkLogger#info} with the batch writer
 * draining into an H2 file. The buffer blocks when full, so the score reflects the
 * sustained write rate rather than the discard rate.
 *
 * <p>Run: {@code java -cp benchmarks/target/classes:<deps> org.openjdk.jmh.Main EnqueueBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class EnqueueBenchmark {

  @Param({"50", "100", "500"})
  private int maxBatchSize;

  private Path directory;
  private LogSink sink;
  private SinkLogger logger;

  @Setup(Level.Trial)
  public void setup() {
    directory = BenchmarkDatabases.newDirectory("logsink-bench-enqueue");
    sink = JdbcLogSinks.open(directory, "bench", b -> b
        .batching(BatchingOptions.builder()
            .maxBatchSize(maxBatchSize)
            .queueCapacity(10_000)
            .overflowPolicy(OverflowPolicy.BLOCK)
            .shutdownTimeout(Duration.ofSeconds(30))
            .build())
        .houseKeeping(HouseKeepingOptions.manual()));
    logger = sink.logger("Benchmark");
  }

  @Benchmark
  @Threads(4)
  public boolean logInfo() {
    return logger.info("Order {OrderId} processed in {Elapsed} ms", 42L, 17);
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    sink.close();
    BenchmarkDatabases.delete(directory);
  }
}
