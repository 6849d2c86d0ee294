package logsink.jdbc;

import logsink.LogEntry;
import logsink.LogLevel;
import logsink.LogSink;
import logsink.SinkLogger;
import logsink.buffer.BatchingOptions;
import logsink.housekeeping.HouseKeepingOptions;
import logsink.housekeeping.HousekeepingMode;
import logsink.spi.FailureListener;
import logsink.spi.LogReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLogSinksTest {

  @TempDir
  Path dir;

  @Test
  void threeLevelsRoundTrip() {
    try (LogSink sink = JdbcLogSinks.open(dir, "levels")) {
      SinkLogger log = sink.logger("App");
      log.info("starting");
      log.warn("low disk");
      log.error("crashed");

      assertTrue(sink.flush(Duration.ofSeconds(5)));

      LogReader reader = sink.reader();
      assertEquals(3, reader.getEntryCount());
      assertEquals(LogLevel.ERROR, reader.getAllEntries().get(2).level());
      assertTrue(reader.getDatabaseFileSize() > 0);
    }
  }

  @Test
  void entriesArePersistedInEnqueueOrder() {
    try (LogSink sink = JdbcLogSinks.open(dir, "ordered", b -> b
        .batching(BatchingOptions.builder().maxBatchSize(37).queueCapacity(5_000).build())
        .houseKeeping(HouseKeepingOptions.manual()))) {
      SinkLogger log = sink.logger("Seq");
      for (int i = 0; i < 1_000; i++) {
        log.info("entry {Index}", i);
      }

      assertTrue(sink.flush(Duration.ofSeconds(30)));

      List<LogEntry> entries = sink.reader().getAllEntries();
      assertEquals(1_000, entries.size());
      for (int i = 0; i < entries.size(); i++) {
        assertEquals(i, entries.get(i).parameters().get("Index"));
      }
      assertEquals(0, sink.discardedCount());
      assertEquals(1_000, sink.writtenCount());
    }
  }

  @Test
  void entriesSurviveReopen() {
    try (LogSink sink = JdbcLogSinks.open(dir, "reopen")) {
      sink.logger("A").info("persisted {Value}", Map.of("k", 1));
    }

    try (LogSink sink = JdbcLogSinks.open(dir, "reopen")) {
      List<LogEntry> entries = sink.reader().getAllEntries();
      assertEquals(1, entries.size());
      assertEquals(Map.of("k", 1), entries.get(0).parameters().get("Value"));
    }
  }

  @Test
  void manualHousekeepingOnlyDeletesOnRequest() throws InterruptedException {
    Instant now = Instant.parse("2024-06-01T00:00:00Z");
    try (LogSink sink = JdbcLogSinks.open(dir, "manual", b -> b
        .clock(Clock.fixed(now, ZoneOffset.UTC))
        .houseKeeping(HouseKeepingOptions.builder()
            .mode(HousekeepingMode.MANUAL)
            .maxAge(Duration.ofDays(1))
            .sweepInterval(Duration.ofMillis(20))
            .build()))) {
      sink.enqueue(LogEntry.builder(LogLevel.INFORMATION).timestamp(now.minus(Duration.ofDays(10))).build());
      sink.enqueue(LogEntry.builder(LogLevel.INFORMATION).timestamp(now.minus(Duration.ofDays(5))).build());
      sink.enqueue(LogEntry.builder(LogLevel.INFORMATION).timestamp(now).build());
      assertTrue(sink.flush(Duration.ofSeconds(5)));

      Thread.sleep(200);
      assertEquals(3, sink.reader().getEntryCount());

      assertEquals(1, sink.housekeeper().deleteOlderThan(now.minus(Duration.ofDays(7))));
      assertEquals(2, sink.reader().getEntryCount());
      assertEquals(1, sink.housekeeper().runOnce());
      assertEquals(1, sink.reader().getEntryCount());
    }
  }

  @Test
  void automaticHousekeepingAppliesRowCap() throws InterruptedException {
    try (LogSink sink = JdbcLogSinks.open(dir, "capped", b -> b
        .houseKeeping(HouseKeepingOptions.builder()
            .maxAge(null)
            .maxRowCount(10L)
            .sweepInterval(Duration.ofMillis(50))
            .build()))) {
      SinkLogger log = sink.logger("Cap");
      for (int i = 0; i < 50; i++) {
        log.info("n{N}", i);
      }
      assertTrue(sink.flush(Duration.ofSeconds(5)));

      long deadline = System.currentTimeMillis() + 10_000;
      while (sink.reader().getEntryCount() > 10 && System.currentTimeMillis() < deadline) {
        Thread.sleep(25);
      }

      List<LogEntry> remaining = sink.reader().getAllEntries();
      assertEquals(10, remaining.size());
      assertEquals(49, remaining.get(9).parameters().get("N"));
    }
  }

  @Test
  void closingSinkReleasesDatabaseFile() throws Exception {
    LogSink sink = JdbcLogSinks.open(dir, "release");
    sink.logger("A").info("x");
    sink.close();

    Path file = DatabaseFiles.dataFile(DatabaseFiles.databasePath(dir, "release"));
    assertTrue(Files.exists(file));
    Files.delete(file);
    assertThrows(IllegalStateException.class, () -> sink.logger("A").info("late"));
  }

  @Test
  void invalidOptionsFailAtSetup() {
    assertThrows(IllegalArgumentException.class, () -> JdbcLogSinks.open(dir, "bad", b -> b
        .batching(BatchingOptions.builder().maxBatchSize(0).build())));
    assertThrows(IllegalArgumentException.class, () -> JdbcLogSinks.open(dir, "bad name"));
  }

  @Test
  void unencodableEntryDoesNotCostTheRestOfItsBatch() {
    List<LogEntry> rejected = new CopyOnWriteArrayList<>();
    try (LogSink sink = JdbcLogSinks.open(dir, "poison", b -> b
        .houseKeeping(HouseKeepingOptions.manual())
        .failureListener(new FailureListener() {
          @Override
          public void onBatchFailed(List<LogEntry> entries, Exception error) {
          }

          @Override
          public void onEntryRejected(LogEntry entry, Exception error) {
            rejected.add(entry);
          }
        }))) {
      SinkLogger log = sink.logger("Mixed");
      for (int i = 0; i < 4; i++) {
        log.info("before {Index}", i);
      }
      assertTrue(sink.enqueue(TestEntries.unencodable("Mixed")));
      for (int i = 4; i < 8; i++) {
        log.info("after {Index}", i);
      }

      assertTrue(sink.flush(Duration.ofSeconds(10)));

      List<LogEntry> entries = sink.reader().getAllEntries();
      assertEquals(8, entries.size());
      for (int i = 0; i < 8; i++) {
        assertEquals(i, entries.get(i).parameters().get("Index"));
      }
      assertEquals(1, sink.rejectedEntryCount());
      assertEquals(0, sink.failedBatchCount());
      assertEquals(0, sink.discardedCount());
      assertEquals(1, rejected.size());

      Map<String, Object> badScope = new HashMap<>();
      badScope.put(null, "x");
      assertThrows(IllegalArgumentException.class, () -> sink.scopes().begin(badScope));
    }
  }

  @Test
  void concurrentProducersKeepTheirOrderDuringHousekeeping() throws Exception {
    int producers = 8;
    int perProducer = 2_000;
    try (LogSink sink = JdbcLogSinks.open(dir, "concurrent", b -> b
        .batching(BatchingOptions.builder().queueCapacity(producers * perProducer).build())
        .houseKeeping(HouseKeepingOptions.builder()
            .maxAge(null)
            .maxRowCount(1_000_000L)
            .sweepInterval(Duration.ofMillis(5))
            .build()))) {
      ExecutorService pool = Executors.newFixedThreadPool(producers);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<Integer>> results = new ArrayList<>();
      for (int t = 0; t < producers; t++) {
        SinkLogger log = sink.logger("P" + t);
        results.add(pool.submit(() -> {
          start.await();
          int accepted = 0;
          for (int i = 0; i < perProducer; i++) {
            if (log.info("step {Index}", i)) {
              accepted++;
            }
          }
          return accepted;
        }));
      }
      start.countDown();
      int accepted = 0;
      for (Future<Integer> result : results) {
        accepted += result.get(60, TimeUnit.SECONDS);
      }
      pool.shutdown();

      assertTrue(sink.flush(Duration.ofSeconds(60)));
      assertEquals(producers * perProducer, accepted);

      List<LogEntry> entries = sink.reader().getAllEntries();
      assertEquals(producers * perProducer, entries.size());
      Map<String, Integer> lastIndex = new HashMap<>();
      for (LogEntry entry : entries) {
        int index = (Integer) entry.parameters().get("Index");
        Integer previous = lastIndex.put(entry.category(), index);
        assertEquals(previous == null ? 0 : previous + 1, index, "order of " + entry.category());
      }
      assertEquals(producers, lastIndex.size());
      assertTrue(sink.housekeeper().isRunning());
    }
  }
}
