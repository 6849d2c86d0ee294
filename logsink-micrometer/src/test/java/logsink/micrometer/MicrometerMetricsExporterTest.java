package logsink.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import logsink.LogEntry;
import logsink.LogSink;
import logsink.housekeeping.HouseKeepingOptions;
import logsink.spi.LogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void bufferCounters() {
    exporter.incrementAccepted();
    exporter.incrementAccepted();
    exporter.incrementDiscarded();

    assertEquals(2.0, counter("logsink.entries.accepted").count());
    assertEquals(1.0, counter("logsink.entries.discarded").count());
  }

  @Test
  void writeCounters() {
    exporter.incrementWritten(25);
    exporter.incrementWriteRetried();
    exporter.incrementBatchFailed(10);

    assertEquals(25.0, counter("logsink.entries.written").count());
    assertEquals(1.0, counter("logsink.batches.retried").count());
    assertEquals(1.0, counter("logsink.batches.failed").count());
    assertEquals(10.0, counter("logsink.entries.failed").count());
  }

  @Test
  void rejectedEntryCounter() {
    exporter.incrementEntryRejected();
    exporter.incrementEntryRejected();

    assertEquals(2.0, counter("logsink.entries.rejected").count());
  }

  @Test
  void housekeepingCounter() {
    exporter.incrementHousekeepingDeleted(300);

    assertEquals(300.0, counter("logsink.housekeeping.deleted").count());
  }

  @Test
  void queueDepthGauge() {
    exporter.recordQueueDepth(17);
    assertEquals(17.0, gauge("logsink.queue.depth").value());

    exporter.recordQueueDepth(0);
    assertEquals(0.0, gauge("logsink.queue.depth").value());
  }

  @Test
  void customNamePrefix() {
    MicrometerMetricsExporter audit = new MicrometerMetricsExporter(registry, "audit.logsink");
    audit.incrementAccepted();
    audit.recordQueueDepth(3);

    assertEquals(1.0, counter("audit.logsink.entries.accepted").count());
    assertEquals(3.0, gauge("audit.logsink.queue.depth").value());
    assertEquals(0.0, counter("logsink.entries.accepted").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementAccepted();

    assertNull(registry.find("logsink.entries.accepted").counter());
    assertNull(registry.find("logsink.queue.depth").gauge());
  }

  @Test
  void invalidArguments() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "logsink."));
  }

  @Test
  void sinkReportsThroughExporterAndClosesIt() {
    AtomicInteger inserted = new AtomicInteger();
    LogStore store = new CountingStore(inserted);
    LogSink sink = LogSink.builder()
        .store(store)
        .houseKeeping(HouseKeepingOptions.manual())
        .metrics(exporter)
        .build();

    sink.logger("Metrics").info("one");
    sink.logger("Metrics").info("two");
    assertTrue(sink.flush(Duration.ofSeconds(10)));

    assertEquals(2.0, counter("logsink.entries.accepted").count());
    assertEquals(2.0, counter("logsink.entries.written").count());
    assertEquals(2, inserted.get());
    assertEquals(1, sink.housekeeper().deleteAll());
    assertEquals(1.0, counter("logsink.housekeeping.deleted").count());

    sink.close();
    assertNull(registry.find("logsink.entries.written").counter());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }

  private static final class CountingStore implements LogStore {
    private final AtomicInteger inserted;

    CountingStore(AtomicInteger inserted) {
      this.inserted = inserted;
    }

    @Override
    public void insertBatch(List<LogEntry> entries) {
      inserted.addAndGet(entries.size());
    }

    @Override
    public int deleteAll() {
      return 1;
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
      return 0;
    }

    @Override
    public int deleteExceedingCount(long maxRows) {
      return 0;
    }

    @Override
    public int deleteByIds(long... ids) {
      return 0;
    }
  }
}
