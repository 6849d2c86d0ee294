package logsink.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import logsink.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code logsink.entries.accepted}: entries accepted into the write buffer</li>
 *   <li>{@code logsink.entries.discarded}: entries dropped by the overflow policy</li>
 *   <li>{@code logsink.entries.written}: entries committed to storage</li>
 *   <li>{@code logsink.entries.failed}: entries lost with abandoned batches</li>
 *   <li>{@code logsink.entries.rejected}: entries dropped because they could not be encoded</li>
 *   <li>{@code logsink.batches.retried}: failed insert attempts that were retried</li>
 *   <li>{@code logsink.batches.failed}: batches abandoned after exhausting retries</li>
 *   <li>{@code logsink.housekeeping.deleted}: rows removed by housekeeping</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code logsink.queue.depth}: entries waiting in the write buffer</li>
 * </ul>
 *
 * <p>Closing the sink closes this exporter, which removes its meters from the registry.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter accepted;
  private final Counter discarded;
  private final Counter written;
  private final Counter failedEntries;
  private final Counter rejectedEntries;
  private final Counter retried;
  private final Counter failedBatches;
  private final Counter housekeepingDeleted;
  private final Gauge queueDepthGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "logsink"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "logsink");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for processes running
   * several sinks.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "audit.logsink"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.accepted = Counter.builder(namePrefix + ".entries.accepted")
        .description("Entries accepted into the write buffer")
        .register(registry);
    this.discarded = Counter.builder(namePrefix + ".entries.discarded")
        .description("Entries dropped because the write buffer was full")
        .register(registry);
    this.written = Counter.builder(namePrefix + ".entries.written")
        .description("Entries committed to storage")
        .register(registry);
    this.failedEntries = Counter.builder(namePrefix + ".entries.failed")
        .description("Entries lost with abandoned batches")
        .register(registry);
    this.rejectedEntries = Counter.builder(namePrefix + ".entries.rejected")
        .description("Entries dropped because they could not be encoded")
        .register(registry);
    this.retried = Counter.builder(namePrefix + ".batches.retried")
        .description("Batch insert attempts that failed and were retried")
        .register(registry);
    this.failedBatches = Counter.builder(namePrefix + ".batches.failed")
        .description("Batches abandoned after exhausting retries")
        .register(registry);
    this.housekeepingDeleted = Counter.builder(namePrefix + ".housekeeping.deleted")
        .description("Rows removed by housekeeping")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementAccepted() {
    if (closed) return;
    accepted.increment();
  }

  @Override
  public void incrementDiscarded() {
    if (closed) return;
    discarded.increment();
  }

  @Override
  public void incrementWritten(int entries) {
    if (closed) return;
    written.increment(entries);
  }

  @Override
  public void incrementWriteRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementBatchFailed(int entries) {
    if (closed) return;
    failedBatches.increment();
    failedEntries.increment(entries);
  }

  @Override
  public void incrementEntryRejected() {
    if (closed) return;
    rejectedEntries.increment();
  }

  @Override
  public void incrementHousekeepingDeleted(int rows) {
    if (closed) return;
    housekeepingDeleted.increment(rows);
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(accepted, discarded, written, failedEntries,
        rejectedEntries, retried, failedBatches, housekeepingDeleted, queueDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
