package logsink.buffer;

import logsink.LogEntry;
import logsink.retry.Retrier;
import logsink.spi.FailureListener;
import logsink.spi.LogStore;
import logsink.spi.MetricsExporter;
import logsink.spi.PreparedBatch;
import logsink.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single background worker that drains a {@link WriteBuffer} into transactional batch
 * inserts.
 *
 * <p>The worker takes the oldest entry, then keeps collecting until the batch holds
 * {@code maxBatchSize} entries or {@code maxWaitTime} has passed since that first entry.
 * While a caller is flushing or the writer is closing it stops waiting and writes
 * whatever is queued. Each batch is encoded once through {@link LogStore#prepare}; an
 * entry that cannot be encoded is dropped alone. Failed inserts are retried per
 * {@link BatchingOptions}; a batch that still fails is dropped, counted and reported to
 * the {@link FailureListener}.
 * Nothing is ever thrown back to producers.
 *
 * <p>Create instances via {@link #builder()}, then call {@link #start()}.
 */
public final class BatchWriter implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchWriter.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final WriteBuffer buffer;
  private final LogStore store;
  private final FailureListener failureListener;
  private final MetricsExporter metrics;
  private final int maxBatchSize;
  private final long maxWaitNanos;
  private final Duration shutdownTimeout;
  private final Retrier retrier;

  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicLong written = new AtomicLong();
  private final AtomicLong failedBatches = new AtomicLong();
  private final AtomicLong failedEntries = new AtomicLong();
  private final AtomicLong rejectedEntries = new AtomicLong();

  private ExecutorService worker;
  private volatile boolean closed;

  private BatchWriter(Builder builder) {
    this.buffer = Objects.requireNonNull(builder.buffer, "buffer");
    this.store = Objects.requireNonNull(builder.store, "store");
    BatchingOptions options = builder.options != null ? builder.options : BatchingOptions.defaults();
    this.failureListener = builder.failureListener != null ? builder.failureListener : FailureListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.maxBatchSize = options.maxBatchSize();
    this.maxWaitNanos = options.maxWaitTime().toNanos();
    this.shutdownTimeout = options.shutdownTimeout();
    this.retrier = new Retrier(options.retryPolicy(), options.maxWriteAttempts(),
        () -> !running.get() && Thread.currentThread().isInterrupted());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the worker thread. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("BatchWriter has been closed");
    }
    if (worker != null) {
      return;
    }
    worker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("logsink-batch-writer-"));
    worker.submit(this::workerLoop);
    logger.fine("Batch writer started");
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && buffer.isEmpty()) {
          break;
        }
        LogEntry first = buffer.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (first == null) {
          continue;
        }
        List<LogEntry> batch = new ArrayList<>(Math.min(maxBatchSize, 1024));
        batch.add(first);
        fill(batch);
        writeBatch(batch);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Batch writer loop error", t);
      }
    }
    abandonRemaining();
  }

  // Entries still queued once the loop is interrupted are not written; they are
  // counted as failed so the pending count returns to zero.
  private void abandonRemaining() {
    List<LogEntry> remaining = new ArrayList<>();
    buffer.drainTo(remaining, Integer.MAX_VALUE);
    if (remaining.isEmpty()) {
      return;
    }
    logger.log(Level.WARNING, "Batch writer stopped with {0} entries unwritten", remaining.size());
    failedBatches.incrementAndGet();
    failedEntries.addAndGet(remaining.size());
    metrics.incrementBatchFailed(remaining.size());
    notifyFailure(Collections.unmodifiableList(remaining),
        new IllegalStateException("Batch writer stopped before the entries were written"));
    buffer.completed(remaining.size());
  }

  private void fill(List<LogEntry> batch) throws InterruptedException {
    long deadline = System.nanoTime() + maxWaitNanos;
    while (batch.size() < maxBatchSize) {
      if (!running.get() || buffer.drainRequested()) {
        buffer.drainTo(batch, maxBatchSize - batch.size());
        return;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0L) {
        return;
      }
      LogEntry next = buffer.poll(
          Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(QUEUE_POLL_TIMEOUT_MS)), TimeUnit.NANOSECONDS);
      if (next != null) {
        batch.add(next);
      }
    }
  }

  private void writeBatch(List<LogEntry> batch) {
    List<LogEntry> entries = Collections.unmodifiableList(batch);
    try {
      PreparedBatch prepared;
      try {
        prepared = store.prepare(entries);
      } catch (RuntimeException e) {
        dropBatch(entries, e, "could not be encoded");
        return;
      }
      for (PreparedBatch.Rejection rejection : prepared.rejected()) {
        reject(rejection);
      }
      if (!prepared.isEmpty()) {
        insert(prepared);
      }
    } finally {
      buffer.completed(entries.size());
      metrics.recordQueueDepth(buffer.size());
    }
  }

  private void insert(PreparedBatch prepared) {
    int size = prepared.size();
    try {
      retrier.execute("insert batch of " + size + " entries", () -> {
        store.insertPrepared(prepared);
        return null;
      }, metrics::incrementWriteRetried);
      written.addAndGet(size);
      metrics.incrementWritten(size);
    } catch (RuntimeException e) {
      dropBatch(prepared.entries(), e, "failed after " + retrier.maxAttempts() + " attempts");
    }
  }

  private void dropBatch(List<LogEntry> entries, RuntimeException error, String reason) {
    int size = entries.size();
    failedBatches.incrementAndGet();
    failedEntries.addAndGet(size);
    metrics.incrementBatchFailed(size);
    logger.log(Level.SEVERE, "Dropped batch of " + size + " entries: " + reason, error);
    notifyFailure(entries, error);
  }

  private void reject(PreparedBatch.Rejection rejection) {
    rejectedEntries.incrementAndGet();
    failedEntries.incrementAndGet();
    metrics.incrementEntryRejected();
    logger.log(Level.WARNING, "Dropped entry that could not be encoded: " + rejection.entry(),
        rejection.error());
    try {
      failureListener.onEntryRejected(rejection.entry(), rejection.error());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "FailureListener threw", e);
    }
  }

  private void notifyFailure(List<LogEntry> entries, Exception error) {
    try {
      failureListener.onBatchFailed(entries, error);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "FailureListener threw", e);
    }
  }

  /**
   * Waits until every entry accepted so far has been written or abandoned.
   *
   * @param timeout maximum wait
   * @return {@code true} if fully drained, {@code false} on timeout
   */
  public boolean flush(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return buffer.awaitDrained(timeout);
  }

  /** Entries committed to storage. */
  public long writtenCount() {
    return written.get();
  }

  /** Batches dropped after exhausting retries. */
  public long failedBatchCount() {
    return failedBatches.get();
  }

  /** Entries lost, either with dropped batches or rejected alone. */
  public long failedEntryCount() {
    return failedEntries.get();
  }

  /** Entries dropped alone because they could not be encoded. */
  public long rejectedEntryCount() {
    return rejectedEntries.get();
  }

  /**
   * Closes the buffer, writes what is still queued within the shutdown timeout, then
   * stops the worker. Entries left after the timeout are abandoned.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    buffer.close();
    running.set(false);
    if (worker == null) {
      return;
    }
    worker.shutdown();
    try {
      if (!worker.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + buffer.size());
        worker.shutdownNow();
        worker.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
    logger.fine("Batch writer stopped");
  }

  /** Builder for {@link BatchWriter}. */
  public static final class Builder {
    private WriteBuffer buffer;
    private LogStore store;
    private BatchingOptions options;
    private FailureListener failureListener;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param buffer the buffer to drain
     * @return this builder
     */
    public Builder buffer(WriteBuffer buffer) {
      this.buffer = buffer;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param store the store batches are inserted into
     * @return this builder
     */
    public Builder store(LogStore store) {
      this.store = store;
      return this;
    }

    /**
     * Optional. Defaults to {@link BatchingOptions#defaults()}.
     *
     * @param options batch size, wait time, retry and shutdown settings
     * @return this builder
     */
    public Builder options(BatchingOptions options) {
      this.options = options;
      return this;
    }

    public Builder failureListener(FailureListener failureListener) {
      this.failureListener = failureListener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @return a new, not yet started writer
     * @throws NullPointerException if {@code buffer} or {@code store} is null
     */
    public BatchWriter build() {
      return new BatchWriter(this);
    }
  }
}
