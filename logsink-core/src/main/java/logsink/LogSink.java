package logsink;

import logsink.buffer.BatchWriter;
import logsink.buffer.BatchingOptions;
import logsink.buffer.WriteBuffer;
import logsink.housekeeping.HouseKeepingOptions;
import logsink.housekeeping.Housekeeper;
import logsink.spi.FailureListener;
import logsink.spi.LogReader;
import logsink.spi.LogStore;
import logsink.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires a {@link WriteBuffer}, its {@link BatchWriter} and a
 * {@link Housekeeper} over one {@link LogStore} into a single {@link AutoCloseable} unit.
 *
 * <p>Producers call {@link #enqueue(LogEntry)} or use a {@link SinkLogger}; neither
 * blocks beyond the buffer's overflow policy, and storage failures never reach them.
 * Closing the sink stops housekeeping, drains the buffer within the configured
 * shutdown timeout and then closes the resources registered with
 * {@link Builder#closeOnShutdown(AutoCloseable)}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (LogSink sink = LogSink.builder()
 *     .store(store)
 *     .reader(reader)
 *     .build()) {
 *   sink.logger("Startup").info("Listening on {Port}", 8080);
 *   sink.flush(Duration.ofSeconds(5));
 * }
 * }</pre>
 */
public final class LogSink implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LogSink.class.getName());

  private final WriteBuffer buffer;
  private final BatchWriter writer;
  private final Housekeeper housekeeper;
  private final LogReader reader;
  private final Clock clock;
  private final LogLevel minimumLevel;
  private final LogScopes scopes = new LogScopes();
  private final List<LogMiddleware> middleware;
  private final List<EntryListener> listeners;
  private final List<AutoCloseable> ownedResources;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean();

  private LogSink(Builder builder) {
    LogStore store = Objects.requireNonNull(builder.store, "store");
    BatchingOptions batching = builder.batching != null ? builder.batching : BatchingOptions.defaults();
    HouseKeepingOptions houseKeeping = builder.houseKeeping != null
        ? builder.houseKeeping : HouseKeepingOptions.defaults();
    MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    FailureListener failureListener = builder.failureListener != null
        ? builder.failureListener : FailureListener.NOOP;

    this.metrics = metrics;
    this.reader = builder.reader;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.minimumLevel = Objects.requireNonNull(builder.minimumLevel, "minimumLevel");
    this.middleware = List.copyOf(builder.middleware);
    this.listeners = new CopyOnWriteArrayList<>(builder.listeners);
    this.ownedResources = List.copyOf(builder.ownedResources);

    this.buffer = new WriteBuffer(batching, metrics);
    this.writer = BatchWriter.builder()
        .buffer(buffer)
        .store(store)
        .options(batching)
        .failureListener(failureListener)
        .metrics(metrics)
        .build();
    this.housekeeper = Housekeeper.builder()
        .store(store)
        .options(houseKeeping)
        .clock(clock)
        .failureListener(failureListener)
        .metrics(metrics)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private void start() {
    writer.start();
    try {
      housekeeper.start();
    } catch (RuntimeException e) {
      writer.close();
      throw e;
    }
  }

  /**
   * Runs the entry through the middleware pipeline and offers it to the write buffer.
   * Entry listeners are notified when it is accepted.
   *
   * @param entry the entry
   * @return {@code true} if buffered; {@code false} if suppressed by middleware or
   *     discarded by the overflow policy
   * @throws IllegalStateException if the sink has been closed
   */
  public boolean enqueue(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    ensureOpen();
    LogEntry processed = applyMiddleware(entry);
    if (processed == null) {
      return false;
    }
    boolean accepted = buffer.enqueue(processed);
    if (accepted) {
      for (EntryListener listener : listeners) {
        try {
          listener.onEntry(processed);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "EntryListener threw", e);
        }
      }
    }
    return accepted;
  }

  private LogEntry applyMiddleware(LogEntry entry) {
    LogEntry current = entry;
    for (LogMiddleware m : middleware) {
      try {
        current = m.apply(current);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Middleware " + m.getClass().getName() + " failed; skipped", e);
        continue;
      }
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  /**
   * Waits until every entry accepted so far has been written or abandoned.
   *
   * @param timeout maximum wait
   * @return {@code true} if fully drained; {@code false} on timeout
   */
  public boolean flush(Duration timeout) {
    ensureOpen();
    return writer.flush(timeout);
  }

  /**
   * Returns a logger for {@code category} using the sink's minimum level.
   */
  public SinkLogger logger(String category) {
    return new SinkLogger(this, category, minimumLevel);
  }

  public SinkLogger logger(Class<?> type) {
    return logger(type.getName());
  }

  public LogScopes scopes() {
    return scopes;
  }

  public Housekeeper housekeeper() {
    return housekeeper;
  }

  /**
   * @return the configured reader
   * @throws IllegalStateException if the sink was built without one
   */
  public LogReader reader() {
    if (reader == null) {
      throw new IllegalStateException("No LogReader configured");
    }
    return reader;
  }

  public Clock clock() {
    return clock;
  }

  public void addEntryListener(EntryListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeEntryListener(EntryListener listener) {
    listeners.remove(listener);
  }

  /** Entries accepted but not yet written or abandoned. */
  public long pendingCount() {
    return buffer.pendingCount();
  }

  /** Entries discarded by the overflow policy since creation or the last reset. */
  public long discardedCount() {
    return buffer.discardedCount();
  }

  /**
   * @return the discard count before the reset
   */
  public long resetDiscardedCount() {
    return buffer.resetDiscardedCount();
  }

  public long writtenCount() {
    return writer.writtenCount();
  }

  public long failedBatchCount() {
    return writer.failedBatchCount();
  }

  public long failedEntryCount() {
    return writer.failedEntryCount();
  }

  public long rejectedEntryCount() {
    return writer.rejectedEntryCount();
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("LogSink has been closed");
    }
  }

  /**
   * Stops housekeeping, drains the write buffer, then closes owned resources in
   * reverse registration order and finally the metrics exporter if it is
   * {@link AutoCloseable}. Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      housekeeper.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      writer.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    for (int i = ownedResources.size() - 1; i >= 0; i--) {
      try {
        ownedResources.get(i).close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link LogSink}. */
  public static final class Builder {
    private LogStore store;
    private LogReader reader;
    private BatchingOptions batching;
    private HouseKeepingOptions houseKeeping;
    private Clock clock;
    private MetricsExporter metrics;
    private FailureListener failureListener;
    private LogLevel minimumLevel = LogLevel.TRACE;
    private final List<LogMiddleware> middleware = new ArrayList<>();
    private final List<EntryListener> listeners = new ArrayList<>();
    private final List<AutoCloseable> ownedResources = new ArrayList<>();

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param store the store batches are written to and rows deleted from
     * @return this builder
     */
    public Builder store(LogStore store) {
      this.store = store;
      return this;
    }

    /**
     * Optional. Exposed through {@link LogSink#reader()}.
     */
    public Builder reader(LogReader reader) {
      this.reader = reader;
      return this;
    }

    /**
     * Optional. Defaults to {@link BatchingOptions#defaults()}.
     */
    public Builder batching(BatchingOptions batching) {
      this.batching = batching;
      return this;
    }

    /**
     * Optional. Defaults to {@link HouseKeepingOptions#defaults()} (automatic, 30 days).
     */
    public Builder houseKeeping(HouseKeepingOptions houseKeeping) {
      this.houseKeeping = houseKeeping;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder failureListener(FailureListener failureListener) {
      this.failureListener = failureListener;
      return this;
    }

    /**
     * Minimum level for loggers obtained from the sink. Optional. Defaults to
     * {@link LogLevel#TRACE}; {@link LogLevel#NONE} disables them.
     */
    public Builder minimumLevel(LogLevel minimumLevel) {
      this.minimumLevel = minimumLevel;
      return this;
    }

    /**
     * Appends a middleware to the pipeline.
     */
    public Builder middleware(LogMiddleware middleware) {
      this.middleware.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    public Builder entryListener(EntryListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * Registers a resource closed after the writer has drained, such as the
     * connection guard behind the store.
     */
    public Builder closeOnShutdown(AutoCloseable resource) {
      this.ownedResources.add(Objects.requireNonNull(resource, "resource"));
      return this;
    }

    /**
     * Builds the sink and starts its background threads.
     *
     * @return a running {@link LogSink}
     * @throws NullPointerException if {@code store} is null
     */
    public LogSink build() {
      LogSink sink = new LogSink(this);
      sink.start();
      return sink;
    }
  }
}
