package logsink.housekeeping;

import logsink.retry.Retrier;
import logsink.spi.FailureListener;
import logsink.spi.LogStore;
import logsink.spi.MetricsExporter;
import logsink.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes log rows on request or, in {@link HousekeepingMode#AUTOMATIC} mode, on a
 * fixed-delay background schedule.
 *
 * <p>Every delete is one statement (or one transaction, for {@link #deleteByIds}) issued
 * through the {@link LogStore}, which serializes it against batch inserts. Failed deletes
 * are retried per {@link HouseKeepingOptions}. Explicit calls rethrow the last failure;
 * background sweeps log it and notify the {@link FailureListener}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class Housekeeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Housekeeper.class.getName());

  private final LogStore store;
  private final HouseKeepingOptions options;
  private final Clock clock;
  private final FailureListener failureListener;
  private final MetricsExporter metrics;
  private final Retrier retrier;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private Housekeeper(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.options = builder.options != null ? builder.options : HouseKeepingOptions.defaults();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.failureListener = builder.failureListener != null ? builder.failureListener : FailureListener.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.retrier = new Retrier(options.retryPolicy(), options.maxAttempts(), () -> closed);
  }

  public static Builder builder() {
    return new Builder();
  }

  public HouseKeepingOptions options() {
    return options;
  }

  /**
   * Starts the background sweep in automatic mode; the first sweep runs immediately.
   * Does nothing in manual mode. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Housekeeper has been closed");
    }
    if (options.mode() != HousekeepingMode.AUTOMATIC || sweepTask != null) {
      return;
    }
    long intervalNanos = intervalNanos(options.sweepInterval());
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("logsink-housekeeper-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, 0L, intervalNanos, TimeUnit.NANOSECONDS);
    logger.log(Level.FINE, "Housekeeping sweep scheduled every {0}", options.sweepInterval());
  }

  // sub-millisecond intervals stay positive; centuries saturate
  static long intervalNanos(Duration interval) {
    try {
      return interval.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  /** Whether a background sweep is scheduled. */
  public boolean isRunning() {
    return sweepTask != null && !closed;
  }

  private void sweep() {
    if (closed) {
      return;
    }
    try {
      int deleted = runOnce();
      if (deleted > 0) {
        logger.log(Level.INFO, "Housekeeping removed {0} rows", deleted);
      }
    } catch (Throwable t) {
      if (closed) {
        return;
      }
      logger.log(Level.SEVERE, "Housekeeping sweep failed", t);
      if (t instanceof Exception e) {
        try {
          failureListener.onHousekeepingFailed(e);
        } catch (RuntimeException listenerError) {
          logger.log(Level.WARNING, "FailureListener threw", listenerError);
        }
      }
    }
  }

  /**
   * Applies the configured retention rules once: rows older than {@code maxAge},
   * then rows beyond {@code maxRowCount}.
   *
   * @return total rows deleted
   */
  public int runOnce() {
    int deleted = 0;
    if (options.maxAge() != null) {
      deleted += deleteOlderThan(clock.instant().minus(options.maxAge()));
    }
    if (options.maxRowCount() != null) {
      deleted += deleteExceedingCount(options.maxRowCount());
    }
    return deleted;
  }

  /**
   * @return rows deleted
   */
  public int deleteAll() {
    return delete("delete all rows", store::deleteAll);
  }

  /**
   * Deletes rows with a timestamp strictly before {@code cutoff}.
   *
   * @return rows deleted
   */
  public int deleteOlderThan(Instant cutoff) {
    Objects.requireNonNull(cutoff, "cutoff");
    return delete("delete rows older than " + cutoff, () -> store.deleteOlderThan(cutoff));
  }

  /**
   * Keeps the {@code maxRows} newest rows (by id) and deletes the rest.
   *
   * @return rows deleted
   */
  public int deleteExceedingCount(long maxRows) {
    if (maxRows < 0) {
      throw new IllegalArgumentException("maxRows must be >= 0");
    }
    return delete("trim to " + maxRows + " rows", () -> store.deleteExceedingCount(maxRows));
  }

  /**
   * Deletes the given rows in one transaction. Unknown ids are ignored.
   *
   * @return rows deleted
   */
  public int deleteByIds(long... ids) {
    Objects.requireNonNull(ids, "ids");
    if (ids.length == 0) {
      return 0;
    }
    long[] copy = ids.clone();
    return delete("delete " + copy.length + " rows by id", () -> store.deleteByIds(copy));
  }

  private int delete(String action, Supplier<Integer> operation) {
    if (closed) {
      throw new IllegalStateException("Housekeeper has been closed");
    }
    int deleted = retrier.execute(action, operation, () -> { });
    if (deleted > 0) {
      metrics.incrementHousekeepingDeleted(deleted);
    }
    return deleted;
  }

  /**
   * Cancels the sweep schedule and waits for a running sweep to finish its current
   * statement.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }

  /** Builder for {@link Housekeeper}. */
  public static final class Builder {
    private LogStore store;
    private HouseKeepingOptions options;
    private Clock clock;
    private FailureListener failureListener;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param store the store rows are deleted from
     * @return this builder
     */
    public Builder store(LogStore store) {
      this.store = store;
      return this;
    }

    /**
     * Optional. Defaults to {@link HouseKeepingOptions#defaults()}.
     */
    public Builder options(HouseKeepingOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}; used for age cutoffs.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
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
     * Builds the housekeeper. Call {@link Housekeeper#start()} to begin automatic sweeps.
     *
     * @return a new {@link Housekeeper}
     * @throws NullPointerException if {@code store} is null
     */
    public Housekeeper build() {
      return new Housekeeper(this);
    }
  }
}
