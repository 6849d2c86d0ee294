package logsink.buffer;

import logsink.LogEntry;
import logsink.spi.MetricsExporter;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded FIFO between producer threads and the {@link BatchWriter}.
 *
 * <p>An entry is <em>pending</em> from the moment it is accepted until the writer reports
 * it written or abandoned; {@link #awaitDrained(Duration)} waits for the pending count
 * to reach zero. When the buffer is full the {@link OverflowPolicy} decides whether the
 * producer waits or the entry is discarded and counted.
 *
 * <p>This class is thread-safe.
 */
public final class WriteBuffer {
  private static final long OFFER_SLICE_MS = 50;

  private final BlockingQueue<LogEntry> queue;
  private final OverflowPolicy overflowPolicy;
  private final MetricsExporter metrics;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicLong pending = new AtomicLong();
  private final AtomicLong discarded = new AtomicLong();
  private final AtomicInteger drainWaiters = new AtomicInteger();
  private final ReentrantLock drainLock = new ReentrantLock();
  private final Condition drained = drainLock.newCondition();
  private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();

  public WriteBuffer(int capacity, OverflowPolicy overflowPolicy, MetricsExporter metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public WriteBuffer(BatchingOptions options, MetricsExporter metrics) {
    this(options.queueCapacity(), options.overflowPolicy(), metrics);
  }

  /**
   * Offers an entry.
   *
   * @param entry the entry
   * @return {@code true} if accepted, {@code false} if discarded
   * @throws IllegalStateException if the buffer has been closed
   */
  public boolean enqueue(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    boolean accepted;
    // held across the check and the offer so close() cannot slip in between
    Lock offerLock = closeLock.readLock();
    offerLock.lock();
    try {
      if (!accepting.get()) {
        throw new IllegalStateException("WriteBuffer has been closed");
      }
      pending.incrementAndGet();
      if (overflowPolicy == OverflowPolicy.BLOCK) {
        accepted = offerBlocking(entry);
      } else {
        accepted = queue.offer(entry);
      }
    } finally {
      offerLock.unlock();
    }
    if (accepted) {
      metrics.incrementAccepted();
    } else {
      discarded.incrementAndGet();
      metrics.incrementDiscarded();
      completed(1);
    }
    metrics.recordQueueDepth(queue.size());
    return accepted;
  }

  private boolean offerBlocking(LogEntry entry) {
    try {
      while (accepting.get()) {
        if (queue.offer(entry, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
          return true;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return false;
  }

  /**
   * Takes the oldest entry, waiting up to {@code timeout}.
   *
   * @return the entry, or {@code null} if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  public LogEntry poll(long timeout, TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }

  /**
   * Moves up to {@code maxEntries} queued entries into {@code target} without waiting.
   *
   * @return number of entries moved
   */
  public int drainTo(Collection<? super LogEntry> target, int maxEntries) {
    return queue.drainTo(target, maxEntries);
  }

  /**
   * Reports {@code count} entries as written or abandoned.
   */
  public void completed(int count) {
    if (pending.addAndGet(-count) <= 0) {
      drainLock.lock();
      try {
        drained.signalAll();
      } finally {
        drainLock.unlock();
      }
    }
  }

  /**
   * Waits until every accepted entry has been written or abandoned.
   *
   * @param timeout maximum wait
   * @return {@code true} if drained, {@code false} on timeout or interrupt
   */
  public boolean awaitDrained(Duration timeout) {
    long nanos = timeout.toNanos();
    drainWaiters.incrementAndGet();
    drainLock.lock();
    try {
      while (pending.get() > 0) {
        if (nanos <= 0L) {
          return false;
        }
        nanos = drained.awaitNanos(nanos);
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      drainLock.unlock();
      drainWaiters.decrementAndGet();
    }
  }

  /**
   * Whether a caller is waiting in {@link #awaitDrained}. The writer stops waiting
   * for a full batch while this is true.
   */
  public boolean drainRequested() {
    return drainWaiters.get() > 0;
  }

  /**
   * Stops accepting entries and releases producers blocked on a full buffer.
   * Entries already queued remain available to {@link #poll}. On return, every entry
   * that a producer was told was accepted is in the queue.
   */
  public void close() {
    accepting.set(false);
    // waits out offers that passed the accepting check; blocked producers notice the
    // flag within one offer slice
    Lock barrier = closeLock.writeLock();
    barrier.lock();
    barrier.unlock();
  }

  public boolean isClosed() {
    return !accepting.get();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  /** Entries currently queued. */
  public int size() {
    return queue.size();
  }

  /** Entries accepted but not yet written or abandoned. */
  public long pendingCount() {
    return Math.max(0L, pending.get());
  }

  public long discardedCount() {
    return discarded.get();
  }

  /**
   * Resets the discard counter.
   *
   * @return the count before the reset
   */
  public long resetDiscardedCount() {
    return discarded.getAndSet(0L);
  }
}
