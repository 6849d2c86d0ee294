package logsink.buffer;

import logsink.retry.ExponentialBackoffRetryPolicy;
import logsink.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for the write buffer and its batch writer.
 *
 * <p>Create instances via {@link #builder()}; {@link #defaults()} returns the default settings.
 */
public final class BatchingOptions {
  private final int maxBatchSize;
  private final Duration maxWaitTime;
  private final int queueCapacity;
  private final OverflowPolicy overflowPolicy;
  private final int maxWriteAttempts;
  private final RetryPolicy retryPolicy;
  private final Duration shutdownTimeout;

  private BatchingOptions(Builder builder) {
    this.overflowPolicy = Objects.requireNonNull(builder.overflowPolicy, "overflowPolicy");
    this.maxWaitTime = Objects.requireNonNull(builder.maxWaitTime, "maxWaitTime");
    this.shutdownTimeout = Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(100, 2_000);

    if (builder.maxBatchSize <= 0) {
      throw new IllegalArgumentException("maxBatchSize must be > 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.maxWriteAttempts < 1) {
      throw new IllegalArgumentException("maxWriteAttempts must be >= 1");
    }
    if (maxWaitTime.isZero() || maxWaitTime.isNegative()) {
      throw new IllegalArgumentException("maxWaitTime must be positive");
    }
    if (shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("shutdownTimeout must be >= 0");
    }
    this.maxBatchSize = builder.maxBatchSize;
    this.queueCapacity = builder.queueCapacity;
    this.maxWriteAttempts = builder.maxWriteAttempts;
  }

  public static BatchingOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxBatchSize() {
    return maxBatchSize;
  }

  public Duration maxWaitTime() {
    return maxWaitTime;
  }

  public int queueCapacity() {
    return queueCapacity;
  }

  public OverflowPolicy overflowPolicy() {
    return overflowPolicy;
  }

  public int maxWriteAttempts() {
    return maxWriteAttempts;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public Duration shutdownTimeout() {
    return shutdownTimeout;
  }

  /** Builder for {@link BatchingOptions}. */
  public static final class Builder {
    private int maxBatchSize = 100;
    private Duration maxWaitTime = Duration.ofMillis(500);
    private int queueCapacity = 1000;
    private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_NEWEST;
    private int maxWriteAttempts = 3;
    private RetryPolicy retryPolicy;
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private Builder() {}

    /**
     * Sets the maximum number of entries inserted per transaction.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param maxBatchSize entries per batch
     * @return this builder
     */
    public Builder maxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
      return this;
    }

    /**
     * Sets how long a partial batch may wait, measured from its first entry, before
     * it is written.
     *
     * <p>Optional. Defaults to {@code 500 ms}. Must be positive.
     *
     * @param maxWaitTime maximum batch latency
     * @return this builder
     */
    public Builder maxWaitTime(Duration maxWaitTime) {
      this.maxWaitTime = maxWaitTime;
      return this;
    }

    /**
     * Sets the number of entries the buffer holds before the overflow policy applies.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity buffer capacity
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Optional. Defaults to {@link OverflowPolicy#DROP_NEWEST}.
     *
     * @param overflowPolicy behavior when the buffer is full
     * @return this builder
     */
    public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
      this.overflowPolicy = overflowPolicy;
      return this;
    }

    /**
     * Sets how many times a batch insert is attempted before the batch is dropped.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxWriteAttempts attempts per batch
     * @return this builder
     */
    public Builder maxWriteAttempts(int maxWriteAttempts) {
      this.maxWriteAttempts = maxWriteAttempts;
      return this;
    }

    /**
     * Optional. Defaults to exponential backoff from 100 ms, capped at 2 s.
     *
     * @param retryPolicy delay between insert attempts
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how long {@code close()} waits for buffered entries to be written.
     *
     * <p>Optional. Defaults to {@code 5 s}. Must be &ge; 0.
     *
     * @param shutdownTimeout drain timeout
     * @return this builder
     */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * @return new options
     * @throws IllegalArgumentException if a size or duration is out of range
     */
    public BatchingOptions build() {
      return new BatchingOptions(this);
    }
  }
}
