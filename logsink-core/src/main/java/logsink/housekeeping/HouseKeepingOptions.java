package logsink.housekeeping;

import logsink.retry.ExponentialBackoffRetryPolicy;
import logsink.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retention settings.
 *
 * <p>A sweep deletes rows older than {@code maxAge} and then trims the table to
 * {@code maxRowCount} rows; either rule may be disabled by setting it to {@code null}.
 * Automatic mode requires at least one rule.
 */
public final class HouseKeepingOptions {
  private final HousekeepingMode mode;
  private final Duration maxAge;
  private final Long maxRowCount;
  private final Duration sweepInterval;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;

  private HouseKeepingOptions(Builder builder) {
    this.mode = Objects.requireNonNull(builder.mode, "mode");
    this.sweepInterval = Objects.requireNonNull(builder.sweepInterval, "sweepInterval");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(100, 2_000);

    if (builder.maxAge != null && (builder.maxAge.isZero() || builder.maxAge.isNegative())) {
      throw new IllegalArgumentException("maxAge must be positive");
    }
    if (builder.maxRowCount != null && builder.maxRowCount < 0) {
      throw new IllegalArgumentException("maxRowCount must be >= 0");
    }
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      throw new IllegalArgumentException("sweepInterval must be positive");
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (mode == HousekeepingMode.AUTOMATIC && builder.maxAge == null && builder.maxRowCount == null) {
      throw new IllegalArgumentException("AUTOMATIC mode requires maxAge or maxRowCount");
    }
    this.maxAge = builder.maxAge;
    this.maxRowCount = builder.maxRowCount;
    this.maxAttempts = builder.maxAttempts;
  }

  public static HouseKeepingOptions defaults() {
    return builder().build();
  }

  /** Manual mode with the default retention rules, applied only by {@code runOnce()}. */
  public static HouseKeepingOptions manual() {
    return builder().mode(HousekeepingMode.MANUAL).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public HousekeepingMode mode() {
    return mode;
  }

  /** Maximum row age, or {@code null} if rows never expire by age. */
  public Duration maxAge() {
    return maxAge;
  }

  /** Maximum number of rows kept, or {@code null} for no cap. */
  public Long maxRowCount() {
    return maxRowCount;
  }

  public Duration sweepInterval() {
    return sweepInterval;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /** Builder for {@link HouseKeepingOptions}. */
  public static final class Builder {
    private HousekeepingMode mode = HousekeepingMode.AUTOMATIC;
    private Duration maxAge = Duration.ofDays(30);
    private Long maxRowCount;
    private Duration sweepInterval = Duration.ofHours(1);
    private int maxAttempts = 3;
    private RetryPolicy retryPolicy;

    private Builder() {}

    /**
     * Optional. Defaults to {@link HousekeepingMode#AUTOMATIC}.
     */
    public Builder mode(HousekeepingMode mode) {
      this.mode = mode;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30 days}; {@code null} disables age-based deletion.
     */
    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    /**
     * Optional. Defaults to {@code null} (no cap).
     */
    public Builder maxRowCount(Long maxRowCount) {
      this.maxRowCount = maxRowCount;
      return this;
    }

    /**
     * Sets the delay between the end of one automatic sweep and the start of the next.
     * The first sweep runs immediately on start.
     *
     * <p>Optional. Defaults to {@code 1 hour}.
     */
    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
      return this;
    }

    /**
     * Optional. Defaults to {@code 3}. Applies to every delete statement.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public HouseKeepingOptions build() {
      return new HouseKeepingOptions(this);
    }
  }
}
