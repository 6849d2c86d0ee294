package logsink.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with jitter.
 *
 * <p>Delay: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, multiplied by
 * a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    if (failedAttempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (failedAttempts >= 31 || (1L << (failedAttempts - 1)) > maxDelayMs / baseDelayMs) {
      expDelay = maxDelayMs;
    } else {
      expDelay = baseDelayMs * (1L << (failedAttempts - 1));
    }
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (expDelay * jitter)));
  }
}
