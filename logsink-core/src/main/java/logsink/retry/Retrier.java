package logsink.retry;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a storage operation up to {@code maxAttempts} times, sleeping between attempts
 * as directed by a {@link RetryPolicy}. The last failure is rethrown once attempts are
 * exhausted, when the waiting thread is interrupted, or when {@code abort} reports true.
 */
public final class Retrier {
  private static final Logger logger = Logger.getLogger(Retrier.class.getName());

  private final RetryPolicy policy;
  private final int maxAttempts;
  private final BooleanSupplier abort;

  public Retrier(RetryPolicy policy, int maxAttempts) {
    this(policy, maxAttempts, () -> false);
  }

  public Retrier(RetryPolicy policy, int maxAttempts, BooleanSupplier abort) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.abort = Objects.requireNonNull(abort, "abort");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Executes {@code operation}.
   *
   * @param action      short description used in log records
   * @param operation   the operation to run
   * @param beforeRetry invoked once before each retry
   * @return the operation's result
   * @throws RuntimeException the last failure of {@code operation}
   */
  public <T> T execute(String action, Supplier<T> operation, Runnable beforeRetry) {
    RuntimeException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return operation.get();
      } catch (RuntimeException e) {
        last = e;
      }
      if (attempt == maxAttempts || abort.getAsBoolean()) {
        break;
      }
      long delayMs = policy.computeDelayMs(attempt);
      logger.log(Level.WARNING, "Failed to " + action + " (attempt " + attempt + "/" + maxAttempts
          + "), retrying in " + delayMs + " ms", last);
      try {
        Thread.sleep(delayMs);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        break;
      }
      beforeRetry.run();
    }
    throw last;
  }
}
