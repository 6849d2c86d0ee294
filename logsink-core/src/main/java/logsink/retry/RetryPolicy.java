package logsink.retry;

/**
 * Strategy for computing the delay before retrying a failed storage operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param failedAttempts attempts that have failed so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int failedAttempts);
}
