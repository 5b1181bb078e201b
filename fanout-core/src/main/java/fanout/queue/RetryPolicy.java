package fanout.queue;

/**
 * Strategy for computing the delay before retrying a failed delivery attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param failedAttempts number of attempts that have failed so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int failedAttempts);
}
