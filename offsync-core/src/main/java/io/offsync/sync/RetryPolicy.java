package io.offsync.sync;

/**
 * Strategy for computing the delay before retrying a failed sync operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of executions so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
