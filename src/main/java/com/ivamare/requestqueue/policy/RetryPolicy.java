package com.ivamare.requestqueue.policy;

import java.util.List;

/**
 * Policy for retrying persisted requests.
 *
 * @param maxRetries Number of failures after which a persisted request is abandoned
 * @param backoffSchedule Delay in seconds before the next drain pass, indexed by retry count
 */
public record RetryPolicy(
    int maxRetries,
    List<Integer> backoffSchedule
) {
    private static final int FALLBACK_BACKOFF_SECONDS = 30;

    /**
     * Creates a RetryPolicy with immutable backoff schedule.
     */
    public RetryPolicy {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive, got: " + maxRetries);
        }
        backoffSchedule = List.copyOf(backoffSchedule);
    }

    /**
     * Default retry policy: 10 retries with backoff [1, 5, 15, 30, 60].
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(10, List.of(1, 5, 15, 30, 60));
    }

    /**
     * Get the delay before retrying a request that has failed {@code retryCount} times.
     *
     * @param retryCount failures so far
     * @return delay in seconds
     */
    public int getBackoff(int retryCount) {
        if (backoffSchedule.isEmpty()) {
            return FALLBACK_BACKOFF_SECONDS;
        }
        int index = Math.max(retryCount - 1, 0);
        if (index < backoffSchedule.size()) {
            return backoffSchedule.get(index);
        }
        // Use last value for counts beyond schedule
        return backoffSchedule.get(backoffSchedule.size() - 1);
    }

    /**
     * Check whether a request with this many failures must be given up.
     *
     * @param retryCount failures so far
     * @return true if the request is exhausted
     */
    public boolean isExhausted(int retryCount) {
        return retryCount >= maxRetries;
    }
}
