package com.ivamare.requestqueue.sequential;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers persisted requests one at a time, in the order they were queued.
 *
 * <p>A pass reads the pending requests and sends them in order. On success
 * the request is removed from the queue; on failure the retry middleware
 * records the failure and the pass ends, the next one starting after the
 * retry policy's backoff. Only one request is in flight at any time, so two
 * attempts of the same request never overlap.
 *
 * <p>Example:
 * <pre>
 * SequentialQueue sequentialQueue = SequentialQueue.builder()
 *     .queue(persistedRequestQueue)
 *     .dispatcher(dispatcher)
 *     .middlewareChain(chain)
 *     .retryPolicy(RetryPolicy.defaultPolicy())
 *     .build();
 *
 * sequentialQueue.start();
 * // ... later
 * sequentialQueue.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface SequentialQueue {

    /**
     * Start draining the queue in the background.
     */
    void start();

    /**
     * Stop gracefully, letting the in-flight request finish within the timeout.
     *
     * @param timeout Maximum time to wait for the in-flight request
     * @return Future that completes when the queue has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop immediately without waiting.
     */
    void stopNow();

    /**
     * @return true if started and not stopping
     */
    boolean isRunning();

    /**
     * @return true while a request is in flight
     */
    boolean isDraining();

    /**
     * Request a drain pass as soon as possible, skipping any pending backoff.
     */
    void flush();

    /**
     * Run one drain pass on the calling thread.
     *
     * @return number of requests attempted
     */
    int drainOnce();

    /**
     * @return number of requests waiting in the persisted request queue
     */
    int pendingCount();

    /**
     * @return consecutive storage errors since the last successful pass
     */
    int getConsecutiveErrorCount();

    /**
     * Create a new sequential queue builder.
     *
     * @return new builder instance
     */
    static SequentialQueueBuilder builder() {
        return new SequentialQueueBuilder();
    }
}
