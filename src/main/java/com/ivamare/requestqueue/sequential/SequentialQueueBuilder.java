package com.ivamare.requestqueue.sequential;

import com.ivamare.requestqueue.RequestQueueProperties.ResilienceProperties;
import com.ivamare.requestqueue.middleware.MiddlewareChain;
import com.ivamare.requestqueue.network.RequestDispatcher;
import com.ivamare.requestqueue.policy.RetryPolicy;
import com.ivamare.requestqueue.queue.PersistedRequestQueue;
import com.ivamare.requestqueue.sequential.impl.DefaultSequentialQueue;

import java.util.function.BooleanSupplier;

/**
 * Builder for creating SequentialQueue instances.
 */
public class SequentialQueueBuilder {

    private PersistedRequestQueue queue;
    private RequestDispatcher dispatcher;
    private MiddlewareChain middlewareChain;
    private RetryPolicy retryPolicy;
    private long pollIntervalMs = 1000;
    private long requestTimeoutMs = 30000;
    private ResilienceProperties resilience;
    private BooleanSupplier offlineProbe = () -> false;

    /**
     * Set the persisted request queue to drain.
     *
     * @param queue The queue
     * @return this builder
     */
    public SequentialQueueBuilder queue(PersistedRequestQueue queue) {
        this.queue = queue;
        return this;
    }

    /**
     * Set the transport used to send requests.
     *
     * @param dispatcher The dispatcher
     * @return this builder
     */
    public SequentialQueueBuilder dispatcher(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        return this;
    }

    /**
     * Set the middleware applied to each attempt. Must contain the retry
     * middleware for failures to be counted.
     *
     * @param middlewareChain The middleware chain
     * @return this builder
     */
    public SequentialQueueBuilder middlewareChain(MiddlewareChain middlewareChain) {
        this.middlewareChain = middlewareChain;
        return this;
    }

    /**
     * Set the retry policy. Defaults to RetryPolicy.defaultPolicy().
     *
     * @param retryPolicy The retry policy
     * @return this builder
     */
    public SequentialQueueBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Set the idle poll interval. Default is 1000ms.
     *
     * @param pollIntervalMs Poll interval in milliseconds
     * @return this builder
     */
    public SequentialQueueBuilder pollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
        return this;
    }

    /**
     * Set the attempt timeout. Default is 30000ms.
     *
     * @param requestTimeoutMs Timeout in milliseconds
     * @return this builder
     */
    public SequentialQueueBuilder requestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
        return this;
    }

    /**
     * Set the storage error backoff settings.
     *
     * @param resilience The resilience properties
     * @return this builder
     */
    public SequentialQueueBuilder resilience(ResilienceProperties resilience) {
        this.resilience = resilience;
        return this;
    }

    /**
     * Set the probe consulted before each pass; passes are skipped while it
     * returns true. Defaults to always online.
     *
     * @param offlineProbe The offline probe
     * @return this builder
     */
    public SequentialQueueBuilder offlineProbe(BooleanSupplier offlineProbe) {
        this.offlineProbe = offlineProbe;
        return this;
    }

    /**
     * Build the sequential queue.
     *
     * @return configured SequentialQueue instance
     * @throws IllegalStateException if required fields are not set
     */
    public SequentialQueue build() {
        if (queue == null) {
            throw new IllegalStateException("queue is required");
        }
        if (dispatcher == null) {
            throw new IllegalStateException("dispatcher is required");
        }
        if (middlewareChain == null) {
            throw new IllegalStateException("middlewareChain is required");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalStateException("pollIntervalMs must be positive");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalStateException("requestTimeoutMs must be positive");
        }

        return new DefaultSequentialQueue(
            queue,
            dispatcher,
            middlewareChain,
            retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy(),
            pollIntervalMs,
            requestTimeoutMs,
            resilience != null ? resilience : new ResilienceProperties(),
            offlineProbe != null ? offlineProbe : () -> false
        );
    }
}
