package com.ivamare.requestqueue.queue;

import com.ivamare.requestqueue.model.Request;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Durable store of requests that must be retried until they succeed or
 * exhaust their retries.
 *
 * <p>Implementations must make {@link #incrementRetries(UUID)} and
 * {@link #remove(UUID)} atomic per identity; operations on an identity that
 * is not present are no-ops.
 */
public interface PersistedRequestQueue {

    /**
     * Add a queued request to the end of the queue.
     *
     * @param request the request (origin must be QUEUED)
     * @throws IllegalArgumentException if the request is interactive
     * @throws com.ivamare.requestqueue.exception.DuplicateRequestException if the identity is already queued
     */
    void enqueue(Request request);

    /**
     * Increment the retry count of a queued request.
     *
     * @param requestId identity of the request
     * @return the new retry count, or empty if the request is not queued
     */
    OptionalInt incrementRetries(UUID requestId);

    /**
     * Remove a request. Removing an absent identity does nothing.
     *
     * @param requestId identity of the request
     */
    void remove(UUID requestId);

    /**
     * List queued requests in the order they were enqueued.
     *
     * @return snapshot of pending requests with their current retry counts
     */
    List<Request> listPending();

    /**
     * Get a queued request by identity.
     *
     * @param requestId identity of the request
     * @return the request with its current retry count, if queued
     */
    Optional<Request> get(UUID requestId);

    /**
     * Number of queued requests.
     */
    int size();

    /**
     * Remove every queued request.
     */
    void clear();
}
