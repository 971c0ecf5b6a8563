package com.ivamare.requestqueue.diagnostics;

import com.ivamare.requestqueue.model.Request;

/**
 * Receives diagnostic records about failed requests.
 *
 * <p>Records are observational. Implementations should not block; callers
 * guard against exceptions thrown from here.
 */
public interface RequestDiagnostics {

    /**
     * A queued request failed and its retry count was incremented.
     */
    void persistedRequestFailed(Request request, int retryCount, String reason);

    /**
     * A queued request reached the retry limit and was removed from the queue.
     */
    void persistedRequestAbandoned(Request request, int retryCount, String reason);

    /**
     * An interactive request failed and its caller received the offline response.
     */
    void interactiveRequestFailed(Request request, Throwable error);

    /**
     * The request that ships logs to the server failed. Must stay local.
     */
    void logRequestFailed(Request request, Throwable error);

    /**
     * The persisted request queue failed while recording a retry or removal.
     *
     * @param operation the queue operation, e.g. "incrementRetries"
     * @param request the request being handled
     * @param cause the storage error
     */
    void storageFault(String operation, Request request, RuntimeException cause);
}
